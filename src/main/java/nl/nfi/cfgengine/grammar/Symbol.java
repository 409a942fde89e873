package nl.nfi.cfgengine.grammar;

// a grammar symbol, either a terminal token or a nonterminal placeholder
public sealed interface Symbol permits Terminal, Nonterminal {

    String value();

    default boolean isTerminal() {
        return this instanceof Terminal;
    }
}
