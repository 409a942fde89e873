package nl.nfi.cfgengine.grammar;

/**
 * A structural defect in a caller supplied grammar. A definition that fails
 * validation never becomes a {@link Grammar}.
 */
public final class GrammarException extends Exception {

    public enum Kind {
        UNDECLARED_NONTERMINAL,
        UNKNOWN_START_SYMBOL,
        UNDECLARED_TERMINAL,
        DUPLICATE_PRODUCTION
    }

    private final Kind kind;

    GrammarException(final Kind kind, final String message) {
        super(message);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
