package nl.nfi.cfgengine.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;
import static java.util.Objects.requireNonNull;

/**
 * Unvalidated grammar under construction. Productions are kept exactly as added,
 * in order and without merging; {@link GrammarValidator#validate(GrammarDefinition)}
 * turns a definition into an immutable {@link Grammar}.
 */
public final class GrammarDefinition {

    private Nonterminal start;
    private final Set<Nonterminal> nonterminals;
    private final Set<String> terminals;
    private final Map<Nonterminal, List<Production>> productions;

    private GrammarDefinition() {
        this.nonterminals = new LinkedHashSet<>();
        this.terminals = new LinkedHashSet<>();
        this.productions = new LinkedHashMap<>();
    }

    public static GrammarDefinition empty() {
        return new GrammarDefinition();
    }

    public GrammarDefinition start(final Nonterminal start) {
        this.start = requireNonNull(start, "start");
        return this;
    }

    public GrammarDefinition nonterminals(final Nonterminal... nonterminals) {
        this.nonterminals.addAll(List.of(nonterminals));
        return this;
    }

    public GrammarDefinition terminals(final String... terminals) {
        for (final String terminal : terminals) {
            this.terminals.add(Terminal.of(terminal).token());
        }
        return this;
    }

    public GrammarDefinition add(final Production production) {
        requireNonNull(production, "production");
        productions.computeIfAbsent(production.lhs(), lhs -> new ArrayList<>()).add(production);
        return this;
    }

    public Nonterminal start() {
        return start;
    }

    public Set<Nonterminal> nonterminals() {
        return unmodifiableSet(nonterminals);
    }

    public Set<String> terminals() {
        return unmodifiableSet(terminals);
    }

    public Map<Nonterminal, List<Production>> productions() {
        return unmodifiableMap(productions);
    }

    public Grammar validate() throws GrammarException {
        return GrammarValidator.validate(this);
    }
}
