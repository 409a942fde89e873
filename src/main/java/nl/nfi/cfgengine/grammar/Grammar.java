package nl.nfi.cfgengine.grammar;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;
import static java.util.Collections.unmodifiableSet;

/**
 * A validated, immutable context-free grammar. Instances are only created by
 * {@link GrammarValidator}, so every nonterminal reachable from a right-hand side
 * has an entry in {@link #productions()}. Safe to share between threads.
 */
public final class Grammar {

    private final Nonterminal start;
    private final Set<Nonterminal> nonterminals;
    private final Set<String> terminals;
    private final Map<Nonterminal, List<Production>> productions;

    private Grammar(final Nonterminal start, final Set<Nonterminal> nonterminals, final Set<String> terminals, final Map<Nonterminal, List<Production>> productions) {
        this.start = start;
        this.nonterminals = nonterminals;
        this.terminals = terminals;
        this.productions = productions;
    }

    static Grammar frozenFrom(final GrammarDefinition definition) {
        final Map<Nonterminal, List<Production>> productions = new LinkedHashMap<>();
        // declared nonterminals without alternatives derive nothing, but still get an (empty) entry
        for (final Nonterminal nonterminal : definition.nonterminals()) {
            productions.put(nonterminal, List.copyOf(definition.productions().getOrDefault(nonterminal, List.of())));
        }
        return new Grammar(
                definition.start(),
                unmodifiableSet(new LinkedHashSet<>(definition.nonterminals())),
                unmodifiableSet(new LinkedHashSet<>(definition.terminals())),
                unmodifiableMap(productions)
        );
    }

    public Nonterminal start() {
        return start;
    }

    public Set<Nonterminal> nonterminals() {
        return nonterminals;
    }

    public Set<String> terminals() {
        return terminals;
    }

    public Map<Nonterminal, List<Production>> productions() {
        return productions;
    }

    // in declared order
    public List<Production> productionsOf(final Nonterminal nonterminal) {
        final List<Production> alternatives = productions.get(nonterminal);
        if (alternatives == null) {
            throw new IllegalStateException("No productions found for " + nonterminal);
        }
        return alternatives;
    }

    public List<Production> allProductions() {
        final List<Production> all = new ArrayList<>();
        productions.values().forEach(all::addAll);
        return all;
    }

    public int productionCount() {
        return productions.values().stream().mapToInt(List::size).sum();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        productions.forEach((lhs, alternatives) -> {
            if (alternatives.isEmpty()) {
                return;
            }
            builder.append(lhs).append(" → ");
            for (int i = 0; i < alternatives.size(); i++) {
                if (i > 0) {
                    builder.append(" | ");
                }
                builder.append(alternatives.get(i).formatRightSide());
            }
            builder.append('\n');
        });
        return builder.toString();
    }
}
