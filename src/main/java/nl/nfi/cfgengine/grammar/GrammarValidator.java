package nl.nfi.cfgengine.grammar;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static nl.nfi.cfgengine.grammar.GrammarException.Kind.DUPLICATE_PRODUCTION;
import static nl.nfi.cfgengine.grammar.GrammarException.Kind.UNDECLARED_NONTERMINAL;
import static nl.nfi.cfgengine.grammar.GrammarException.Kind.UNDECLARED_TERMINAL;
import static nl.nfi.cfgengine.grammar.GrammarException.Kind.UNKNOWN_START_SYMBOL;

public final class GrammarValidator {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarValidator.class);

    private GrammarValidator() {
    }

    /**
     * Checks the structural invariants of a definition and freezes it.
     * <ul>
     *     <li>the start symbol is a declared nonterminal</li>
     *     <li>every production's left-hand side is declared</li>
     *     <li>every nonterminal on a right-hand side has a production entry</li>
     *     <li>every terminal on a right-hand side is declared</li>
     *     <li>no left-hand side has the same right-hand side twice</li>
     * </ul>
     */
    public static Grammar validate(final GrammarDefinition definition) throws GrammarException {
        final Nonterminal start = definition.start();
        if (start == null) {
            throw fail(UNKNOWN_START_SYMBOL, "Grammar has no start symbol");
        }
        if (!definition.nonterminals().contains(start)) {
            throw fail(UNKNOWN_START_SYMBOL, "Start symbol %s is not a declared nonterminal".formatted(start));
        }

        final Map<Nonterminal, List<Production>> productions = definition.productions();
        for (final Map.Entry<Nonterminal, List<Production>> entry : productions.entrySet()) {
            final Nonterminal lhs = entry.getKey();
            if (!definition.nonterminals().contains(lhs)) {
                throw fail(UNDECLARED_NONTERMINAL, "Productions given for undeclared nonterminal %s".formatted(lhs));
            }

            final List<Production> alternatives = entry.getValue();
            for (int i = 0; i < alternatives.size(); i++) {
                final Production production = alternatives.get(i);
                for (final Symbol symbol : production.rhs()) {
                    if (symbol instanceof Nonterminal nonterminal && !productions.containsKey(nonterminal)) {
                        throw fail(UNDECLARED_NONTERMINAL, "Production %s references %s, which has no productions".formatted(production, nonterminal));
                    }
                    if (symbol instanceof Terminal terminal && !definition.terminals().contains(terminal.token())) {
                        throw fail(UNDECLARED_TERMINAL, "Production %s uses undeclared terminal '%s'".formatted(production, terminal));
                    }
                }
                for (int j = 0; j < i; j++) {
                    if (alternatives.get(j).sameRuleAs(production)) {
                        throw fail(DUPLICATE_PRODUCTION, "Production %s is declared more than once".formatted(production));
                    }
                }
            }
        }

        final Grammar grammar = Grammar.frozenFrom(definition);
        LOG.debug("Validated grammar: start {}, {} nonterminals, {} terminals, {} productions",
                start, grammar.nonterminals().size(), grammar.terminals().size(), grammar.productionCount());
        return grammar;
    }

    private static GrammarException fail(final GrammarException.Kind kind, final String message) {
        LOG.debug("Grammar rejected ({}): {}", kind, message);
        return new GrammarException(kind, message);
    }
}
