package nl.nfi.cfgengine.derivation;

import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.grammar.Production;

import static java.util.Objects.requireNonNull;

/**
 * One entry of a {@link DerivationTrace}.
 */
public sealed interface DerivationStep permits DerivationStep.Rewrite, DerivationStep.Counted {

    /**
     * Expansion of the nonterminal at {@code position} of the previous sentential
     * form by {@code production}.
     */
    record Rewrite(Nonterminal nonterminal, int position, Production production) implements DerivationStep {

        public Rewrite {
            requireNonNull(nonterminal, "nonterminal");
            requireNonNull(production, "production");
            if (position < 0) {
                throw new IllegalArgumentException("Negative position: %d".formatted(position));
            }
            if (!production.lhs().equals(nonterminal)) {
                throw new IllegalArgumentException("Production %s does not expand %s".formatted(production, nonterminal));
            }
        }

        @Override
        public String toString() {
            return "%s@%d: %s".formatted(nonterminal, position, production);
        }
    }

    /**
     * Synthetic witness produced by a counting recognizer: the input consists of
     * {@code n} repetitions of each block. This is not a grammar rewrite and cannot
     * be replayed as one.
     */
    record Counted(int n) implements DerivationStep {

        public Counted {
            if (n < 0) {
                throw new IllegalArgumentException("Negative count: %d".formatted(n));
            }
        }

        @Override
        public String toString() {
            return "n = " + n;
        }
    }
}
