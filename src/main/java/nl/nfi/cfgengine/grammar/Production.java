package nl.nfi.cfgengine.grammar;

import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

// a single alternative of a nonterminal, e.g.:
//      S -> a S b
//  where lhs = S, rhs = [a, S, b]
// an empty rhs is an ε-production
// weight is only used for random sampling, it is not part of the rule itself
public record Production(Nonterminal lhs, List<Symbol> rhs, double weight) {

    public static final String EPSILON = "ε";

    public Production {
        requireNonNull(lhs, "lhs");
        rhs = List.copyOf(requireNonNull(rhs, "rhs"));
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("Production weight must be positive and finite: %s".formatted(weight));
        }
    }

    public static Production of(final Nonterminal lhs, final Symbol... rhs) {
        return new Production(lhs, List.of(rhs), 1.0);
    }

    public static Production epsilon(final Nonterminal lhs) {
        return new Production(lhs, List.of(), 1.0);
    }

    public Production withWeight(final double weight) {
        return new Production(lhs, rhs, weight);
    }

    public boolean isEpsilon() {
        return rhs.isEmpty();
    }

    public int size() {
        return rhs.size();
    }

    public Symbol symbolAt(final int position) {
        return rhs.get(position);
    }

    // same rule, regardless of sampling weight
    public boolean sameRuleAs(final Production other) {
        return lhs.equals(other.lhs) && rhs.equals(other.rhs);
    }

    public String formatRightSide() {
        if (rhs.isEmpty()) {
            return EPSILON;
        }
        return rhs.stream().map(Symbol::value).collect(Collectors.joining(" "));
    }

    @Override
    public String toString() {
        return lhs + " → " + formatRightSide();
    }
}
