package nl.nfi.cfgengine.common;

import nl.nfi.cfgengine.derivation.DerivationStep;
import nl.nfi.cfgengine.derivation.DerivationTrace;
import nl.nfi.cfgengine.derivation.SententialForm;
import nl.nfi.cfgengine.grammar.Nonterminal;

import java.util.List;
import java.util.stream.Collectors;

import static nl.nfi.cfgengine.grammar.Production.EPSILON;

public final class Formatting {

    private Formatting() {
    }

    // the empty string is shown as ε
    public static String displayString(final String value) {
        return value.isEmpty() ? EPSILON : value;
    }

    // S → aSb → aaSbb → aabb
    public static String formatDerivation(final Nonterminal start, final DerivationTrace trace) {
        if (trace.isSynthetic()) {
            final DerivationStep.Counted counted = (DerivationStep.Counted) trace.steps().stream()
                    .filter(DerivationStep.Counted.class::isInstance)
                    .findFirst()
                    .orElseThrow();
            return "n = %d (membership witness, not a derivation)".formatted(counted.n());
        }
        final List<SententialForm> forms = trace.replay(start);
        return forms.stream().map(SententialForm::toString).collect(Collectors.joining(" → "));
    }
}
