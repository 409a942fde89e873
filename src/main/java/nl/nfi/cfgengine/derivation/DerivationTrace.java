package nl.nfi.cfgengine.derivation;

import nl.nfi.cfgengine.grammar.Nonterminal;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Ordered derivation steps from the start symbol to a terminal sentential form.
 * Generation and grammar recognition both produce traces made only of
 * {@link DerivationStep.Rewrite} steps. A trace holding a {@link DerivationStep.Counted}
 * step is synthetic: it witnesses membership but is not a derivation.
 */
public record DerivationTrace(List<DerivationStep> steps) {

    public DerivationTrace {
        steps = List.copyOf(requireNonNull(steps, "steps"));
    }

    public static DerivationTrace of(final List<? extends DerivationStep> steps) {
        return new DerivationTrace(List.copyOf(steps));
    }

    public static DerivationTrace counted(final int n) {
        return new DerivationTrace(List.of(new DerivationStep.Counted(n)));
    }

    public int size() {
        return steps.size();
    }

    public DerivationStep stepAt(final int index) {
        return steps.get(index);
    }

    public boolean isSynthetic() {
        return steps.stream().anyMatch(step -> step instanceof DerivationStep.Counted);
    }

    public List<DerivationStep.Rewrite> rewrites() {
        if (isSynthetic()) {
            throw new IllegalStateException("Synthetic trace has no rewrite steps: " + this);
        }
        return steps.stream().map(DerivationStep.Rewrite.class::cast).toList();
    }

    /**
     * Applies the steps to {@code start}, returning every sentential form passed
     * through, the initial one included.
     */
    public List<SententialForm> replay(final Nonterminal start) {
        final List<SententialForm> forms = new ArrayList<>(steps.size() + 1);
        SententialForm form = SententialForm.of(start);
        forms.add(form);
        for (final DerivationStep.Rewrite step : rewrites()) {
            if (step.position() >= form.size() || !step.nonterminal().equals(form.symbolAt(step.position()))) {
                throw new IllegalStateException("Step %s does not apply to %s".formatted(step, form));
            }
            form = form.expand(step.position(), step.production());
            forms.add(form);
        }
        return forms;
    }
}
