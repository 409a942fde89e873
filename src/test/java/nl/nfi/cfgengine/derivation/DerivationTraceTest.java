package nl.nfi.cfgengine.derivation;

import nl.nfi.cfgengine.grammar.Production;
import org.junit.jupiter.api.Test;

import java.util.List;

import static nl.nfi.cfgengine.Grammars.A;
import static nl.nfi.cfgengine.Grammars.S;
import static nl.nfi.cfgengine.Grammars.t;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DerivationTraceTest {

    private static final Production WRAP = Production.of(S, t("a"), S, t("b"));
    private static final Production EMPTY = Production.epsilon(S);

    @Test
    void expandsSententialForms() {
        final SententialForm form = SententialForm.of(S).expand(0, WRAP);

        assertThat(form.symbols()).containsExactly(t("a"), S, t("b"));
        assertThat(form.leftmostNonterminal()).isEqualTo(1);
        assertThat(form.terminalCount()).isEqualTo(2);
        assertThat(form.isTerminal()).isFalse();

        final SententialForm terminal = form.expand(1, EMPTY);
        assertThat(terminal.isTerminal()).isTrue();
        assertThat(terminal.terminalString()).isEqualTo("ab");
        assertThat(terminal.toString()).isEqualTo("ab");
        assertThat(SententialForm.of().toString()).isEqualTo("ε");
    }

    @Test
    void rejectsExpansionOfWrongSymbol() {
        assertThatThrownBy(() -> SententialForm.of(t("a"), S).expand(0, WRAP))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void replaysRewriteSteps() {
        final DerivationTrace trace = DerivationTrace.of(List.of(
                new DerivationStep.Rewrite(S, 0, WRAP),
                new DerivationStep.Rewrite(S, 1, WRAP),
                new DerivationStep.Rewrite(S, 2, EMPTY)
        ));

        assertThat(trace.isSynthetic()).isFalse();
        assertThat(trace.replay(S))
                .extracting(SententialForm::toString)
                .containsExactly("S", "aSb", "aaSbb", "aabb");
    }

    @Test
    void rejectsStepsThatDoNotApply() {
        final DerivationTrace trace = DerivationTrace.of(List.of(
                new DerivationStep.Rewrite(S, 0, WRAP),
                new DerivationStep.Rewrite(S, 0, EMPTY)
        ));

        assertThatThrownBy(() -> trace.replay(S)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void countedTraceIsSyntheticAndCannotBeReplayed() {
        final DerivationTrace trace = DerivationTrace.counted(3);

        assertThat(trace.isSynthetic()).isTrue();
        assertThat(trace.steps()).containsExactly(new DerivationStep.Counted(3));
        assertThatThrownBy(trace::rewrites).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> trace.replay(S)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rewriteMustMatchProduction() {
        assertThatThrownBy(() -> new DerivationStep.Rewrite(A, 0, WRAP))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DerivationStep.Rewrite(S, -1, WRAP))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
