package nl.nfi.cfgengine.generate;

import nl.nfi.cfgengine.derivation.DerivationStep;
import nl.nfi.cfgengine.derivation.SententialForm;
import nl.nfi.cfgengine.grammar.Grammar;
import nl.nfi.cfgengine.grammar.GrammarDefinition;
import nl.nfi.cfgengine.grammar.GrammarException;
import nl.nfi.cfgengine.grammar.Production;
import nl.nfi.cfgengine.recognize.CfgRecognizer;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.stream.LongStream;
import java.util.stream.Stream;

import static nl.nfi.cfgengine.Grammars.S;
import static nl.nfi.cfgengine.Grammars.anbn;
import static nl.nfi.cfgengine.Grammars.load;
import static nl.nfi.cfgengine.Grammars.palindromes;
import static nl.nfi.cfgengine.Grammars.t;
import static nl.nfi.cfgengine.Grammars.unitCycle;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RandomDerivationTest {

    static Stream<Arguments> grammarsAndSeeds() {
        final Map<String, Grammar> grammars = new TreeMap<>(Map.of(
                "anbn", anbn(),
                "palindromes", palindromes(),
                "unit cycle", unitCycle(),
                "balanced", load("balanced.ini"),
                "expression", load("expression.ini")
        ));
        return grammars.entrySet().stream()
                .flatMap(entry -> LongStream.range(0, 25).mapToObj(seed -> Arguments.of(entry.getKey(), entry.getValue(), seed)));
    }

    @ParameterizedTest(name = "{0}, seed {2}")
    @MethodSource("grammarsAndSeeds")
    void generatedStringsAreMembers(final String name, final Grammar grammar, final long seed) {
        final GenerationResult result = RandomDerivation.init(grammar).maxDepth(30).generate(seed);

        if (result instanceof GenerationResult.Generated generated) {
            assertThat(CfgRecognizer.forGrammar(grammar).recognize(generated.string()).isMember())
                    .as("'%s' should be recognized", generated.string())
                    .isTrue();
        } else {
            assertThat(result).isInstanceOf(GenerationResult.DepthExceeded.class);
        }
    }

    @ParameterizedTest(name = "{0}, seed {2}")
    @MethodSource("grammarsAndSeeds")
    void generationIsDeterministic(final String name, final Grammar grammar, final long seed) {
        final RandomDerivation derivation = RandomDerivation.init(grammar).maxDepth(30);

        assertThat(derivation.generate(seed)).isEqualTo(derivation.generate(seed));
        assertThat(RandomDerivation.init(grammar).maxDepth(30).generate(new Random(seed)))
                .isEqualTo(derivation.generate(seed));
    }

    @ParameterizedTest(name = "{0}, seed {2}")
    @MethodSource("grammarsAndSeeds")
    void traceIsLeftmostAndReplaysToResult(final String name, final Grammar grammar, final long seed) {
        final GenerationResult result = RandomDerivation.init(grammar).maxDepth(30).generate(seed);

        final List<SententialForm> forms = result.trace().replay(grammar.start());
        final List<DerivationStep.Rewrite> steps = result.trace().rewrites();
        for (int i = 0; i < steps.size(); i++) {
            assertThat(steps.get(i).position()).isEqualTo(forms.get(i).leftmostNonterminal());
        }
        result.value().ifPresent(value -> {
            assertThat(forms.get(forms.size() - 1).isTerminal()).isTrue();
            assertThat(forms.get(forms.size() - 1).terminalString()).isEqualTo(value);
        });
    }

    @Test
    void anbnProducesMatchingRuns() {
        final RandomDerivation derivation = RandomDerivation.init(anbn()).maxDepth(50);

        for (long seed = 0; seed < 100; seed++) {
            final GenerationResult result = derivation.generate(seed);
            assertThat(result).isInstanceOf(GenerationResult.Generated.class);

            final String value = result.value().orElseThrow();
            final int n = value.length() / 2;
            assertThat(value).isEqualTo("a".repeat(n) + "b".repeat(n));
            // n wraps and a final ε
            assertThat(result.trace().size()).isEqualTo(n + 1);
        }
    }

    @Test
    void stopsAtMaxDepth() {
        final GenerationResult result = RandomDerivation.init(anbn()).maxDepth(0).generate(1);

        assertThat(result).isInstanceOf(GenerationResult.DepthExceeded.class);
        assertThat(((GenerationResult.DepthExceeded) result).form()).isEqualTo(SententialForm.of(S));
        assertThat(result.trace().steps()).isEmpty();
        assertThat(result.value()).isEmpty();
    }

    @Test
    void depthExceededKeepsPartialTrace() {
        // S -> a S never terminates
        final Grammar grammar = grammar(GrammarDefinition.empty()
                .start(S)
                .nonterminals(S)
                .terminals("a")
                .add(Production.of(S, t("a"), S)));

        final GenerationResult result = RandomDerivation.init(grammar).maxDepth(7).generate(3);

        assertThat(result).isInstanceOf(GenerationResult.DepthExceeded.class);
        assertThat(((GenerationResult.DepthExceeded) result).maxDepth()).isEqualTo(7);
        assertThat(result.trace().size()).isEqualTo(7);
        assertThat(((GenerationResult.DepthExceeded) result).form().toString()).isEqualTo("aaaaaaaS");
    }

    @Test
    void stopsAtMaxLength() {
        final Grammar grammar = grammar(GrammarDefinition.empty()
                .start(S)
                .nonterminals(S)
                .terminals("a")
                .add(Production.of(S, t("a"), t("a"))));

        final GenerationResult result = RandomDerivation.init(grammar).maxLength(1).generate(0);

        assertThat(result).isInstanceOf(GenerationResult.LengthExceeded.class);
        assertThat(RandomDerivation.init(grammar).maxLength(2).generate(0).value()).contains("aa");
    }

    @Test
    void reportsNonterminalWithoutAlternatives() {
        final Grammar grammar = grammar(GrammarDefinition.empty()
                .start(S)
                .nonterminals(S));

        final GenerationResult result = RandomDerivation.init(grammar).generate(0);

        assertThat(result).isInstanceOf(GenerationResult.NoAlternatives.class);
        assertThat(((GenerationResult.NoAlternatives) result).nonterminal()).isEqualTo(S);
    }

    @Test
    void choosesAlternativesUniformly() {
        final Grammar grammar = grammar(GrammarDefinition.empty()
                .start(S)
                .nonterminals(S)
                .terminals("a", "b", "c")
                .add(Production.of(S, t("a")))
                .add(Production.of(S, t("b")))
                .add(Production.of(S, t("c"))));
        final RandomDerivation derivation = RandomDerivation.init(grammar);
        final Random random = new Random(1234);

        final Map<String, Integer> counts = new TreeMap<>();
        final int draws = 30_000;
        for (int i = 0; i < draws; i++) {
            counts.merge(derivation.generate(random).value().orElseThrow(), 1, Integer::sum);
        }

        assertThat(counts).containsOnlyKeys("a", "b", "c");
        counts.values().forEach(count -> assertThat((double) count / draws).isCloseTo(1.0 / 3, within(0.02)));
    }

    @Test
    void sampleUsesConsecutiveSeeds() {
        final RandomDerivation derivation = RandomDerivation.init(load("balanced.ini")).maxDepth(12);

        final List<String> expected = new ArrayList<>();
        for (long seed = 100; seed < 110; seed++) {
            derivation.generate(seed).value().ifPresent(expected::add);
        }

        assertThat(derivation.sample(100, 10)).isEqualTo(expected);
    }

    @Test
    void rejectsNegativeBounds() {
        final RandomDerivation derivation = RandomDerivation.init(anbn());

        assertThatThrownBy(() -> derivation.maxDepth(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> derivation.maxLength(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static Grammar grammar(final GrammarDefinition definition) {
        try {
            return definition.validate();
        } catch (final GrammarException e) {
            throw new IllegalStateException(e);
        }
    }
}
