package nl.nfi.cfgengine.generate;

import nl.nfi.cfgengine.derivation.DerivationStep;
import nl.nfi.cfgengine.derivation.DerivationTrace;
import nl.nfi.cfgengine.derivation.SententialForm;
import nl.nfi.cfgengine.grammar.Grammar;
import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

import static java.util.Collections.unmodifiableMap;
import static nl.nfi.cfgengine.generate.Samplers.buildSampler;

/**
 * Produces random strings of a grammar's language by leftmost expansion of the
 * start symbol. Nonterminals are always expanded left to right, only the choice
 * of production is random (weighted by {@link Production#weight()}, uniform by
 * default). The same grammar, bounds and seed always give the same string and
 * trace.
 * <p>
 * Instances are immutable and may be shared between threads; a {@link Random}
 * passed to {@link #generate(Random)} must not be shared.
 */
public final class RandomDerivation {

    private static final Logger LOG = LoggerFactory.getLogger(RandomDerivation.class);

    public static final int DEFAULT_MAX_DEPTH = 20;

    private final Grammar grammar;
    private final Map<Nonterminal, Function<Random, Production>> productionSamplers;
    private final int maxDepth;
    private final int maxLength;

    private RandomDerivation(final Grammar grammar, final Map<Nonterminal, Function<Random, Production>> productionSamplers, final int maxDepth, final int maxLength) {
        this.grammar = grammar;
        this.productionSamplers = productionSamplers;
        this.maxDepth = maxDepth;
        this.maxLength = maxLength;
    }

    public static RandomDerivation init(final Grammar grammar) {
        final Map<Nonterminal, Function<Random, Production>> samplers = new HashMap<>(grammar.nonterminals().size());
        grammar.productions().forEach((nonterminal, alternatives) -> {
            if (!alternatives.isEmpty()) {
                samplers.put(nonterminal, buildSampler(alternatives, Production::weight));
            }
        });
        return new RandomDerivation(grammar, unmodifiableMap(samplers), DEFAULT_MAX_DEPTH, 0);
    }

    // maximum number of rewrite steps
    public RandomDerivation maxDepth(final int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("Max depth must not be negative: %d".formatted(maxDepth));
        }
        return new RandomDerivation(grammar, productionSamplers, maxDepth, maxLength);
    }

    // maximum number of terminals, 0 means unbounded
    public RandomDerivation maxLength(final int maxLength) {
        if (maxLength < 0) {
            throw new IllegalArgumentException("Max length must not be negative: %d".formatted(maxLength));
        }
        return new RandomDerivation(grammar, productionSamplers, maxDepth, maxLength);
    }

    public GenerationResult generate(final long seed) {
        return generate(new Random(seed));
    }

    public GenerationResult generate(final Random random) {
        SententialForm form = SententialForm.of(grammar.start());
        final List<DerivationStep> steps = new ArrayList<>();
        int depth = 0;

        while (true) {
            final int position = form.leftmostNonterminal();
            if (position < 0) {
                return new GenerationResult.Generated(form.terminalString(), DerivationTrace.of(steps));
            }
            if (depth >= maxDepth) {
                return new GenerationResult.DepthExceeded(maxDepth, form, DerivationTrace.of(steps));
            }

            final Nonterminal nonterminal = (Nonterminal) form.symbolAt(position);
            final Function<Random, Production> sampler = productionSamplers.get(nonterminal);
            if (sampler == null) {
                return new GenerationResult.NoAlternatives(nonterminal, form, DerivationTrace.of(steps));
            }

            final Production production = sampler.apply(random);
            form = form.expand(position, production);
            steps.add(new DerivationStep.Rewrite(nonterminal, position, production));
            depth++;

            if (maxLength > 0 && form.terminalCount() > maxLength) {
                return new GenerationResult.LengthExceeded(maxLength, form, DerivationTrace.of(steps));
            }
        }
    }

    /**
     * Runs {@code count} generations with the distinct seeds {@code seed},
     * {@code seed + 1}, ... and returns the strings of the successful ones.
     */
    public List<String> sample(final long seed, final int count) {
        final List<String> samples = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            final GenerationResult result = generate(seed + i);
            if (result instanceof GenerationResult.Generated generated) {
                samples.add(generated.string());
            } else {
                LOG.debug("Discarding sample for seed {}: {}", seed + i, result.getClass().getSimpleName());
            }
        }
        LOG.debug("Sampled {} of {} strings (max depth {}, max length {})", samples.size(), count, maxDepth, maxLength);
        return samples;
    }
}
