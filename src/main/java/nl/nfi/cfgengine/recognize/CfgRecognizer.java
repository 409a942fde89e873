package nl.nfi.cfgengine.recognize;

import nl.nfi.cfgengine.derivation.DerivationStep;
import nl.nfi.cfgengine.derivation.DerivationTrace;
import nl.nfi.cfgengine.grammar.Grammar;
import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.grammar.Production;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.unmodifiableMap;

/**
 * Decides membership in the language of a {@link Grammar} with a tabular parse
 * over all spans of the input, and rebuilds one leftmost derivation for members.
 * <p>
 * Works for any validated grammar, including ε-productions, unit productions,
 * cycles among them and right-hand sides of any length. The time taken is
 * polynomial in the input length. When a string has several derivations, the
 * returned one prefers productions in declared order, then the earliest split
 * points, so the result is deterministic.
 * <p>
 * Immutable and safe to share between threads.
 */
public final class CfgRecognizer implements Recognizer {

    private static final Logger LOG = LoggerFactory.getLogger(CfgRecognizer.class);

    private final Grammar grammar;
    private final Map<Nonterminal, Integer> indices;
    private final List<Production> productions;

    private CfgRecognizer(final Grammar grammar, final Map<Nonterminal, Integer> indices, final List<Production> productions) {
        this.grammar = grammar;
        this.indices = indices;
        this.productions = productions;
    }

    public static CfgRecognizer forGrammar(final Grammar grammar) {
        final Map<Nonterminal, Integer> indices = new HashMap<>();
        for (final Nonterminal nonterminal : grammar.nonterminals()) {
            indices.put(nonterminal, indices.size());
        }
        return new CfgRecognizer(grammar, unmodifiableMap(indices), List.copyOf(grammar.allProductions()));
    }

    public Grammar grammar() {
        return grammar;
    }

    // one token per code point
    @Override
    public MembershipResult recognize(final String input) {
        return recognize(input.codePoints().mapToObj(Character::toString).toList());
    }

    // for grammars with multi-character terminal tokens
    public MembershipResult recognize(final List<String> tokens) {
        for (final String token : tokens) {
            if (!grammar.terminals().contains(token)) {
                LOG.debug("Token '{}' is not in the terminal alphabet", token);
                return MembershipResult.notMember();
            }
        }

        final RecognitionChart chart = RecognitionChart.fill(grammar, indices, productions, tokens);
        LOG.debug("Filled chart for {} tokens: {} derived entries", tokens.size(), chart.derivedEntryCount());

        if (!chart.derivesInput(grammar.start())) {
            return MembershipResult.notMember();
        }

        final List<DerivationStep> steps = new ArrayList<>();
        chart.reconstruct(grammar.start(), steps);
        return MembershipResult.member(DerivationTrace.of(steps));
    }
}
