package nl.nfi.cfgengine.generate;

import nl.nfi.cfgengine.derivation.DerivationTrace;
import nl.nfi.cfgengine.derivation.SententialForm;
import nl.nfi.cfgengine.grammar.Nonterminal;

import java.util.Optional;

// outcome of a single random derivation, failures are values, not exceptions
public sealed interface GenerationResult permits
        GenerationResult.Generated,
        GenerationResult.DepthExceeded,
        GenerationResult.LengthExceeded,
        GenerationResult.NoAlternatives {

    DerivationTrace trace();

    default boolean isGenerated() {
        return this instanceof Generated;
    }

    default Optional<String> value() {
        if (this instanceof Generated generated) {
            return Optional.of(generated.string());
        }
        return Optional.empty();
    }

    record Generated(String string, DerivationTrace trace) implements GenerationResult {
    }

    // the expansion did not terminate within maxDepth steps
    record DepthExceeded(int maxDepth, SententialForm form, DerivationTrace trace) implements GenerationResult {
    }

    // the sentential form holds more than maxLength terminals
    record LengthExceeded(int maxLength, SententialForm form, DerivationTrace trace) implements GenerationResult {
    }

    // the leftmost nonterminal has no productions, so the grammar derives nothing from here
    record NoAlternatives(Nonterminal nonterminal, SententialForm form, DerivationTrace trace) implements GenerationResult {
    }
}
