package nl.nfi.cfgengine.recognize;

import nl.nfi.cfgengine.derivation.DerivationTrace;

/**
 * Recognizes {@code a^n b^n c^n} for {@code n >= 0}. No context-free grammar
 * generates this language, so this is a direct run-length check rather than a
 * grammar driven parse.
 * <p>
 * A member's trace is synthetic: a single {@link nl.nfi.cfgengine.derivation.DerivationStep.Counted}
 * step holding {@code n}. It witnesses membership, it is not a derivation.
 */
public final class CountingRecognizer implements Recognizer {

    private static final char[] BLOCKS = {'a', 'b', 'c'};

    private static final CountingRecognizer INSTANCE = new CountingRecognizer();

    private CountingRecognizer() {
    }

    public static CountingRecognizer instance() {
        return INSTANCE;
    }

    @Override
    public MembershipResult recognize(final String input) {
        if (input.isEmpty()) {
            return MembershipResult.member(DerivationTrace.counted(0));
        }

        int position = 0;
        int n = -1;
        for (final char block : BLOCKS) {
            final int runStart = position;
            while (position < input.length() && input.charAt(position) == block) {
                position++;
            }
            final int runLength = position - runStart;
            if (runLength == 0) {
                return MembershipResult.notMember();
            }
            if (n >= 0 && runLength != n) {
                return MembershipResult.notMember();
            }
            n = runLength;
        }

        // trailing characters after the c run
        if (position != input.length()) {
            return MembershipResult.notMember();
        }
        return MembershipResult.member(DerivationTrace.counted(n));
    }
}
