package nl.nfi.cfgengine.recognize;

import nl.nfi.cfgengine.derivation.DerivationTrace;

import java.util.Objects;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

public final class MembershipResult {

    public enum Verdict {
        MEMBER,
        NOT_MEMBER
    }

    private static final MembershipResult NOT_MEMBER = new MembershipResult(Verdict.NOT_MEMBER, null);

    private final Verdict verdict;
    private final DerivationTrace trace;

    private MembershipResult(final Verdict verdict, final DerivationTrace trace) {
        this.verdict = verdict;
        this.trace = trace;
    }

    public static MembershipResult member(final DerivationTrace trace) {
        return new MembershipResult(Verdict.MEMBER, requireNonNull(trace, "trace"));
    }

    public static MembershipResult notMember() {
        return NOT_MEMBER;
    }

    public Verdict verdict() {
        return verdict;
    }

    public boolean isMember() {
        return verdict == Verdict.MEMBER;
    }

    // present iff member
    public Optional<DerivationTrace> trace() {
        return Optional.ofNullable(trace);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MembershipResult other)) {
            return false;
        }
        return verdict == other.verdict && Objects.equals(trace, other.trace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(verdict, trace);
    }

    @Override
    public String toString() {
        return trace == null ? verdict.name() : verdict + " " + trace.steps();
    }
}
