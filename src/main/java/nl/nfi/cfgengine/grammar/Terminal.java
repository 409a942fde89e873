package nl.nfi.cfgengine.grammar;

import static java.util.Objects.requireNonNull;

// an atomic output token, e.g. 'a' in S -> a S b
public record Terminal(String token) implements Symbol {

    public Terminal {
        requireNonNull(token, "token");
        if (token.isEmpty()) {
            throw new IllegalArgumentException("Terminal token must not be empty, use an empty right-hand side for ε");
        }
    }

    public static Terminal of(final String token) {
        return new Terminal(token);
    }

    @Override
    public String value() {
        return token;
    }

    @Override
    public String toString() {
        return token;
    }
}
