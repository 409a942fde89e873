package nl.nfi.cfgengine.grammar;

import static java.util.Objects.requireNonNull;

public record Nonterminal(String name) implements Symbol {

    public Nonterminal {
        requireNonNull(name, "name");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Nonterminal name must not be empty");
        }
    }

    public static Nonterminal of(final String name) {
        return new Nonterminal(name);
    }

    @Override
    public String value() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
