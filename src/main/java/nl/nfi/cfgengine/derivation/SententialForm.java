package nl.nfi.cfgengine.derivation;

import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.grammar.Production;
import nl.nfi.cfgengine.grammar.Symbol;
import nl.nfi.cfgengine.grammar.Terminal;

import java.util.ArrayList;
import java.util.List;

import static java.util.Objects.requireNonNull;
import static nl.nfi.cfgengine.grammar.Production.EPSILON;

// intermediate state of a derivation, e.g. a a S b b
public record SententialForm(List<Symbol> symbols) {

    public SententialForm {
        symbols = List.copyOf(requireNonNull(symbols, "symbols"));
    }

    public static SententialForm of(final Symbol... symbols) {
        return new SententialForm(List.of(symbols));
    }

    // -1 when the form is terminal
    public int leftmostNonterminal() {
        for (int position = 0; position < symbols.size(); position++) {
            if (symbols.get(position) instanceof Nonterminal) {
                return position;
            }
        }
        return -1;
    }

    public boolean isTerminal() {
        return leftmostNonterminal() < 0;
    }

    public int size() {
        return symbols.size();
    }

    public Symbol symbolAt(final int position) {
        return symbols.get(position);
    }

    public long terminalCount() {
        return symbols.stream().filter(Symbol::isTerminal).count();
    }

    // replaces the nonterminal at position by the right-hand side of production
    public SententialForm expand(final int position, final Production production) {
        if (!production.lhs().equals(symbols.get(position))) {
            throw new IllegalArgumentException("Cannot apply %s at position %d of %s".formatted(production, position, this));
        }
        final List<Symbol> expanded = new ArrayList<>(symbols.size() + production.size());
        expanded.addAll(symbols.subList(0, position));
        expanded.addAll(production.rhs());
        expanded.addAll(symbols.subList(position + 1, symbols.size()));
        return new SententialForm(expanded);
    }

    // concatenation of all terminal tokens, in order
    public String terminalString() {
        final StringBuilder builder = new StringBuilder();
        for (final Symbol symbol : symbols) {
            if (symbol instanceof Terminal terminal) {
                builder.append(terminal.token());
            }
        }
        return builder.toString();
    }

    @Override
    public String toString() {
        if (symbols.isEmpty()) {
            return EPSILON;
        }
        final StringBuilder builder = new StringBuilder();
        for (final Symbol symbol : symbols) {
            builder.append(symbol.value());
        }
        return builder.toString();
    }
}
