package nl.nfi.cfgengine.recognize;

import nl.nfi.cfgengine.derivation.DerivationStep;
import nl.nfi.cfgengine.grammar.Grammar;
import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.grammar.Production;
import nl.nfi.cfgengine.grammar.Symbol;
import nl.nfi.cfgengine.grammar.Terminal;

import java.util.List;
import java.util.Map;

// table over spans (start, length) of the input:
//      derived[start][length][nonterminal] = whether the nonterminal derives the span
// spans are filled by increasing length, so a span only depends on shorter spans
// and on facts about itself, which are iterated to a fixpoint
final class RecognitionChart {

    private final Grammar grammar;
    private final Map<Nonterminal, Integer> indices;
    private final List<Production> productions;
    private final List<String> tokens;
    private final boolean[][][] derived;

    private int derivedEntryCount = 0;

    private RecognitionChart(final Grammar grammar, final Map<Nonterminal, Integer> indices, final List<Production> productions, final List<String> tokens) {
        this.grammar = grammar;
        this.indices = indices;
        this.productions = productions;
        this.tokens = tokens;

        final int n = tokens.size();
        this.derived = new boolean[n + 1][][];
        for (int start = 0; start <= n; start++) {
            derived[start] = new boolean[n - start + 1][indices.size()];
        }
    }

    static RecognitionChart fill(final Grammar grammar, final Map<Nonterminal, Integer> indices, final List<Production> productions, final List<String> tokens) {
        final RecognitionChart chart = new RecognitionChart(grammar, indices, productions, tokens);
        final int n = tokens.size();
        for (int length = 0; length <= n; length++) {
            for (int start = 0; start + length <= n; start++) {
                chart.fillSpan(start, length);
            }
        }
        return chart;
    }

    private void fillSpan(final int start, final int length) {
        final boolean[] span = derived[start][length];
        boolean changed;
        do {
            changed = false;
            for (final Production production : productions) {
                final int lhs = indices.get(production.lhs());
                if (!span[lhs] && matches(production.rhs(), start, length)) {
                    span[lhs] = true;
                    derivedEntryCount++;
                    changed = true;
                }
            }
        } while (changed);
    }

    // sweeps the set of reachable end offsets over the right-hand side, trying every split point;
    // the last symbol has to cover the rest of the span
    private boolean matches(final List<Symbol> rhs, final int start, final int length) {
        if (rhs.isEmpty()) {
            return length == 0;
        }
        boolean[] reachable = new boolean[length + 1];
        reachable[0] = true;

        final int last = rhs.size() - 1;
        for (int index = 0; index < last; index++) {
            final Symbol symbol = rhs.get(index);
            final boolean[] next = new boolean[length + 1];
            boolean any = false;
            for (int offset = 0; offset <= length; offset++) {
                if (!reachable[offset]) {
                    continue;
                }
                for (int pieceLength = 0; offset + pieceLength <= length; pieceLength++) {
                    if (!next[offset + pieceLength] && derives(symbol, start + offset, pieceLength)) {
                        next[offset + pieceLength] = true;
                        any = true;
                    }
                }
            }
            if (!any) {
                return false;
            }
            reachable = next;
        }

        for (int offset = 0; offset <= length; offset++) {
            if (reachable[offset] && derives(rhs.get(last), start + offset, length - offset)) {
                return true;
            }
        }
        return false;
    }

    private boolean derives(final Symbol symbol, final int pieceStart, final int pieceLength) {
        if (symbol instanceof Terminal terminal) {
            return pieceLength == 1 && tokens.get(pieceStart).equals(terminal.token());
        }
        return derived[pieceStart][pieceLength][indices.get((Nonterminal) symbol)];
    }

    boolean derivesInput(final Nonterminal nonterminal) {
        return derived[0][tokens.size()][indices.get(nonterminal)];
    }

    int derivedEntryCount() {
        return derivedEntryCount;
    }

    /**
     * Rebuilds a leftmost derivation of the whole input. At each nonterminal the
     * first production in declared order is taken, with the first split point
     * (earliest lengths, left to right) that justifies the span. The only choices
     * skipped are those that would expand a nonterminal again on the same span
     * while it is already being expanded there, which would never end on cyclic
     * unit or ε rules.
     * <p>
     * Steps are emitted in pre-order, so every expanded nonterminal only has
     * terminals to its left and its position equals the start of its span.
     */
    void reconstruct(final Nonterminal nonterminal, final List<DerivationStep> steps) {
        if (!reconstruct(nonterminal, 0, tokens.size(), new boolean[indices.size()], steps)) {
            throw new IllegalStateException("No derivation of %s found for the input".formatted(nonterminal));
        }
    }

    // onPath: nonterminals currently being expanded on this same span
    private boolean reconstruct(final Nonterminal nonterminal, final int start, final int length, final boolean[] onPath, final List<DerivationStep> steps) {
        final int index = indices.get(nonterminal);
        if (!derived[start][length][index] || onPath[index]) {
            return false;
        }

        onPath[index] = true;
        try {
            for (final Production production : grammar.productionsOf(nonterminal)) {
                final boolean[][] completable = completable(production.rhs(), start, length);
                if (!completable[0][0]) {
                    continue;
                }
                final int mark = steps.size();
                steps.add(new DerivationStep.Rewrite(nonterminal, start, production));
                if (expand(production.rhs(), 0, 0, start, length, onPath, completable, steps)) {
                    return true;
                }
                truncate(steps, mark);
            }
            return false;
        } finally {
            onPath[index] = false;
        }
    }

    // picks the lengths of rhs symbols from index on, reconstructing each nonterminal as soon as its piece is chosen
    private boolean expand(final List<Symbol> rhs, final int index, final int offset, final int start, final int length, final boolean[] onPath, final boolean[][] completable, final List<DerivationStep> steps) {
        if (index == rhs.size()) {
            return offset == length;
        }
        final Symbol symbol = rhs.get(index);
        for (int pieceLength = 0; offset + pieceLength <= length; pieceLength++) {
            if (!completable[index + 1][offset + pieceLength] || !derives(symbol, start + offset, pieceLength)) {
                continue;
            }
            final int mark = steps.size();
            if (symbol instanceof Nonterminal child) {
                // a piece covering the whole span keeps the path, any shorter piece starts a new one
                final boolean[] childPath = pieceLength == length ? onPath : new boolean[indices.size()];
                if (!reconstruct(child, start + offset, pieceLength, childPath, steps)) {
                    continue;
                }
            }
            if (expand(rhs, index + 1, offset + pieceLength, start, length, onPath, completable, steps)) {
                return true;
            }
            truncate(steps, mark);
        }
        return false;
    }

    // completable[i][offset]: symbols i.. of rhs can derive the rest of the span from offset
    private boolean[][] completable(final List<Symbol> rhs, final int start, final int length) {
        final boolean[][] completable = new boolean[rhs.size() + 1][length + 1];
        completable[rhs.size()][length] = true;
        for (int index = rhs.size() - 1; index >= 0; index--) {
            for (int offset = 0; offset <= length; offset++) {
                if (index == rhs.size() - 1) {
                    completable[index][offset] = derives(rhs.get(index), start + offset, length - offset);
                    continue;
                }
                for (int pieceLength = 0; offset + pieceLength <= length; pieceLength++) {
                    if (completable[index + 1][offset + pieceLength] && derives(rhs.get(index), start + offset, pieceLength)) {
                        completable[index][offset] = true;
                        break;
                    }
                }
            }
        }
        return completable;
    }

    private static void truncate(final List<DerivationStep> steps, final int size) {
        steps.subList(size, steps.size()).clear();
    }
}
