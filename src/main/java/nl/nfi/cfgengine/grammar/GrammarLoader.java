package nl.nfi.cfgengine.grammar;

import nl.nfi.cfgengine.common.ini.IniConfig;
import nl.nfi.cfgengine.common.ini.IniSection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static nl.nfi.cfgengine.grammar.Production.EPSILON;

/**
 * Reads a {@link GrammarDefinition} from an INI file, e.g.:
 * <pre>
 * [GRAMMAR]
 * start = S
 * nonterminals = ["S"]
 * terminals = ["a", "b"]
 *
 * [PRODUCTIONS]
 * S = ["a S b", "ε"]
 *
 * [WEIGHTS]
 * S = [1, 1]
 * </pre>
 * Right-hand side symbols are separated by spaces. A symbol is a nonterminal when
 * it is declared as one, otherwise it is a terminal. The {@code WEIGHTS} section is
 * optional. The result is not validated.
 */
public final class GrammarLoader {

    private static final Logger LOG = LoggerFactory.getLogger(GrammarLoader.class);

    private static final String GRAMMAR_SECTION = "GRAMMAR";
    private static final String PRODUCTIONS_SECTION = "PRODUCTIONS";
    private static final String WEIGHTS_SECTION = "WEIGHTS";

    private GrammarLoader() {
    }

    public static GrammarDefinition loadFrom(final Path path) throws IOException {
        final GrammarDefinition definition = fromConfig(IniConfig.loadFrom(path));
        LOG.info("Loaded grammar definition from {}: start {}, {} nonterminals", path, definition.start(), definition.nonterminals().size());
        return definition;
    }

    public static GrammarDefinition fromConfig(final IniConfig config) {
        final IniSection header = config.getSection(GRAMMAR_SECTION);

        final List<Nonterminal> nonterminals = header.getStringList("nonterminals").stream()
                .map(Nonterminal::of)
                .toList();
        final Set<String> declared = Set.copyOf(header.getStringList("nonterminals"));

        final GrammarDefinition definition = GrammarDefinition.empty()
                .start(Nonterminal.of(header.getString("start")))
                .nonterminals(nonterminals.toArray(Nonterminal[]::new))
                .terminals(header.getStringList("terminals").toArray(String[]::new));

        final IniSection productions = config.getSection(PRODUCTIONS_SECTION);
        final IniSection weights = config.hasSection(WEIGHTS_SECTION) ? config.getSection(WEIGHTS_SECTION) : null;

        for (final String name : productions.keys()) {
            final Nonterminal lhs = Nonterminal.of(name);
            final List<String> alternatives = productions.getStringList(name);

            List<Double> alternativeWeights = null;
            if (weights != null && weights.hasKey(name)) {
                alternativeWeights = weights.getDoubleList(name);
                if (alternativeWeights.size() != alternatives.size()) {
                    throw new IllegalArgumentException("Weight count (%d) does not match production count (%d) for %s".formatted(
                            alternativeWeights.size(), alternatives.size(), name));
                }
            }

            for (int i = 0; i < alternatives.size(); i++) {
                final double weight = alternativeWeights == null ? 1.0 : alternativeWeights.get(i);
                definition.add(new Production(lhs, parseRightSide(alternatives.get(i), declared), weight));
            }
        }
        return definition;
    }

    static List<Symbol> parseRightSide(final String text, final Set<String> nonterminals) {
        final String rightSide = text.strip();
        if (rightSide.isEmpty() || rightSide.equals(EPSILON)) {
            return List.of();
        }

        final List<Symbol> symbols = new ArrayList<>();
        for (final String part : rightSide.split(" +")) {
            if (nonterminals.contains(part)) {
                symbols.add(Nonterminal.of(part));
            } else {
                symbols.add(Terminal.of(part));
            }
        }
        return symbols;
    }
}
