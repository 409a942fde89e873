package nl.nfi.cfgengine.cli;

import nl.nfi.cfgengine.common.logger.LoggerConfigurator;
import nl.nfi.cfgengine.grammar.Grammar;
import nl.nfi.cfgengine.grammar.GrammarLoader;
import nl.nfi.cfgengine.grammar.Nonterminal;
import nl.nfi.cfgengine.generate.RandomDerivation;
import nl.nfi.cfgengine.recognize.CfgRecognizer;
import nl.nfi.cfgengine.recognize.CountingRecognizer;
import nl.nfi.cfgengine.recognize.MembershipResult;
import nl.nfi.cfgengine.recognize.Recognizer;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.cfgengine.common.Formatting.displayString;
import static nl.nfi.cfgengine.common.Formatting.formatDerivation;
import static nl.nfi.cfgengine.grammar.Production.EPSILON;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;
import static picocli.CommandLine.Parameters;

@Command(name = "cfg_engine")
public class CfgEngineCli implements Callable<Integer> {

    @Option(names = {"--grammar"}, description = "INI file with the grammar definition")
    private String grammarPath;

    @Option(names = {"--mode"}, description = "Valid values: ${COMPLETION-CANDIDATES} (case insensitive)", defaultValue = "generate")
    private Mode mode;

    @Option(names = {"--count"}, description = "Number of strings to generate")
    private int count = 10;

    @Option(names = {"--seed"}, description = "Seed of the first generation, following ones use seed + 1, seed + 2, ...")
    private long seed = 0;

    @Option(names = {"--max_depth"}, description = "Maximum number of rewrite steps per generated string")
    private int maxDepth = RandomDerivation.DEFAULT_MAX_DEPTH;

    @Option(names = {"--max_length"}, description = "Discard generated strings longer than this (0 is unbounded)")
    private int maxLength = 0;

    @Option(names = {"--output"}, description = "The file to write the results to")
    private String outputPath = "-";

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    @Parameters(description = "Strings to test for membership, ε for the empty string")
    private List<String> inputs = new ArrayList<>();

    @Override
    public Integer call() throws Exception {
        if (logPath != null) {
            LoggerConfigurator.logTo(logPath);
        }

        if (mode != Mode.RECOGNIZE_ABC && grammarPath == null) {
            System.err.println("Missing required option: '--grammar' for mode " + mode.name().toLowerCase());
            return ExitCode.USAGE;
        }

        try {
            if (outputPath.equals("-")) {
                final PrintStream output = new PrintStream(System.out, false, UTF_8);
                run(output);
                output.flush();
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                run(output);
            }
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(CfgEngineCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private void run(final PrintStream output) throws Exception {
        switch (mode) {
            case GENERATE -> generate(loadGrammar(), output);
            case RECOGNIZE -> {
                final Grammar grammar = loadGrammar();
                recognize(CfgRecognizer.forGrammar(grammar), grammar.start(), output);
            }
            case RECOGNIZE_ABC -> recognize(CountingRecognizer.instance(), null, output);
        }
    }

    private Grammar loadGrammar() throws Exception {
        return GrammarLoader.loadFrom(Paths.get(grammarPath)).validate();
    }

    private void generate(final Grammar grammar, final PrintStream output) {
        final List<String> samples = RandomDerivation.init(grammar)
                .maxDepth(maxDepth)
                .maxLength(maxLength)
                .sample(seed, count);

        for (int i = 0; i < samples.size(); i++) {
            output.println("%d. '%s'".formatted(i + 1, displayString(samples.get(i))));
        }
    }

    private void recognize(final Recognizer recognizer, final Nonterminal start, final PrintStream output) {
        for (final String raw : inputs) {
            final String input = raw.equals(EPSILON) ? "" : raw;
            final MembershipResult result = recognizer.recognize(input);
            output.println("'%s': %s".formatted(displayString(input), result.isMember() ? "ACCEPTED" : "REJECTED"));
            result.trace().ifPresent(trace -> output.println("  " + formatDerivation(start, trace)));
        }
    }
}
