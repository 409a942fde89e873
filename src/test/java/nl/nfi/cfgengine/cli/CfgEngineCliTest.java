package nl.nfi.cfgengine.cli;

import ch.qos.logback.classic.LoggerContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

import static java.nio.charset.StandardCharsets.US_ASCII;
import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;
import static nl.nfi.cfgengine.Grammars.TEST_RESOURCES_PATH;
import static org.assertj.core.api.Assertions.assertThat;

class CfgEngineCliTest {

    private static final String ANBN_PATH = TEST_RESOURCES_PATH.resolve("grammars/anbn.ini").toString();

    @TempDir
    Path tempWorkDir;

    @Test
    void generatesNumberedSamples() throws IOException {
        final Path output = tempWorkDir.resolve("samples.txt");

        final int exitCode = execute("--grammar", ANBN_PATH, "--count", "10", "--seed", "5", "--max_depth", "40", "--output", output.toString());

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        final List<String> lines = readAllLines(output, UTF_8);
        assertThat(lines).isNotEmpty().hasSizeLessThanOrEqualTo(10);
        for (int i = 0; i < lines.size(); i++) {
            assertThat(lines.get(i)).matches((i + 1) + "\\. '(ε|(a+b+))'");
        }
    }

    @Test
    void samplesAreReproducible() throws IOException {
        final Path first = tempWorkDir.resolve("first.txt");
        final Path second = tempWorkDir.resolve("second.txt");

        execute("--grammar", ANBN_PATH, "--seed", "11", "--output", first.toString());
        execute("--grammar", ANBN_PATH, "--seed", "11", "--output", second.toString());

        assertThat(readAllLines(first, UTF_8)).isEqualTo(readAllLines(second, UTF_8));
    }

    @Test
    void recognizesWithDerivations() throws IOException {
        final Path output = tempWorkDir.resolve("recognized.txt");

        final int exitCode = execute("--grammar", ANBN_PATH, "--mode", "recognize", "--output", output.toString(), "ab", "aab", "ε");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(readAllLines(output, UTF_8)).containsExactly(
                "'ab': ACCEPTED",
                "  S → aSb → ab",
                "'aab': REJECTED",
                "'ε': ACCEPTED",
                "  S → ε"
        );
    }

    @Test
    void recognizesCountingLanguageWithoutGrammar() throws IOException {
        final Path output = tempWorkDir.resolve("counted.txt");

        final int exitCode = execute("--mode", "RECOGNIZE_ABC", "--output", output.toString(), "aabbcc", "abccba");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
        assertThat(readAllLines(output, UTF_8)).containsExactly(
                "'aabbcc': ACCEPTED",
                "  n = 2 (membership witness, not a derivation)",
                "'abccba': REJECTED"
        );
    }

    @Test
    void requiresGrammarForGrammarModes() {
        assertThat(execute("--mode", "recognize", "ab")).isEqualTo(CommandLine.ExitCode.USAGE);
    }

    @Test
    void failsOnInvalidGrammar() {
        final String path = TEST_RESOURCES_PATH.resolve("grammars/undeclared.ini").toString();

        assertThat(execute("--grammar", path, "--output", tempWorkDir.resolve("out.txt").toString()))
                .isEqualTo(CommandLine.ExitCode.SOFTWARE);
    }

    @Test
    void writesUtf8ToStandardOutput() {
        final PrintStream standardOutput = System.out;
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        System.setOut(new PrintStream(captured, true, US_ASCII));
        try {
            assertThat(execute("--grammar", ANBN_PATH, "--mode", "recognize", "ε")).isEqualTo(CommandLine.ExitCode.OK);
        } finally {
            System.setOut(standardOutput);
        }

        assertThat(captured.toString(UTF_8).lines()).containsExactly(
                "'ε': ACCEPTED",
                "  S → ε"
        );
    }

    @Test
    void writesLogFileToLogDirectory() throws IOException {
        final Path logDirectory = tempWorkDir.resolve("logs");
        final Path output = tempWorkDir.resolve("recognized.txt");

        try {
            final int exitCode = execute("--grammar", ANBN_PATH, "--mode", "recognize", "--log_directory_path", logDirectory.toString(), "--output", output.toString(), "aabb");

            assertThat(exitCode).isEqualTo(CommandLine.ExitCode.OK);
            final Path logFile = logDirectory.resolve("cfg_engine.log");
            assertThat(logFile).exists();
            assertThat(readAllLines(logFile, UTF_8)).anyMatch(line -> line.contains("Filled chart for 4 tokens"));
        } finally {
            System.clearProperty("LOG_DIRECTORY_PATH");
            ((LoggerContext) LoggerFactory.getILoggerFactory()).reset();
        }
    }

    private static int execute(final String... args) {
        return new CommandLine(new CfgEngineCli()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
    }
}
