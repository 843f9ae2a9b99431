package org.seanet.cli;

import org.seanet.cli.config.LoggingConfigurator;
import org.seanet.junit.extensions.logging.AllowLog;
import org.seanet.junit.extensions.logging.ExpectLog;
import org.seanet.junit.extensions.logging.LogLevel;
import org.seanet.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the {@code snc} command in-process and checks exit codes and console output.
 */
@Tag("integration")
@ExtendWith(LogWatchExtension.class)
class CommandLineInterfaceTest {

    private static final String VALID_SOURCE = "int main() { return 1 + 2; }";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path writeSource(String name, String source) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, source, StandardCharsets.UTF_8);
        return file;
    }

    /**
     * Verifies that a valid program is compiled into an executable and its launcher settings.
     */
    @Test
    @AllowLog(level = LogLevel.INFO, loggerPattern = "org\\.seanet\\.cli\\..*", messagePattern = "Wrote executable .*")
    void compilesExecutable() throws IOException {
        // Arrange
        Path input = writeSource("main.sn", VALID_SOURCE);
        Path output = tempDir.resolve("out/main.exe");

        // Act
        int exitCode = run("-i", input.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(tempDir.resolve("out/seanet.txt")).hasContent("main.exe");
        assertThat(err.toString()).isEmpty();
    }

    /**
     * Verifies that --library writes no launcher settings.
     */
    @Test
    @AllowLog(level = LogLevel.INFO, messagePattern = "Wrote library .*")
    void compilesLibrary() throws IOException {
        // Arrange
        Path input = writeSource("lib.sn", "int square(int x) { return x * x; }");
        Path output = tempDir.resolve("lib.snl");

        // Act
        int exitCode = run("--input-file", input.toString(), "--output-file", output.toString(), "--library");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(output).exists();
        assertThat(tempDir.resolve("seanet.txt")).doesNotExist();
    }

    /**
     * Verifies that --dump-ast prints the tree to standard output.
     */
    @Test
    @AllowLog(level = LogLevel.INFO, messagePattern = "Wrote executable .*")
    void dumpsAst() throws IOException {
        // Arrange
        Path input = writeSource("main.sn", VALID_SOURCE);

        // Act
        int exitCode = run("-i", input.toString(), "-o", tempDir.resolve("main.exe").toString(), "--dump-ast");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).contains("(function int main () (block (return (+ 1 2))))");
    }

    /**
     * Verifies that the dump-ast setting from a configuration file has the same effect as the flag.
     */
    @Test
    @AllowLog(level = LogLevel.INFO, messagePattern = "Wrote executable .*")
    void readsSettingsFromConfigFile() throws IOException {
        // Arrange
        Path input = writeSource("main.sn", VALID_SOURCE);
        Path config = writeSource("custom.conf", "seanet.compiler { dump-ast = true, launcher-settings-file = \"run.txt\" }");

        // Act
        int exitCode = run("-i", input.toString(), "-o", tempDir.resolve("main.exe").toString(), "-c", config.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("(program");
        assertThat(tempDir.resolve("run.txt")).hasContent("main.exe");
    }

    /**
     * Verifies that diagnostics are printed to standard error and the exit code signals failure.
     */
    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Compilation of .* failed with 1 error\\(s\\)")
    void reportsSyntaxError() throws IOException {
        // Arrange
        Path input = writeSource("broken.sn", "int main() { return 1 }");
        Path output = tempDir.resolve("broken.exe");

        // Act
        int exitCode = run("-i", input.toString(), "-o", output.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Parse error at " + input + ":1,");
        assertThat(output).doesNotExist();
    }

    /**
     * Verifies that a missing input file is reported as an I/O error.
     */
    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Compilation of .* failed: .*")
    void reportsMissingInput() {
        // Act
        int exitCode = run("-i", tempDir.resolve("missing.sn").toString(), "-o", tempDir.resolve("x.exe").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("I/O error: ");
    }

    /**
     * Verifies that an explicit configuration file must exist.
     */
    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Failed to load configuration: .*")
    void rejectsMissingConfigFile() throws IOException {
        // Arrange
        Path input = writeSource("main.sn", VALID_SOURCE);

        // Act
        int exitCode = run("-i", input.toString(), "-o", tempDir.resolve("main.exe").toString(),
                "-c", tempDir.resolve("absent.conf").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).startsWith("Failed to load configuration: ");
    }

    /**
     * Verifies that a missing required option is a usage error.
     */
    @Test
    void rejectsMissingOutputOption() {
        // Act
        int exitCode = run("-i", "main.sn");

        // Assert
        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--output-file");
    }

    /**
     * Verifies the help and version options.
     */
    @Test
    void printsHelpAndVersion() {
        // Act
        int helpExitCode = run("--help");
        int versionExitCode = run("-v");

        // Assert
        assertThat(helpExitCode).isZero();
        assertThat(versionExitCode).isZero();
        assertThat(out.toString()).contains("Usage: snc").contains("--dump-ast").contains("Seanet compiler 0.1.0");
    }

    /**
     * Verifies that input nested too deeply for the parser is reported as a diagnostic, not a crash.
     */
    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "Compilation of .* failed with 1 error\\(s\\)")
    void reportsExcessiveNesting() throws IOException {
        // Arrange
        Path input = writeSource("deep.sn", "int main() { return " + "(".repeat(1000) + "1" + ")".repeat(1000) + "; }");

        // Act
        int exitCode = run("-i", input.toString(), "-o", tempDir.resolve("deep.exe").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Expression nested too deeply.");
    }
}
