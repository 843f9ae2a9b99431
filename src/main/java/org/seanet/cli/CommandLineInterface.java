package org.seanet.cli;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.seanet.cli.config.CompilerSettings;
import org.seanet.cli.config.ConfigLoader;
import org.seanet.cli.config.LoggingConfigurator;
import org.seanet.compiler.Compiler;
import org.seanet.compiler.api.CompilationException;
import org.seanet.compiler.api.OutputKind;
import org.seanet.compiler.backend.ManifestCodeGenerator;
import org.seanet.compiler.diagnostics.Diagnostic;
import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;
import org.seanet.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * The {@code snc} command: compiles one Seanet source file into an executable or a library.
 */
@Command(
    name = "snc",
    version = "Seanet compiler 0.1.0",
    description = "Compiles a Seanet source file.",
    sortOptions = false
)
public class CommandLineInterface implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineInterface.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-i", "--input-file"}, required = true, paramLabel = "<file>",
            description = "The source file to compile.")
    private Path inputFile;

    @Option(names = {"-o", "--output-file"}, required = true, paramLabel = "<file>",
            description = "The artifact to write.")
    private Path outputFile;

    @Option(names = {"-l", "--library"},
            description = "Produce a library instead of an executable.")
    private boolean library;

    @Option(names = {"-c", "--config"}, paramLabel = "<file>",
            description = "Path to a configuration file (default: seanet.conf in the working directory).")
    private File configFile;

    @Option(names = "--dump-ast",
            description = "Print the parsed AST to standard output.")
    private boolean dumpAst;

    @Option(names = {"-h", "--help"}, usageHelp = true,
            description = "Show this help message and exit.")
    private boolean helpRequested;

    @Option(names = {"-v", "--version"}, versionHelp = true,
            description = "Print version information and exit.")
    private boolean versionRequested;

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new CommandLineInterface()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final CompilerSettings settings;
        try {
            final Config config = ConfigLoader.load(configFile);
            LoggingConfigurator.configure(config);
            settings = CompilerSettings.fromConfig(config);
        } catch (ConfigException e) {
            LOG.error("Failed to load configuration: {}", e.getMessage());
            err.println("Failed to load configuration: " + e.getMessage());
            return 1;
        }

        final OutputKind kind = library ? OutputKind.LIBRARY : settings.outputKind();
        final Compiler compiler = new Compiler(new ManifestCodeGenerator(settings.launcherSettingsFile()));

        try {
            final ProgramNode program = compiler.compile(inputFile, outputFile, kind);
            if (dumpAst || settings.dumpAst()) {
                out.println(AstPrinter.print(program));
            }
            LOG.info("Wrote {} {}", kind == OutputKind.LIBRARY ? "library" : "executable", outputFile);
            return 0;
        } catch (CompilationException e) {
            for (Diagnostic diagnostic : e.getDiagnostics()) {
                err.println(diagnostic);
            }
            LOG.error("Compilation of {} failed with {} error(s)", inputFile, e.getDiagnostics().size());
            return 1;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            LOG.error("Compilation of {} failed: {}", inputFile, e.toString());
            return 1;
        }
    }
}
