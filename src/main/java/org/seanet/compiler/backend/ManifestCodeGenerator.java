package org.seanet.compiler.backend;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.seanet.compiler.api.OutputKind;
import org.seanet.compiler.frontend.TreeWalker;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.statement.FunctionDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;
import org.seanet.compiler.frontend.parser.ast.statement.StructDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.VariableDeclarationNode;
import org.seanet.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A placeholder code generator that describes the program instead of translating it.
 * <p>
 * It writes a JSON manifest listing the top-level functions and structs. For executables
 * it also writes the launcher settings file next to the artifact; the launcher reads the
 * artifact name from it and starts the {@code main} function.
 */
public class ManifestCodeGenerator implements ICodeGenerator {

    /** The settings file name the launcher looks for by default. */
    public static final String DEFAULT_LAUNCHER_SETTINGS_FILE = "seanet.txt";
    static final String ENTRY_POINT = "main";

    private static final Logger LOG = LoggerFactory.getLogger(ManifestCodeGenerator.class);
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    private final String launcherSettingsFileName;

    /**
     * Creates a generator that writes {@value #DEFAULT_LAUNCHER_SETTINGS_FILE} for executables.
     */
    public ManifestCodeGenerator() {
        this(DEFAULT_LAUNCHER_SETTINGS_FILE);
    }

    /**
     * Creates a generator with a custom launcher settings file name.
     * @param launcherSettingsFileName The file name, resolved against the artifact's directory.
     */
    public ManifestCodeGenerator(String launcherSettingsFileName) {
        this.launcherSettingsFileName = launcherSettingsFileName;
    }

    @Override
    public void generate(ProgramNode program, Path output, OutputKind kind) throws IOException {
        Path target = output.toAbsolutePath();
        Path directory = target.getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }

        Manifest manifest = describe(program, target.getFileName().toString(), kind);
        if (kind == OutputKind.EXECUTABLE
                && manifest.functions().stream().noneMatch(f -> f.name().equals(ENTRY_POINT))) {
            LOG.warn("Executable {} declares no '{}' function; the launcher will not find an entry point", target, ENTRY_POINT);
        }
        Files.writeString(target, GSON.toJson(manifest), StandardCharsets.UTF_8);

        if (kind == OutputKind.EXECUTABLE) {
            Path settings = directory == null ? Path.of(launcherSettingsFileName) : directory.resolve(launcherSettingsFileName);
            Files.writeString(settings, target.getFileName().toString(), StandardCharsets.UTF_8);
            LOG.debug("Wrote launcher settings {}", settings);
        }
    }

    /**
     * Collects the top-level declarations of a program.
     * @param program The program.
     * @param name The artifact name.
     * @param kind The artifact kind.
     * @return The manifest.
     */
    Manifest describe(ProgramNode program, String name, OutputKind kind) {
        List<FunctionEntry> functions = new ArrayList<>();
        List<StructEntry> structs = new ArrayList<>();

        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = Map.of(
                FunctionDeclarationNode.class, node -> {
                    FunctionDeclarationNode function = (FunctionDeclarationNode) node;
                    functions.add(new FunctionEntry(
                            function.name().text(),
                            AstPrinter.formatType(function.returnType()),
                            describeAll(function.parameters()),
                            function.name().line()));
                },
                StructDeclarationNode.class, node -> {
                    StructDeclarationNode struct = (StructDeclarationNode) node;
                    structs.add(new StructEntry(
                            struct.name().text(),
                            describeAll(struct.fields()),
                            struct.name().line()));
                });
        new TreeWalker(handlers).walk(program.declarations());

        return new Manifest(name, kind, kind == OutputKind.EXECUTABLE ? ENTRY_POINT : null, functions, structs);
    }

    private static List<String> describeAll(List<VariableDeclarationNode> declarations) {
        List<String> result = new ArrayList<>();
        for (VariableDeclarationNode declaration : declarations) {
            result.add(AstPrinter.formatType(declaration.type()) + " " + declaration.name().text());
        }
        return result;
    }

    /**
     * The JSON document written as the artifact.
     * @param name The artifact file name.
     * @param kind The artifact kind.
     * @param entryPoint The entry point function for executables, null for libraries.
     * @param functions The top-level functions in source order.
     * @param structs The structs in source order.
     */
    record Manifest(String name, OutputKind kind, String entryPoint, List<FunctionEntry> functions, List<StructEntry> structs) {}

    record FunctionEntry(String name, String returnType, List<String> parameters, int line) {}

    record StructEntry(String name, List<String> fields, int line) {}
}
