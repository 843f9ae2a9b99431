package org.seanet.compiler;

import org.seanet.compiler.api.CompilationException;
import org.seanet.compiler.api.ICompiler;
import org.seanet.compiler.api.OutputKind;
import org.seanet.compiler.backend.ICodeGenerator;
import org.seanet.compiler.backend.ManifestCodeGenerator;
import org.seanet.compiler.diagnostics.DiagnosticsEngine;
import org.seanet.compiler.frontend.lexer.Lexer;
import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.Parser;
import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * The main compiler implementation. This class orchestrates the pipeline from
 * source text through tokens and AST to the artifact written by the code generator.
 * <p>
 * Every call uses its own {@link DiagnosticsEngine}, so one instance may compile
 * several files in turn.
 */
public class Compiler implements ICompiler {

    private static final Logger LOG = LoggerFactory.getLogger(Compiler.class);

    private final ICodeGenerator codeGenerator;

    /**
     * Creates a compiler that writes manifests with the default launcher settings file.
     */
    public Compiler() {
        this(new ManifestCodeGenerator());
    }

    /**
     * Creates a compiler with a specific code generator.
     * @param codeGenerator The generator that receives the parsed program.
     */
    public Compiler(ICodeGenerator codeGenerator) {
        this.codeGenerator = codeGenerator;
    }

    @Override
    public ProgramNode parse(String source, String fileName) throws CompilationException {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();

        // Phase 2: Parsing. It also runs after lexical errors so the first syntax error is reported as well.
        ProgramNode program = new Parser(tokens, diagnostics, fileName).parse();

        if (diagnostics.hasErrors()) {
            throw new CompilationException(diagnostics.summary(), diagnostics.getDiagnostics());
        }
        return program;
    }

    @Override
    public ProgramNode compile(Path input, Path output, OutputKind kind) throws CompilationException, IOException {
        String source = Files.readString(input, StandardCharsets.UTF_8);
        ProgramNode program = parse(source, input.toString());
        LOG.debug("Generating {} {} from {}", kind, output, input);

        // Phase 3: Code generation
        codeGenerator.generate(program, output, kind);
        return program;
    }
}
