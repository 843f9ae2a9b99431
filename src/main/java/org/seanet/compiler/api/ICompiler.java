package org.seanet.compiler.api;

import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Defines the public interface of the Seanet compiler.
 */
public interface ICompiler {

    /**
     * Scans and parses the given source code.
     *
     * @param source The complete source text.
     * @param fileName The name of the source file, used in diagnostics only.
     * @return The AST of the program.
     * @throws CompilationException if lexical or syntax errors were reported.
     */
    ProgramNode parse(String source, String fileName) throws CompilationException;

    /**
     * Compiles a source file into an artifact.
     *
     * @param input The source file, read as UTF-8.
     * @param output The path of the artifact to write.
     * @param kind Whether to produce an executable or a library.
     * @return The AST the artifact was generated from.
     * @throws CompilationException if errors occur during compilation.
     * @throws IOException if the source cannot be read or the artifact cannot be written.
     */
    ProgramNode compile(Path input, Path output, OutputKind kind) throws CompilationException, IOException;
}
