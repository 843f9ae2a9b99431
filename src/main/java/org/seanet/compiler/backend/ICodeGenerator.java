package org.seanet.compiler.backend;

import org.seanet.compiler.api.OutputKind;
import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Turns a complete AST into an artifact on disk.
 */
public interface ICodeGenerator {

    /**
     * Generates the artifact for a program.
     *
     * @param program The program; it has been parsed without errors.
     * @param output The path of the artifact.
     * @param kind The kind of artifact to produce.
     * @throws IOException if the artifact cannot be written.
     */
    void generate(ProgramNode program, Path output, OutputKind kind) throws IOException;
}
