package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * The root of the AST: the top-level function and struct declarations of one file.
 *
 * @param declarations The declarations in source order.
 */
public record ProgramNode(List<Statement> declarations) implements Statement {

    public ProgramNode {
        declarations = List.copyOf(declarations);
    }

    /**
     * Creates the program returned when parsing was aborted.
     * @return A program without declarations.
     */
    public static ProgramNode empty() {
        return new ProgramNode(List.of());
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(declarations);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
