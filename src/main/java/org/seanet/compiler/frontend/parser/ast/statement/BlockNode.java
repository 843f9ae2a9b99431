package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * A braced list of statements.
 *
 * @param statements The statements in order.
 */
public record BlockNode(List<Statement> statements) implements Statement {

    public BlockNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(statements);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
