package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * An expression evaluated for its side effects.
 *
 * @param expression The expression.
 */
public record ExpressionStatementNode(Expression expression) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
