package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * A parenthesized expression.
 *
 * @param expression The inner expression.
 */
public record GroupingNode(Expression expression) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
