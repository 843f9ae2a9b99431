package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * A short-circuiting {@code &&} or {@code ||}. The right operand is only evaluated when
 * the left one does not decide the result.
 *
 * @param left The left operand.
 * @param operator The {@code &&} or {@code ||} token.
 * @param right The right operand.
 */
public record LogicalNode(Expression left, Token operator, Expression right) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
