package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * An arithmetic, bitwise, shift, relational or equality operation.
 * Short-circuiting {@code &&} and {@code ||} are {@link LogicalNode}s instead.
 *
 * @param left The left operand.
 * @param operator The operator token.
 * @param right The right operand.
 */
public record BinaryNode(Expression left, Token operator, Expression right) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
