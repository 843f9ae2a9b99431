package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * A prefix operator applied to an operand: {@code !x}, {@code -x}, {@code ~x}, {@code ++x}, {@code --x}.
 *
 * @param operator The operator token.
 * @param operand The operand.
 */
public record PrefixUnaryNode(Token operator, Expression operand) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
