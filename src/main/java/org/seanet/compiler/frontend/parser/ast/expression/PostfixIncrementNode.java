package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.lexer.TokenType;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

/**
 * A postfix increment or decrement of a variable: {@code i++} or {@code i--}.
 *
 * @param name The variable name.
 * @param operator The {@code ++} or {@code --} token.
 */
public record PostfixIncrementNode(Token name, Token operator) implements Expression {

    /**
     * @return true for {@code i--}.
     */
    public boolean isDecrement() {
        return operator.type() == TokenType.MINUS_MINUS;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
