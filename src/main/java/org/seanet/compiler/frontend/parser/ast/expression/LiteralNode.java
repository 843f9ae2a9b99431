package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

/**
 * An AST node that represents a literal: a number, a string, {@code true} or {@code false}.
 *
 * @param literal The literal token; its value was parsed by the lexer.
 */
public record LiteralNode(
        Token literal
) implements Expression {

    /**
     * Gets the value the lexer parsed for the literal.
     * @return The literal value.
     */
    public Object getValue() {
        return literal.value();
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    // This node has no children and inherits the empty list from getChildren().
}
