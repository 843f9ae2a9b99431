package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

/**
 * A reference to a variable by name.
 *
 * @param name The variable name.
 * @param isReference Whether the variable is passed by reference ({@code ref x} in call arguments).
 */
public record VariableReferenceNode(Token name, boolean isReference) implements Expression {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
