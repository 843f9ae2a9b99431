package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * An assignment to a variable, plain or compound ({@code =}, {@code +=}, {@code -=}, {@code *=}, {@code /=}).
 *
 * @param name The name of the assigned variable.
 * @param operator The assignment operator token.
 * @param value The assigned expression.
 */
public record AssignmentNode(Token name, Token operator, Expression value) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
