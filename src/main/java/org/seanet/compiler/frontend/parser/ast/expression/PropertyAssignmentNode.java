package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * An assignment to a property of an object, e.g. {@code p.x = 1}.
 *
 * @param object The expression producing the object.
 * @param property The property name.
 * @param operator The assignment operator token.
 * @param value The assigned expression.
 */
public record PropertyAssignmentNode(Expression object, Token property, Token operator, Expression value) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object, value);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
