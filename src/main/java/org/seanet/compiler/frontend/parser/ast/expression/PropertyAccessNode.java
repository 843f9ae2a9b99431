package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * Reads a property of an object, e.g. {@code p.x}.
 *
 * @param object The expression producing the object.
 * @param property The property name.
 */
public record PropertyAccessNode(Expression object, Token property) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(object);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
