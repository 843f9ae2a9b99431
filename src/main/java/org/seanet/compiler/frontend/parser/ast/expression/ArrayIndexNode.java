package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * Reads an element of an array, e.g. {@code a[i]}.
 *
 * @param array The expression producing the array.
 * @param bracket The opening bracket, used for positions.
 * @param index The index expression.
 */
public record ArrayIndexNode(Expression array, Token bracket, Expression index) implements Expression {

    @Override
    public List<AstNode> getChildren() {
        return List.of(array, index);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
