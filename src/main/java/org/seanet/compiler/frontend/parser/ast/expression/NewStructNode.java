package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

/**
 * Allocates a struct through its argument-less constructor: {@code new Point()}.
 *
 * @param keyword The {@code new} token.
 * @param type The struct type.
 */
public record NewStructNode(Token keyword, TypeInfo.Named type) implements Expression {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
