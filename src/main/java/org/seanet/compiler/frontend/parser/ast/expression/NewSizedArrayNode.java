package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

import java.util.List;

/**
 * Allocates an array with explicit sizes, e.g. {@code new int[5][3]}.
 *
 * @param keyword The {@code new} token.
 * @param type The array type; one {@link TypeInfo.ArrayOf} level per size.
 * @param sizes The size expressions, outermost dimension first.
 */
public record NewSizedArrayNode(Token keyword, TypeInfo.ArrayOf type, List<Expression> sizes) implements Expression {

    public NewSizedArrayNode {
        sizes = List.copyOf(sizes);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(sizes);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
