package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * A {@code while} loop. {@code for} loops are desugared into this node by the parser.
 *
 * @param keyword The {@code while} token, or the {@code for} token of a desugared loop.
 * @param condition The loop condition.
 * @param body The loop body.
 */
public record WhileNode(Token keyword, Expression condition, BlockNode body) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, body);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
