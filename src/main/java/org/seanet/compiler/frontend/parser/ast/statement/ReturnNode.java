package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;

import java.util.List;

/**
 * {@code return value;}
 *
 * @param keyword The {@code return} token.
 * @param value The returned expression.
 */
public record ReturnNode(Token keyword, Expression value) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(value);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
