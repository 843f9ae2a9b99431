package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

/**
 * {@code return;}
 *
 * @param keyword The {@code return} token.
 */
public record ReturnEmptyNode(Token keyword) implements Statement {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
