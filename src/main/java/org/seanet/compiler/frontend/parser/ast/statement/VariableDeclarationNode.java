package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

/**
 * A declaration without initializer. Also used for function parameters and struct fields.
 *
 * @param type The declared type.
 * @param name The variable name.
 */
public record VariableDeclarationNode(TypeInfo type, Token name) implements Statement {

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
