package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

import java.util.List;

/**
 * A declaration with initializer, e.g. {@code int x = 1;} or {@code var x = 1;}.
 * For {@code var} the type is a {@link TypeInfo.Named} holding the {@code var} token.
 *
 * @param type The declared type.
 * @param name The variable name.
 * @param initializer The initial value.
 */
public record VariableDeclarationWithAssignmentNode(TypeInfo type, Token name, Expression initializer) implements Statement {

    @Override
    public List<AstNode> getChildren() {
        return List.of(initializer);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
