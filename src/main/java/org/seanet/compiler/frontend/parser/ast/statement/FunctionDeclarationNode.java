package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * A top-level function.
 *
 * @param returnType The return type; {@code void} is a {@link TypeInfo.Named} of the void token.
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param body The function body.
 */
public record FunctionDeclarationNode(
        TypeInfo returnType,
        Token name,
        List<VariableDeclarationNode> parameters,
        BlockNode body
) implements Statement {

    public FunctionDeclarationNode {
        parameters = List.copyOf(parameters);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.add(body);
        return children;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
