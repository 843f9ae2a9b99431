package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.List;

/**
 * A top-level struct.
 *
 * @param name The struct name.
 * @param fields The fields in declaration order.
 */
public record StructDeclarationNode(Token name, List<VariableDeclarationNode> fields) implements Statement {

    public StructDeclarationNode {
        fields = List.copyOf(fields);
    }

    @Override
    public List<AstNode> getChildren() {
        return List.copyOf(fields);
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
