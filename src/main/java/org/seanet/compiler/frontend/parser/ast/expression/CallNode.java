package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * A call of a function or function pointer.
 *
 * @param callee The called expression.
 * @param paren The opening parenthesis, used for positions.
 * @param arguments The arguments in order; by-reference arguments are
 *                  {@link VariableReferenceNode}s marked as references.
 */
public record CallNode(Expression callee, Token paren, List<Expression> arguments) implements Expression {

    public CallNode {
        arguments = List.copyOf(arguments);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(callee);
        children.addAll(arguments);
        return children;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
