package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/**
 * An {@code if} statement with its {@code else if} chain and optional {@code else}.
 * <p>
 * The {@code else if} branches are kept flat in source order; each of them is an
 * {@code IfNode} with no branches of its own. The first branch whose condition holds runs,
 * {@code elseBranch} runs if none does.
 *
 * @param keyword The {@code if} token.
 * @param condition The condition.
 * @param thenBranch The block run when the condition holds.
 * @param elseIfs The {@code else if} branches in order.
 * @param elseBranch The {@code else} block, or null.
 */
public record IfNode(
        Token keyword,
        Expression condition,
        BlockNode thenBranch,
        List<IfNode> elseIfs,
        BlockNode elseBranch
) implements Statement {

    public IfNode {
        elseIfs = List.copyOf(elseIfs);
    }

    /**
     * @return true if the statement has a final {@code else} block.
     */
    public boolean hasElse() {
        return elseBranch != null;
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBranch);
        children.addAll(elseIfs);
        if (elseBranch != null) {
            children.add(elseBranch);
        }
        return children;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
