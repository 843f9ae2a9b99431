package org.seanet.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * The node set is closed: see {@link org.seanet.compiler.frontend.parser.ast.expression.Expression}
 * and {@link org.seanet.compiler.frontend.parser.ast.statement.Statement}.
 */
public interface AstNode {
    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Dispatches to the {@link AstVisitor} method for the concrete node type.
     *
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <T> T accept(AstVisitor<T> visitor);
}
