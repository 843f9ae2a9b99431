package org.seanet.compiler.frontend;

import org.seanet.compiler.frontend.parser.ast.AstNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that a phase only names the node types it is interested in.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from AST node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of AST nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single AST node and all of its descendants, parents before children.
     * The traversal keeps its own stack, so the depth of the tree is not limited by the thread's stack.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        Deque<AstNode> pending = new ArrayDeque<>();
        push(pending, node);
        while (!pending.isEmpty()) {
            AstNode next = pending.pop();
            handlers.getOrDefault(next.getClass(), n -> {}).accept(next);

            List<AstNode> children = next.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                push(pending, children.get(i));
            }
        }
    }

    private static void push(Deque<AstNode> pending, AstNode node) {
        if (node != null) {
            pending.push(node);
        }
    }
}
