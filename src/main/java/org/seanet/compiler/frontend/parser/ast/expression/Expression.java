package org.seanet.compiler.frontend.parser.ast.expression;

import org.seanet.compiler.frontend.parser.ast.AstNode;

/**
 * A piece of syntax that can be evaluated to a value.
 */
public sealed interface Expression extends AstNode permits
        LiteralNode, GroupingNode, PrefixUnaryNode, BinaryNode, LogicalNode,
        AssignmentNode, PropertyAssignmentNode, CallNode, PropertyAccessNode,
        VariableReferenceNode, PostfixIncrementNode, ArrayIndexNode,
        NewSizedArrayNode, NewStructNode {
}
