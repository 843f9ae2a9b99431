package org.seanet.compiler.frontend.parser.ast.statement;

import org.seanet.compiler.frontend.parser.ast.AstNode;

/**
 * A piece of syntax that can be run, but not evaluated.
 */
public sealed interface Statement extends AstNode permits
        ProgramNode, BlockNode, ExpressionStatementNode, VariableDeclarationNode,
        VariableDeclarationWithAssignmentNode, IfNode, WhileNode,
        FunctionDeclarationNode, StructDeclarationNode, ReturnNode, ReturnEmptyNode {
}
