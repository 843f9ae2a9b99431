package org.seanet.compiler.frontend.parser.ast;

import org.seanet.compiler.frontend.parser.ast.expression.ArrayIndexNode;
import org.seanet.compiler.frontend.parser.ast.expression.AssignmentNode;
import org.seanet.compiler.frontend.parser.ast.expression.BinaryNode;
import org.seanet.compiler.frontend.parser.ast.expression.CallNode;
import org.seanet.compiler.frontend.parser.ast.expression.GroupingNode;
import org.seanet.compiler.frontend.parser.ast.expression.LiteralNode;
import org.seanet.compiler.frontend.parser.ast.expression.LogicalNode;
import org.seanet.compiler.frontend.parser.ast.expression.NewSizedArrayNode;
import org.seanet.compiler.frontend.parser.ast.expression.NewStructNode;
import org.seanet.compiler.frontend.parser.ast.expression.PostfixIncrementNode;
import org.seanet.compiler.frontend.parser.ast.expression.PrefixUnaryNode;
import org.seanet.compiler.frontend.parser.ast.expression.PropertyAccessNode;
import org.seanet.compiler.frontend.parser.ast.expression.PropertyAssignmentNode;
import org.seanet.compiler.frontend.parser.ast.expression.VariableReferenceNode;
import org.seanet.compiler.frontend.parser.ast.statement.BlockNode;
import org.seanet.compiler.frontend.parser.ast.statement.ExpressionStatementNode;
import org.seanet.compiler.frontend.parser.ast.statement.FunctionDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.IfNode;
import org.seanet.compiler.frontend.parser.ast.statement.ProgramNode;
import org.seanet.compiler.frontend.parser.ast.statement.ReturnEmptyNode;
import org.seanet.compiler.frontend.parser.ast.statement.ReturnNode;
import org.seanet.compiler.frontend.parser.ast.statement.StructDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.VariableDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.VariableDeclarationWithAssignmentNode;
import org.seanet.compiler.frontend.parser.ast.statement.WhileNode;

/**
 * A visitor for the Abstract Syntax Tree with one method per node type.
 * Adding a node type adds a method here, so every visitor has to handle it.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    // Expressions
    T visit(LiteralNode node);
    T visit(GroupingNode node);
    T visit(PrefixUnaryNode node);
    T visit(BinaryNode node);
    T visit(LogicalNode node);
    T visit(AssignmentNode node);
    T visit(PropertyAssignmentNode node);
    T visit(CallNode node);
    T visit(PropertyAccessNode node);
    T visit(VariableReferenceNode node);
    T visit(PostfixIncrementNode node);
    T visit(ArrayIndexNode node);
    T visit(NewSizedArrayNode node);
    T visit(NewStructNode node);

    // Statements
    T visit(ProgramNode node);
    T visit(BlockNode node);
    T visit(ExpressionStatementNode node);
    T visit(VariableDeclarationNode node);
    T visit(VariableDeclarationWithAssignmentNode node);
    T visit(IfNode node);
    T visit(WhileNode node);
    T visit(FunctionDeclarationNode node);
    T visit(StructDeclarationNode node);
    T visit(ReturnNode node);
    T visit(ReturnEmptyNode node);
}
