package org.seanet.compiler.util;

import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.parser.Parser;
import org.seanet.compiler.frontend.parser.ast.AstNode;
import org.seanet.compiler.frontend.parser.ast.AstVisitor;
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
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders an AST as a parenthesized prefix expression, e.g. {@code (+ 1 (* 2 3))}.
 * Used for {@code --dump-ast} and for compact assertions in tests.
 * <p>
 * Subtrees below {@link #MAX_DEPTH} levels are rendered as {@code ...}. The parser bounds nesting,
 * but long operator or call chains such as {@code a + b + ... + z} still build deep left spines.
 */
public final class AstPrinter implements AstVisitor<String> {

    /** The deepest level that is rendered in full. */
    public static final int MAX_DEPTH = 4 * Parser.MAX_NESTING_DEPTH;

    private int depth = 0;

    /**
     * Renders a node and all of its children.
     * @param node The root node.
     * @return The rendered tree.
     */
    public static String print(AstNode node) {
        return new AstPrinter().render(node);
    }

    /**
     * Renders a type the way it is written in source, e.g. {@code ref int[][]} or {@code fun<int, bool>}.
     * A plain {@code fun} is rendered as {@code fun<void>}.
     * @param type The type.
     * @return The rendered type.
     */
    public static String formatType(TypeInfo type) {
        if (type instanceof TypeInfo.Named named) {
            return (named.isReference() ? "ref " : "") + text(named.name());
        }
        if (type instanceof TypeInfo.ArrayOf array) {
            return (array.isReference() ? "ref " : "") + formatType(array.elementType()) + "[]";
        }
        TypeInfo.FunctionPointer function = (TypeInfo.FunctionPointer) type;
        List<String> parts = new ArrayList<>();
        function.parameterTypes().forEach(p -> parts.add(formatType(p)));
        parts.add(formatType(function.returnType()));
        return "fun<" + String.join(", ", parts) + ">";
    }

    // Synthesized tokens have no lexeme; their keyword is their type name.
    private static String text(Token token) {
        return token.length() == 0 ? token.type().name().toLowerCase(Locale.ROOT) : token.text();
    }

    private String render(AstNode node) {
        if (depth >= MAX_DEPTH) {
            return "...";
        }
        depth++;
        String rendered = node.accept(this);
        depth--;
        return rendered;
    }

    private String parenthesize(String head, AstNode... nodes) {
        return parenthesize(head, List.of(nodes));
    }

    private String parenthesize(String head, List<? extends AstNode> nodes) {
        StringBuilder sb = new StringBuilder("(").append(head);
        for (AstNode node : nodes) {
            sb.append(' ').append(render(node));
        }
        return sb.append(')').toString();
    }

    // Expressions

    @Override
    public String visit(LiteralNode node) {
        return text(node.literal());
    }

    @Override
    public String visit(GroupingNode node) {
        return parenthesize("group", node.expression());
    }

    @Override
    public String visit(PrefixUnaryNode node) {
        return parenthesize(node.operator().text(), node.operand());
    }

    @Override
    public String visit(BinaryNode node) {
        return parenthesize(node.operator().text(), node.left(), node.right());
    }

    @Override
    public String visit(LogicalNode node) {
        return parenthesize(node.operator().text(), node.left(), node.right());
    }

    @Override
    public String visit(AssignmentNode node) {
        return parenthesize(node.operator().text() + " " + node.name().text(), node.value());
    }

    @Override
    public String visit(PropertyAssignmentNode node) {
        return "(" + node.operator().text() + " (. " + render(node.object()) + " " + node.property().text() + ") "
                + render(node.value()) + ")";
    }

    @Override
    public String visit(CallNode node) {
        List<AstNode> parts = new ArrayList<>();
        parts.add(node.callee());
        parts.addAll(node.arguments());
        return parenthesize("call", parts);
    }

    @Override
    public String visit(PropertyAccessNode node) {
        return "(. " + render(node.object()) + " " + node.property().text() + ")";
    }

    @Override
    public String visit(VariableReferenceNode node) {
        return node.isReference() ? "(ref " + node.name().text() + ")" : node.name().text();
    }

    @Override
    public String visit(PostfixIncrementNode node) {
        return "(postfix" + node.operator().text() + " " + node.name().text() + ")";
    }

    @Override
    public String visit(ArrayIndexNode node) {
        return parenthesize("index", node.array(), node.index());
    }

    @Override
    public String visit(NewSizedArrayNode node) {
        return parenthesize("new " + formatType(node.type()), node.sizes());
    }

    @Override
    public String visit(NewStructNode node) {
        return "(new " + formatType(node.type()) + ")";
    }

    // Statements

    @Override
    public String visit(ProgramNode node) {
        return parenthesize("program", node.declarations());
    }

    @Override
    public String visit(BlockNode node) {
        return parenthesize("block", node.statements());
    }

    @Override
    public String visit(ExpressionStatementNode node) {
        return parenthesize("expr", node.expression());
    }

    @Override
    public String visit(VariableDeclarationNode node) {
        return "(declare " + formatType(node.type()) + " " + node.name().text() + ")";
    }

    @Override
    public String visit(VariableDeclarationWithAssignmentNode node) {
        return parenthesize("declare " + formatType(node.type()) + " " + node.name().text(), node.initializer());
    }

    @Override
    public String visit(IfNode node) {
        StringBuilder sb = new StringBuilder("(if ")
                .append(render(node.condition())).append(' ')
                .append(render(node.thenBranch()));
        for (IfNode elseIf : node.elseIfs()) {
            sb.append(" (else-if ").append(render(elseIf.condition())).append(' ')
                    .append(render(elseIf.thenBranch())).append(')');
        }
        if (node.hasElse()) {
            sb.append(" (else ").append(render(node.elseBranch())).append(')');
        }
        return sb.append(')').toString();
    }

    @Override
    public String visit(WhileNode node) {
        return parenthesize("while", node.condition(), node.body());
    }

    @Override
    public String visit(FunctionDeclarationNode node) {
        String parameters = node.parameters().stream()
                .map(this::render)
                .collect(Collectors.joining(" ", "(", ")"));
        return "(function " + formatType(node.returnType()) + " " + node.name().text() + " " + parameters + " "
                + render(node.body()) + ")";
    }

    @Override
    public String visit(StructDeclarationNode node) {
        return parenthesize("struct " + node.name().text(), node.fields());
    }

    @Override
    public String visit(ReturnNode node) {
        return parenthesize("return", node.value());
    }

    @Override
    public String visit(ReturnEmptyNode node) {
        return "(return)";
    }
}
