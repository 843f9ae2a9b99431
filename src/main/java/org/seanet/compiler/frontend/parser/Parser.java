package org.seanet.compiler.frontend.parser;

import org.seanet.compiler.diagnostics.DiagnosticsEngine;
import org.seanet.compiler.frontend.lexer.Token;
import org.seanet.compiler.frontend.lexer.TokenType;
import org.seanet.compiler.frontend.parser.ast.expression.ArrayIndexNode;
import org.seanet.compiler.frontend.parser.ast.expression.AssignmentNode;
import org.seanet.compiler.frontend.parser.ast.expression.BinaryNode;
import org.seanet.compiler.frontend.parser.ast.expression.CallNode;
import org.seanet.compiler.frontend.parser.ast.expression.Expression;
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
import org.seanet.compiler.frontend.parser.ast.statement.Statement;
import org.seanet.compiler.frontend.parser.ast.statement.StructDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.VariableDeclarationNode;
import org.seanet.compiler.frontend.parser.ast.statement.VariableDeclarationWithAssignmentNode;
import org.seanet.compiler.frontend.parser.ast.statement.WhileNode;
import org.seanet.compiler.frontend.parser.ast.types.TypeInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static org.seanet.compiler.frontend.lexer.TokenType.*;

/**
 * The recursive-descent parser for Seanet. It consumes a list of tokens
 * from the {@link org.seanet.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Grammar, from the top level down to the highest binding strength:
 * <pre>
 * program       : ( structDecl | functionDecl )* EOF ;
 * structDecl    : "struct" IDENTIFIER "{" ( type IDENTIFIER ";" )* "}" ;
 * functionDecl  : ( "void" | type ) IDENTIFIER "(" parameters? ")" block ;
 * declaration   : "var" IDENTIFIER "=" expression ";"
 *               | type IDENTIFIER ( "=" expression )? ";"
 *               | statement ;
 * statement     : block | ifStmt | whileStmt | forStmt | returnStmt | expression ";" ;
 * type          : "ref"? typeName ( "[" "]" )* | functionType ;
 * functionType  : "fun" ( "&lt;" type ( "," type )* "&gt;" )? ;
 * expression    : assignment ;
 * assignment    : logicOr ( ( "=" | "+=" | "-=" | "*=" | "/=" ) assignment )? ;
 * logicOr       : logicAnd ( "||" logicAnd )* ;
 * logicAnd      : bitwiseOr ( "&amp;&amp;" bitwiseOr )* ;
 * bitwiseOr     : bitwiseXor ( "|" bitwiseXor )* ;
 * bitwiseXor    : bitwiseAnd ( "^" bitwiseAnd )* ;
 * bitwiseAnd    : equality ( "&amp;" equality )* ;
 * equality      : comparison ( ( "==" | "!=" ) comparison )* ;
 * comparison    : shift ( ( "&lt;" | "&lt;=" | "&gt;" | "&gt;=" ) shift )* ;
 * shift         : term ( ( "&lt;&lt;" | "&gt;&gt;" ) term )* ;
 * term          : factor ( ( "+" | "-" ) factor )* ;
 * factor        : unary ( ( "*" | "/" | "%" ) unary )* ;
 * unary         : ( "!" | "-" | "~" | "++" | "--" ) unary | postfix ;
 * postfix       : primary ( "(" arguments? ")" | "." IDENTIFIER | "[" expression "]" )* ;
 * primary       : literal | "(" expression ")" | IDENTIFIER ( "++" | "--" )? | newExpr ;
 * </pre>
 * The parser stops at the first syntax error: it reports the error, abandons the whole
 * parse and returns an empty {@link ProgramNode}. Nesting of blocks and expressions is limited
 * to {@link #MAX_NESTING_DEPTH} levels; deeper input is reported as a syntax error.
 */
public class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /**
     * The maximum number of nested blocks, parenthesized or operand expressions, prefix operators
     * and chained assignments. Each level costs several dozen stack frames while parsing.
     */
    public static final int MAX_NESTING_DEPTH = 128;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser.
     * @param tokens The tokens to parse, terminated by an end-of-file token. Comments are skipped.
     * @param diagnostics The engine for reporting errors.
     * @param fileName The name of the parsed file, for error reporting.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, String fileName) {
        this.tokens = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() != COMMENT) {
                this.tokens.add(token);
            }
        }
        if (this.tokens.isEmpty() || this.tokens.get(this.tokens.size() - 1).type() != END_OF_FILE) {
            throw new IllegalArgumentException("Token stream must end with " + END_OF_FILE);
        }
        this.diagnostics = diagnostics;
        this.fileName = fileName;
    }

    /**
     * Parses the entire token stream.
     * @return The program, or an empty program if a syntax error was reported.
     */
    public ProgramNode parse() {
        current = 0;
        depth = 0;
        try {
            ProgramNode program = program();
            LOG.debug("Parsed {} top-level declarations from {}", program.declarations().size(), fileName);
            return program;
        } catch (ParseAbort abort) {
            LOG.debug("Parsing of {} aborted: {}", fileName, abort.getMessage());
            return ProgramNode.empty();
        }
    }

    private ProgramNode program() throws ParseAbort {
        List<Statement> declarations = new ArrayList<>();
        while (!isAtEnd()) {
            if (match(STRUCT)) {
                declarations.add(structDeclaration());
            } else if (check(VOID) || isTypeStart()) {
                declarations.add(functionDeclaration());
            } else {
                throw error(peek(), "Expected function or struct declaration.");
            }
        }
        return new ProgramNode(declarations);
    }

    private StructDeclarationNode structDeclaration() throws ParseAbort {
        Token name = consume(IDENTIFIER, "Expected struct name.");
        consume(LEFT_BRACE, "Expected '{' after struct name.");
        List<VariableDeclarationNode> fields = new ArrayList<>();
        while (!check(RIGHT_BRACE) && !isAtEnd()) {
            TypeInfo type = type();
            Token fieldName = consume(IDENTIFIER, "Expected field name.");
            consume(SEMICOLON, "Expected ';' after field declaration.");
            fields.add(new VariableDeclarationNode(type, fieldName));
        }
        consume(RIGHT_BRACE, "Expected '}' after struct fields.");
        return new StructDeclarationNode(name, fields);
    }

    private FunctionDeclarationNode functionDeclaration() throws ParseAbort {
        TypeInfo returnType = match(VOID) ? new TypeInfo.Named(previous(), false) : type();
        Token name = consume(IDENTIFIER, "Expected function name.");
        consume(LEFT_PAREN, "Expected '(' after function name.");
        List<VariableDeclarationNode> parameters = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                TypeInfo parameterType = type();
                Token parameterName = consume(IDENTIFIER, "Expected parameter name.");
                parameters.add(new VariableDeclarationNode(parameterType, parameterName));
            } while (match(COMMA));
        }
        consume(RIGHT_PAREN, "Expected ')' after parameters.");
        BlockNode body = block("Expected '{' before function body.");
        return new FunctionDeclarationNode(returnType, name, parameters, body);
    }

    // Types

    private TypeInfo type() throws ParseAbort {
        if (match(REF)) {
            if (check(FUN)) {
                throw error(peek(), "ref cannot apply to a function-pointer type.");
            }
            return arrayDimensions(typeName(), true);
        }
        if (check(FUN)) {
            return functionPointerType();
        }
        return arrayDimensions(typeName(), false);
    }

    private Token typeName() throws ParseAbort {
        if (peek().type().isBuiltinType() || check(IDENTIFIER)) {
            return advance();
        }
        throw error(peek(), "Expected type.");
    }

    private TypeInfo arrayDimensions(Token name, boolean isReference) throws ParseAbort {
        int dimensions = 0;
        while (match(LEFT_BRACKET)) {
            consume(RIGHT_BRACKET, "Expected ']' after '[' in array type.");
            dimensions++;
        }
        if (dimensions == 0) {
            return new TypeInfo.Named(name, isReference);
        }
        // ref marks the outermost type only.
        TypeInfo type = new TypeInfo.Named(name, false);
        for (int i = 1; i <= dimensions; i++) {
            type = new TypeInfo.ArrayOf(type, isReference && i == dimensions);
        }
        return type;
    }

    private TypeInfo.FunctionPointer functionPointerType() throws ParseAbort {
        Token fun = consume(FUN, "Expected 'fun'.");
        if (!match(LESS)) {
            return new TypeInfo.FunctionPointer(fun, List.of(), new TypeInfo.Named(fun.synthesize(VOID, null), false));
        }
        List<TypeInfo> types = new ArrayList<>();
        do {
            types.add(match(VOID) ? new TypeInfo.Named(previous(), false) : type());
        } while (match(COMMA));
        closeTypeArguments();

        // The last entry is the return type, all others are parameters.
        TypeInfo returnType = types.remove(types.size() - 1);
        return new TypeInfo.FunctionPointer(fun, types, returnType);
    }

    private void closeTypeArguments() throws ParseAbort {
        if (match(GREATER)) {
            return;
        }
        if (check(GREATER_GREATER)) {
            // Nested function-pointer types end in ">>"; consume only its first half.
            Token both = peek();
            Token first = new Token(GREATER, both.start(), 1, both.source(), both.line(), both.column(), null);
            Token second = new Token(GREATER, both.start() + 1, 1, both.source(), both.line(), both.column() + 1, null);
            tokens.set(current, first);
            tokens.add(current + 1, second);
            advance();
            return;
        }
        throw error(peek(), "Expected '>' after function-pointer type arguments.");
    }

    private boolean isTypeStart() {
        return check(REF) || check(FUN) || check(IDENTIFIER) || peek().type().isBuiltinType();
    }

    private boolean isDeclarationStart() {
        if (check(REF) || check(FUN) || peek().type().isBuiltinType()) {
            return true;
        }
        // "Name other" declares a variable of a named type, "Name[] other" one of an array type.
        return check(IDENTIFIER)
                && (checkAt(1, IDENTIFIER) || (checkAt(1, LEFT_BRACKET) && checkAt(2, RIGHT_BRACKET)));
    }

    // Statements

    private Statement declaration() throws ParseAbort {
        if (match(VAR)) {
            return varDeclaration();
        }
        if (isDeclarationStart()) {
            return typedDeclaration();
        }
        return statement();
    }

    private Statement varDeclaration() throws ParseAbort {
        Token var = previous();
        Token name = consume(IDENTIFIER, "Expected variable name.");
        consume(EQUAL, "Expected '=' after variable name; 'var' declarations require an initializer.");
        Expression initializer = expression();
        consume(SEMICOLON, "Expected ';' after variable declaration.");
        return new VariableDeclarationWithAssignmentNode(new TypeInfo.Named(var, false), name, initializer);
    }

    private Statement typedDeclaration() throws ParseAbort {
        TypeInfo type = type();
        Token name = consume(IDENTIFIER, "Expected variable name.");
        Statement declaration;
        if (match(EQUAL)) {
            declaration = new VariableDeclarationWithAssignmentNode(type, name, expression());
        } else {
            declaration = new VariableDeclarationNode(type, name);
        }
        consume(SEMICOLON, "Expected ';' after variable declaration.");
        return declaration;
    }

    private Statement statement() throws ParseAbort {
        if (check(LEFT_BRACE)) return block("Expected '{'.");
        if (match(IF)) return ifStatement();
        if (match(WHILE)) return whileStatement();
        if (match(FOR)) return forStatement();
        if (match(RETURN)) return returnStatement();
        if (check(BREAK) || check(CONTINUE)) {
            throw error(peek(), "'" + peek().text() + "' statements are not supported.");
        }
        return expressionStatement();
    }

    private BlockNode block(String missingBraceMessage) throws ParseAbort {
        consume(LEFT_BRACE, missingBraceMessage);
        enterNesting("Blocks nested too deeply.");
        List<Statement> statements = new ArrayList<>();
        while (!check(RIGHT_BRACE) && !isAtEnd()) {
            statements.add(declaration());
        }
        consume(RIGHT_BRACE, "Expected '}' after block.");
        depth--;
        return new BlockNode(statements);
    }

    private IfNode ifStatement() throws ParseAbort {
        IfNode first = conditionalBranch(previous());
        List<IfNode> elseIfs = new ArrayList<>();
        BlockNode elseBranch = null;
        while (match(ELSE)) {
            if (match(IF)) {
                elseIfs.add(conditionalBranch(previous()));
            } else {
                elseBranch = block("Expected '{' or 'if' after 'else'.");
                break;
            }
        }
        return new IfNode(first.keyword(), first.condition(), first.thenBranch(), elseIfs, elseBranch);
    }

    private IfNode conditionalBranch(Token keyword) throws ParseAbort {
        consume(LEFT_PAREN, "Expected '(' after 'if'.");
        Expression condition = expression();
        consume(RIGHT_PAREN, "Expected ')' after if condition.");
        BlockNode body = block("Expected '{' after if condition.");
        return new IfNode(keyword, condition, body, List.of(), null);
    }

    private WhileNode whileStatement() throws ParseAbort {
        Token keyword = previous();
        consume(LEFT_PAREN, "Expected '(' after 'while'.");
        Expression condition = expression();
        consume(RIGHT_PAREN, "Expected ')' after while condition.");
        BlockNode body = block("Expected '{' after while condition.");
        return new WhileNode(keyword, condition, body);
    }

    /**
     * Desugars {@code for (init; cond; incr) { body }} into
     * {@code { init; while (cond) { body; incr; } }}.
     */
    private BlockNode forStatement() throws ParseAbort {
        Token keyword = previous();
        consume(LEFT_PAREN, "Expected '(' after 'for'.");

        Statement initializer;
        if (match(SEMICOLON)) {
            initializer = null;
        } else if (match(VAR)) {
            initializer = varDeclaration();
        } else if (isDeclarationStart()) {
            initializer = typedDeclaration();
        } else {
            initializer = expressionStatement();
        }

        // An omitted condition loops forever; the synthesized literal sits where the condition would have been.
        Expression condition = check(SEMICOLON)
                ? new LiteralNode(peek().synthesize(TRUE, Boolean.TRUE))
                : expression();
        consume(SEMICOLON, "Expected ';' after loop condition.");

        Expression increment = check(RIGHT_PAREN) ? null : expression();
        consume(RIGHT_PAREN, "Expected ')' after for clauses.");
        BlockNode body = block("Expected '{' after for clauses.");

        List<Statement> loopStatements = new ArrayList<>(body.statements());
        if (increment != null) {
            loopStatements.add(new ExpressionStatementNode(increment));
        }
        WhileNode loop = new WhileNode(keyword, condition, new BlockNode(loopStatements));

        List<Statement> outer = new ArrayList<>();
        if (initializer != null) {
            outer.add(initializer);
        }
        outer.add(loop);
        return new BlockNode(outer);
    }

    private Statement returnStatement() throws ParseAbort {
        Token keyword = previous();
        if (match(SEMICOLON)) {
            return new ReturnEmptyNode(keyword);
        }
        Expression value = expression();
        consume(SEMICOLON, "Expected ';' after return value.");
        return new ReturnNode(keyword, value);
    }

    private Statement expressionStatement() throws ParseAbort {
        Expression expression = expression();
        consume(SEMICOLON, "Expected ';' after expression.");
        return new ExpressionStatementNode(expression);
    }

    // Expressions

    private Expression expression() throws ParseAbort {
        enterNesting("Expression nested too deeply.");
        Expression expression = assignment();
        depth--;
        return expression;
    }

    private Expression assignment() throws ParseAbort {
        Expression target = logicalOr();
        if (match(EQUAL, PLUS_EQUAL, MINUS_EQUAL, STAR_EQUAL, SLASH_EQUAL)) {
            Token operator = previous();
            enterNesting("Expression nested too deeply.");
            Expression value = assignment();
            depth--;
            if (target instanceof VariableReferenceNode variable) {
                return new AssignmentNode(variable.name(), operator, value);
            }
            if (target instanceof PropertyAccessNode property) {
                return new PropertyAssignmentNode(property.object(), property.property(), operator, value);
            }
            throw error(operator, "Invalid assignment target.");
        }
        return target;
    }

    private Expression logicalOr() throws ParseAbort {
        return logical(this::logicalAnd, PIPE_PIPE);
    }

    private Expression logicalAnd() throws ParseAbort {
        return logical(this::bitwiseOr, AMPERSAND_AMPERSAND);
    }

    private Expression bitwiseOr() throws ParseAbort {
        return binary(this::bitwiseXor, PIPE);
    }

    private Expression bitwiseXor() throws ParseAbort {
        return binary(this::bitwiseAnd, CARET);
    }

    private Expression bitwiseAnd() throws ParseAbort {
        return binary(this::equality, AMPERSAND);
    }

    private Expression equality() throws ParseAbort {
        return binary(this::comparison, EQUAL_EQUAL, BANG_EQUAL);
    }

    private Expression comparison() throws ParseAbort {
        return binary(this::shift, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL);
    }

    private Expression shift() throws ParseAbort {
        return binary(this::term, LESS_LESS, GREATER_GREATER);
    }

    private Expression term() throws ParseAbort {
        return binary(this::factor, PLUS, MINUS);
    }

    private Expression factor() throws ParseAbort {
        return binary(this::unary, STAR, SLASH, PERCENT);
    }

    private Expression binary(OperandParser operand, TokenType... operators) throws ParseAbort {
        Expression expression = operand.parse();
        while (match(operators)) {
            Token operator = previous();
            Expression right = operand.parse();
            expression = new BinaryNode(expression, operator, right);
        }
        return expression;
    }

    private Expression logical(OperandParser operand, TokenType operator) throws ParseAbort {
        Expression expression = operand.parse();
        while (match(operator)) {
            Token token = previous();
            Expression right = operand.parse();
            expression = new LogicalNode(expression, token, right);
        }
        return expression;
    }

    private Expression unary() throws ParseAbort {
        if (match(BANG, MINUS, TILDE, PLUS_PLUS, MINUS_MINUS)) {
            Token operator = previous();
            enterNesting("Expression nested too deeply.");
            Expression operand = unary();
            depth--;
            return new PrefixUnaryNode(operator, operand);
        }
        return postfix();
    }

    private Expression postfix() throws ParseAbort {
        Expression expression = primary();
        while (true) {
            if (match(LEFT_PAREN)) {
                expression = finishCall(expression);
            } else if (match(DOT)) {
                Token property = consume(IDENTIFIER, "Expected property name after '.'.");
                expression = new PropertyAccessNode(expression, property);
            } else if (match(LEFT_BRACKET)) {
                Token bracket = previous();
                Expression index = expression();
                consume(RIGHT_BRACKET, "Expected ']' after index.");
                expression = new ArrayIndexNode(expression, bracket, index);
            } else {
                return expression;
            }
        }
    }

    private CallNode finishCall(Expression callee) throws ParseAbort {
        Token paren = previous();
        List<Expression> arguments = new ArrayList<>();
        if (!check(RIGHT_PAREN)) {
            do {
                if (match(REF)) {
                    Token name = consume(IDENTIFIER, "Expected variable name after 'ref'.");
                    arguments.add(new VariableReferenceNode(name, true));
                } else {
                    arguments.add(expression());
                }
            } while (match(COMMA));
        }
        consume(RIGHT_PAREN, "Expected ')' after arguments.");
        return new CallNode(callee, paren, arguments);
    }

    private Expression primary() throws ParseAbort {
        if (peek().type().isLiteral()) {
            return new LiteralNode(advance());
        }
        if (match(LEFT_PAREN)) {
            Expression expression = expression();
            consume(RIGHT_PAREN, "Expected ')' after expression.");
            return new GroupingNode(expression);
        }
        if (match(IDENTIFIER)) {
            Token name = previous();
            if (match(PLUS_PLUS, MINUS_MINUS)) {
                return new PostfixIncrementNode(name, previous());
            }
            return new VariableReferenceNode(name, false);
        }
        if (match(NEW)) {
            return newExpression();
        }
        throw error(peek(), "Expected expression.");
    }

    private Expression newExpression() throws ParseAbort {
        Token keyword = previous();
        TypeInfo elementType = check(FUN) ? functionPointerType() : new TypeInfo.Named(typeName(), false);

        if (check(LEFT_BRACKET)) {
            List<Expression> sizes = new ArrayList<>();
            TypeInfo.ArrayOf arrayType = null;
            TypeInfo inner = elementType;
            while (match(LEFT_BRACKET)) {
                sizes.add(expression());
                consume(RIGHT_BRACKET, "Expected ']' after array size.");
                arrayType = new TypeInfo.ArrayOf(inner, false);
                inner = arrayType;
            }
            return new NewSizedArrayNode(keyword, arrayType, sizes);
        }

        if (!(elementType instanceof TypeInfo.Named structType)) {
            throw error(peek(), "Expected '[' after function-pointer type in 'new' expression.");
        }
        consume(LEFT_PAREN, "Expected '(' or '[' after type in 'new' expression.");
        consume(RIGHT_PAREN, "Expected ')' in 'new' expression; struct constructors take no arguments.");
        return new NewStructNode(keyword, structType);
    }

    // Token stream helpers

    // An abort leaves the counter raised; parse() resets it.
    private void enterNesting(String message) throws ParseAbort {
        if (++depth > MAX_NESTING_DEPTH) {
            throw error(peek(), message);
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private boolean check(TokenType type) {
        return peek().type() == type;
    }

    private boolean checkAt(int offset, TokenType type) {
        int index = current + offset;
        return index < tokens.size() && tokens.get(index).type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == END_OF_FILE;
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }

    private Token consume(TokenType type, String errorMessage) throws ParseAbort {
        if (check(type)) return advance();
        throw error(peek(), errorMessage);
    }

    private ParseAbort error(Token token, String message) {
        diagnostics.reportSyntaxError(message, fileName, token.line(), token.column());
        return new ParseAbort(message);
    }

    /**
     * A parsing step that may abort the parse.
     */
    @FunctionalInterface
    private interface OperandParser {
        Expression parse() throws ParseAbort;
    }

    /**
     * Unwinds all parsing methods up to {@link #parse()} after a syntax error has been reported.
     */
    private static final class ParseAbort extends Exception {
        ParseAbort(String message) {
            super(message, null, false, false);
        }
    }
}
