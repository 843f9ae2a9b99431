package org.seanet.compiler.frontend.lexer;

import org.seanet.compiler.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * The lexer never fails: every lexical problem is reported to the {@link DiagnosticsEngine},
 * the offending lexeme is dropped, and scanning continues with the next character. The
 * resulting list always ends with exactly one {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("true", TokenType.TRUE),
            Map.entry("false", TokenType.FALSE),
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("return", TokenType.RETURN),
            Map.entry("for", TokenType.FOR),
            Map.entry("while", TokenType.WHILE),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("var", TokenType.VAR),
            Map.entry("ref", TokenType.REF),
            Map.entry("fun", TokenType.FUN),
            Map.entry("new", TokenType.NEW),
            Map.entry("struct", TokenType.STRUCT),
            Map.entry("byte", TokenType.BYTE),
            Map.entry("short", TokenType.SHORT),
            Map.entry("ushort", TokenType.USHORT),
            Map.entry("int", TokenType.INT),
            Map.entry("uint", TokenType.UINT),
            Map.entry("long", TokenType.LONG),
            Map.entry("ulong", TokenType.ULONG),
            Map.entry("float", TokenType.FLOAT),
            Map.entry("double", TokenType.DOUBLE),
            Map.entry("bool", TokenType.BOOL),
            Map.entry("void", TokenType.VOID),
            Map.entry("string", TokenType.STRING)
    );

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private List<Token> result;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the file being scanned, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code. The source is scanned once;
     * later calls return the same list without reporting the diagnostics again.
     * @return An unmodifiable list of the recognized tokens, terminated by an end-of-file token.
     */
    public List<Token> scanTokens() {
        if (result != null) {
            return result;
        }
        while (!isAtEnd()) {
            beginLexeme();
            scanToken();
        }
        beginLexeme();
        addToken(TokenType.END_OF_FILE);
        LOG.debug("Scanned {} tokens from {}", tokens.size(), logicalFileName);
        result = List.copyOf(tokens);
        return result;
    }

    private void beginLexeme() {
        start = current;
        startLine = line;
        startColumn = column;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // Whitespace; advance() already moved to the next line on '\n'.
            case ' ', '\r', '\t', '\n':
                break;
            case '{': addToken(TokenType.LEFT_BRACE); break;
            case '}': addToken(TokenType.RIGHT_BRACE); break;
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case '[': addToken(TokenType.LEFT_BRACKET); break;
            case ']': addToken(TokenType.RIGHT_BRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;
            case ';': addToken(TokenType.SEMICOLON); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '^': addToken(TokenType.CARET); break;
            case '~': addToken(TokenType.TILDE); break;
            case '+':
                if (match('+')) {
                    addToken(TokenType.PLUS_PLUS);
                } else {
                    addToken(match('=') ? TokenType.PLUS_EQUAL : TokenType.PLUS);
                }
                break;
            case '-':
                if (match('-')) {
                    addToken(TokenType.MINUS_MINUS);
                } else {
                    addToken(match('=') ? TokenType.MINUS_EQUAL : TokenType.MINUS);
                }
                break;
            case '*':
                addToken(match('=') ? TokenType.STAR_EQUAL : TokenType.STAR);
                break;
            case '/':
                if (match('/')) {
                    lineComment();
                } else if (match('*')) {
                    blockComment();
                } else {
                    addToken(match('=') ? TokenType.SLASH_EQUAL : TokenType.SLASH);
                }
                break;
            case '!':
                addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
                break;
            case '=':
                addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
                break;
            case '<':
                if (match('=')) {
                    addToken(TokenType.LESS_EQUAL);
                } else {
                    addToken(match('<') ? TokenType.LESS_LESS : TokenType.LESS);
                }
                break;
            case '>':
                if (match('=')) {
                    addToken(TokenType.GREATER_EQUAL);
                } else {
                    addToken(match('>') ? TokenType.GREATER_GREATER : TokenType.GREATER);
                }
                break;
            case '&':
                addToken(match('&') ? TokenType.AMPERSAND_AMPERSAND : TokenType.AMPERSAND);
                break;
            case '|':
                addToken(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE);
                break;
            case '"':
                string();
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    unexpectedCharacter(c);
                }
                break;
        }
    }

    private void unexpectedCharacter(char c) {
        if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
            advance();
        }
        reportError("Unexpected character: " + source.substring(start, current));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = KEYWORDS.getOrDefault(text, TokenType.IDENTIFIER);
        if (type == TokenType.TRUE || type == TokenType.FALSE) {
            addToken(type, type == TokenType.TRUE);
        } else {
            addToken(type);
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        // The radix marker is only recognized after an initial run of decimal digits.
        int radixMarker = -1;
        if (peek() == 'x' || peek() == 'X') {
            radixMarker = current;
            advance();
            while (isHexDigit(peek())) advance();
        }

        if (radixMarker < 0 && (isExponentMarker(peek()) || (peek() == '.' && isDigit(peekNext())))) {
            floatingPoint();
            return;
        }

        boolean unsigned = match('u') || match('U');
        boolean isLong = match('l') || match('L');
        int suffixLength = (unsigned ? 1 : 0) + (isLong ? 1 : 0);

        if (radixMarker >= 0 && !"0".equals(source.substring(start, radixMarker))) {
            reportError("Invalid " + integerKindName(unsigned, isLong) + " literal: " + source.substring(start, current));
            return;
        }

        int digitsStart = radixMarker >= 0 ? radixMarker + 1 : start;
        String digits = source.substring(digitsStart, current - suffixLength);
        int radix = radixMarker >= 0 ? 16 : 10;
        try {
            if (isLong) {
                long value = unsigned || radix == 16
                        ? Long.parseUnsignedLong(digits, radix)
                        : Long.parseLong(digits, radix);
                addToken(unsigned ? TokenType.ULONG_LITERAL : TokenType.LONG_LITERAL, value);
            } else {
                int value = unsigned || radix == 16
                        ? Integer.parseUnsignedInt(digits, radix)
                        : Integer.parseInt(digits, radix);
                addToken(unsigned ? TokenType.UINT_LITERAL : TokenType.INT_LITERAL, value);
            }
        } catch (NumberFormatException e) {
            reportError("Invalid " + integerKindName(unsigned, isLong) + " literal: " + source.substring(start, current));
        }
    }

    private void floatingPoint() {
        if (peek() == '.') {
            advance();
            while (isDigit(peek())) advance();
        }
        if (isExponentMarker(peek())) {
            advance();
            if (peek() == '+' || peek() == '-') advance();
            while (isDigit(peek())) advance();
        }

        if (match('f') || match('F')) {
            String text = source.substring(start, current - 1);
            try {
                float value = Float.parseFloat(text);
                if (Float.isInfinite(value)) {
                    throw new NumberFormatException("out of range");
                }
                addToken(TokenType.FLOAT_LITERAL, value);
            } catch (NumberFormatException e) {
                reportError("Invalid float literal: " + source.substring(start, current));
            }
        } else {
            String text = source.substring(start, current);
            try {
                double value = Double.parseDouble(text);
                if (Double.isInfinite(value)) {
                    throw new NumberFormatException("out of range");
                }
                addToken(TokenType.DOUBLE_LITERAL, value);
            } catch (NumberFormatException e) {
                reportError("Invalid double literal: " + text);
            }
        }
    }

    private static String integerKindName(boolean unsigned, boolean isLong) {
        if (isLong) return unsigned ? "ulong" : "long";
        return unsigned ? "uint" : "int";
    }

    private void string() {
        while (peek() != '"' && !isAtEnd()) advance();

        if (isAtEnd()) {
            reportError("Unterminated string. Expected \", but reached end of file.");
            return;
        }

        // The closing "
        advance();

        // The lexeme keeps the quotes, the value is the verbatim content.
        addToken(TokenType.STRING_LITERAL, source.substring(start + 1, current - 1));
    }

    private void lineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        addToken(TokenType.COMMENT);
    }

    private void blockComment() {
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();

        if (isAtEnd()) {
            reportError("Unterminated block comment. Expected */, but reached end of file.");
            return;
        }

        // The closing */
        advance();
        advance();
        addToken(TokenType.COMMENT);
    }

    private void reportError(String message) {
        diagnostics.reportLexicalError(message, logicalFileName, startLine, startColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        tokens.add(new Token(type, start, current - start, source, startLine, startColumn, literal));
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private static boolean isExponentMarker(char c) {
        return c == 'e' || c == 'E';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private static boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private static boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
