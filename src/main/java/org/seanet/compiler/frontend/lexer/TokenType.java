package org.seanet.compiler.frontend.lexer;

import java.util.EnumSet;
import java.util.Set;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Structural punctuation.
    /** The '{' character. */
    LEFT_BRACE,
    /** The '}' character. */
    RIGHT_BRACE,
    /** The '(' character. */
    LEFT_PAREN,
    /** The ')' character. */
    RIGHT_PAREN,
    /** The '[' character. */
    LEFT_BRACKET,
    /** The ']' character. */
    RIGHT_BRACKET,
    /** The ',' character. */
    COMMA,
    /** The '.' character, used for property access. */
    DOT,
    /** The ';' character, which terminates statements. */
    SEMICOLON,

    // Operators.
    PLUS,
    PLUS_PLUS,
    PLUS_EQUAL,
    MINUS,
    MINUS_MINUS,
    MINUS_EQUAL,
    STAR,
    STAR_EQUAL,
    SLASH,
    SLASH_EQUAL,
    PERCENT,
    /** The logical negation '!'. */
    BANG,
    BANG_EQUAL,
    EQUAL,
    EQUAL_EQUAL,
    LESS,
    LESS_EQUAL,
    LESS_LESS,
    GREATER,
    GREATER_EQUAL,
    GREATER_GREATER,
    /** The bitwise and '&'. */
    AMPERSAND,
    /** The logical and '&&'. */
    AMPERSAND_AMPERSAND,
    /** The bitwise or '|'. */
    PIPE,
    /** The logical or '||'. */
    PIPE_PIPE,
    /** The bitwise xor '^'. */
    CARET,
    /** The bitwise complement '~'. */
    TILDE,

    // Literals.
    /** A string literal; the lexeme includes the quotes, no escapes are processed. */
    STRING_LITERAL,
    /** A 32-bit signed integer literal. */
    INT_LITERAL,
    /** A 32-bit unsigned integer literal, e.g. {@code 12u}. */
    UINT_LITERAL,
    /** A 64-bit signed integer literal, e.g. {@code 12L}. */
    LONG_LITERAL,
    /** A 64-bit unsigned integer literal, e.g. {@code 12uL}. */
    ULONG_LITERAL,
    /** A 32-bit floating point literal, e.g. {@code 1.5f}. */
    FLOAT_LITERAL,
    /** A 64-bit floating point literal, e.g. {@code 1.5}. */
    DOUBLE_LITERAL,

    // Keywords.
    TRUE,
    FALSE,
    IF,
    ELSE,
    RETURN,
    FOR,
    WHILE,
    BREAK,
    CONTINUE,
    VAR,
    REF,
    FUN,
    NEW,
    STRUCT,

    // Primitive type names.
    BYTE,
    SHORT,
    USHORT,
    INT,
    UINT,
    LONG,
    ULONG,
    FLOAT,
    DOUBLE,
    BOOL,
    VOID,
    STRING,

    // Miscellaneous.
    /** An identifier, such as a variable, function or struct name. */
    IDENTIFIER,
    /** A line or block comment. */
    COMMENT,
    /** Represents the end of the source file. */
    END_OF_FILE;

    private static final Set<TokenType> BUILTIN_TYPES = EnumSet.of(
            BYTE, SHORT, USHORT, INT, UINT, LONG, ULONG, FLOAT, DOUBLE, BOOL, STRING);

    private static final Set<TokenType> LITERALS = EnumSet.of(
            STRING_LITERAL, INT_LITERAL, UINT_LITERAL, LONG_LITERAL, ULONG_LITERAL,
            FLOAT_LITERAL, DOUBLE_LITERAL, TRUE, FALSE);

    /**
     * Checks whether this is the keyword of a primitive value type. {@link #VOID} is not
     * one: it is only valid as a return type.
     * @return true for the builtin type names.
     */
    public boolean isBuiltinType() {
        return BUILTIN_TYPES.contains(this);
    }

    /**
     * Checks whether a token of this type forms a literal expression on its own.
     * @return true for literal tokens, including {@code true} and {@code false}.
     */
    public boolean isLiteral() {
        return LITERALS.contains(this);
    }
}
