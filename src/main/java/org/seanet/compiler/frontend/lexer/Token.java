package org.seanet.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 * <p>
 * A token does not copy its lexeme; it is a view of {@code length} characters starting
 * at {@code start} in the shared source buffer.
 *
 * @param type The type of the token.
 * @param start The offset of the first character of the lexeme in {@code source}.
 * @param length The number of characters of the lexeme.
 * @param source The complete source text the token was scanned from.
 * @param line The 1-based line where the token begins.
 * @param column The 1-based column where the token begins.
 * @param value The parsed literal value (e.g. an {@link Integer} for int literals), or null.
 */
public record Token(
        TokenType type,
        int start,
        int length,
        String source,
        int line,
        int column,
        Object value
) {

    /**
     * Returns the lexeme of this token.
     * @return The source text covered by this token.
     */
    public String text() {
        return source.substring(start, start + length);
    }

    /**
     * Creates a token of another type that occupies the same position as this one.
     * Used for tokens the parser synthesizes, which have no lexeme of their own.
     *
     * @param type The type of the new token.
     * @param value The literal value of the new token.
     * @return A zero-length token at the position of this token.
     */
    public Token synthesize(TokenType type, Object value) {
        return new Token(type, start, 0, source, line, column, value);
    }

    @Override
    public String toString() {
        return type + " '" + text() + "' at " + line + ":" + column;
    }
}
