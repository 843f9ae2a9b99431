package org.seanet.compiler.diagnostics;

/**
 * Represents a single error reported while turning source text into an AST.
 *
 * @param kind The phase that detected the problem.
 * @param message The diagnostic message.
 * @param fileName The name of the file where the issue occurred.
 * @param line The 1-based line of the issue.
 * @param column The 1-based column of the issue.
 */
public record Diagnostic(
        Kind kind,
        String message,
        String fileName,
        int line,
        int column
) {
    /**
     * The phase that reported a diagnostic.
     */
    public enum Kind {
        /** Reported by the lexer; scanning continued past it. */
        LEXICAL,
        /** Reported by the parser; parsing was aborted. */
        SYNTAX
    }

    @Override
    public String toString() {
        return String.format("Parse error at %s:%d,%d - %s", fileName, line, column, message);
    }
}
