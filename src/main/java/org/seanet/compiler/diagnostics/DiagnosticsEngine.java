package org.seanet.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the errors that occur while scanning and parsing.
 * <p>
 * This decouples error reporting from the lexer and parser: neither throws to its
 * caller, the caller inspects this engine afterwards. Reporting order is preserved.
 * Instances are not safe for concurrent writers; use one engine per compilation unit.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error found by the lexer.
     *
     * @param message  The error message.
     * @param fileName The file in which the error occurred.
     * @param line     The line of the error.
     * @param column   The column of the error.
     */
    public void reportLexicalError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Kind.LEXICAL, message, fileName, line, column));
    }

    /**
     * Reports an error found by the parser.
     *
     * @param message  The error message.
     * @param fileName The file in which the error occurred.
     * @param line     The line of the error.
     * @param column   The column of the error.
     */
    public void reportSyntaxError(String message, String fileName, int line, int column) {
        diagnostics.add(new Diagnostic(Diagnostic.Kind.SYNTAX, message, fileName, line, column));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics in reporting order.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns the diagnostics of one phase only.
     *
     * @param kind The phase to filter by.
     * @return The matching diagnostics in reporting order.
     */
    public List<Diagnostic> getDiagnostics(Diagnostic.Kind kind) {
        return diagnostics.stream()
                .filter(d -> d.kind() == kind)
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
