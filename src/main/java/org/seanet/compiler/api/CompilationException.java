package org.seanet.compiler.api;

import org.seanet.compiler.diagnostics.Diagnostic;

import java.util.List;

/**
 * An exception that is thrown when one or more errors occur during the compilation process.
 * <p>
 * It is part of the public API and carries the diagnostics that caused the failure.
 */
public class CompilationException extends Exception {

    private final List<Diagnostic> diagnostics;

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        this(message, List.of());
    }

    /**
     * Constructs a new compilation exception for the reported diagnostics.
     * @param message The detail message, usually the formatted diagnostics.
     * @param diagnostics The diagnostics in reporting order.
     */
    public CompilationException(String message, List<Diagnostic> diagnostics) {
        super(message, null);
        this.diagnostics = List.copyOf(diagnostics);
    }

    /**
     * Returns the diagnostics that caused the failure.
     * @return An unmodifiable list of diagnostics, possibly empty.
     */
    public List<Diagnostic> getDiagnostics() {
        return diagnostics;
    }
}
