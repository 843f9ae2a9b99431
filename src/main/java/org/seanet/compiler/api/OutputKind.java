package org.seanet.compiler.api;

/**
 * The kind of artifact the code generator produces.
 */
public enum OutputKind {
    /** A program with a {@code main} entry point, started through the launcher. */
    EXECUTABLE,
    /** A collection of functions and structs without an entry point. */
    LIBRARY
}
