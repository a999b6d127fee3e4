package org.kestrel.compiler.api;

/**
 * An exception that is thrown when one or more errors occur while a source text is parsed.
 * <p>
 * It is part of the public API and hides the internal error reporting of the compiler.
 */
public class CompilationException extends Exception {

    /**
     * Constructs a new compilation exception with the specified detail message.
     * @param message The detail message.
     */
    public CompilationException(String message) {
        super(message);
    }
}
