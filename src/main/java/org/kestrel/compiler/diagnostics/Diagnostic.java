package org.kestrel.compiler.diagnostics;

/**
 * Represents a single diagnostic message (error, warning, info)
 * that occurs while processing a source text.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param fileName The name of the source the issue occurred in.
 * @param lineNumber The line number of the issue, or 0 if unknown.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error; the parsed tree must not be treated as complete. */
        ERROR,
        /** A warning that does not invalidate the result. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
