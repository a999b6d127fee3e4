package org.kestrel.compiler.api;

import org.kestrel.compiler.diagnostics.Diagnostic;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of parsing one source text. The program is always present; if
 * {@link #hasErrors()} is true it lacks the statements that failed to parse and
 * must not be treated as complete.
 *
 * @param program The parsed program.
 * @param diagnostics All diagnostics in the order they were reported.
 */
public record ParseResult(ProgramNode program, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if at least one error was reported.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * @return The messages of all errors, in order.
     */
    public List<String> errors() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.ERROR)
                .map(Diagnostic::message)
                .toList();
    }

    /**
     * @return All diagnostics formatted one per line.
     */
    public String summary() {
        return diagnostics.stream().map(Diagnostic::toString).collect(Collectors.joining("\n"));
    }
}
