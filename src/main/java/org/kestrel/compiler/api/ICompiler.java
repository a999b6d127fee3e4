package org.kestrel.compiler.api;

import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public, clean interface for the Kestrel front end.
 */
public interface ICompiler {

    /**
     * Parses the given source code and collects all syntax errors instead of failing.
     *
     * @param source The source code.
     * @param programName A name for the program, used in diagnostics.
     * @return The program together with all reported diagnostics.
     */
    ParseResult parse(String source, String programName);

    /**
     * Parses the given source code and requires it to be free of errors.
     *
     * @param source The source code.
     * @param programName A name for the program, used in diagnostics.
     * @return The complete program.
     * @throws CompilationException if any syntax error was reported. The message lists all of them.
     */
    ProgramNode compile(String source, String programName) throws CompilationException;

    /**
     * Parses a single expression, such as {@code 1 + x * 2}. A trailing {@code ;} is allowed,
     * anything else after the expression is an error.
     *
     * @param source The expression source.
     * @return The expression.
     * @throws CompilationException if the text is not exactly one valid expression.
     */
    ExpressionNode parseExpression(String source) throws CompilationException;

    /**
     * Sets the verbosity level for log output.
     * @param level The verbosity level (0=ERROR .. 4=TRACE).
     */
    void setVerbosity(int level);

    /**
     * Parses the source code from a file and requires it to be free of errors.
     * @param programPath The path to the source file.
     * @return The complete program.
     * @throws CompilationException if errors occur during parsing.
     * @throws IOException if the file cannot be read.
     */
    default ProgramNode compile(Path programPath) throws CompilationException, IOException {
        return compile(Files.readString(programPath), programPath.toString());
    }
}
