package org.kestrel.compiler;

import org.kestrel.compiler.api.CompilationException;
import org.kestrel.compiler.api.ICompiler;
import org.kestrel.compiler.api.ParseResult;
import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.lexer.Lexer;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.Parser;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;

import java.util.Optional;

/**
 * The main front end implementation. Every call runs a fresh lexer and parser with
 * its own diagnostics, so calls are independent of each other.
 */
public class Compiler implements ICompiler {

    private static final String EXPRESSION_SOURCE = "<expression>";

    private int verbosity = -1;

    @Override
    public ParseResult parse(String source, String programName) {
        applyVerbosity();
        CompilerLogger.debug("Compiler: parsing " + programName);

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source), diagnostics, programName);
        ProgramNode program = parser.parseProgram();

        if (diagnostics.hasErrors()) {
            CompilerLogger.info("Compiler: " + programName + ": " + diagnostics.errorCount() + " error(s)");
        }
        return new ParseResult(program, diagnostics.getDiagnostics());
    }

    @Override
    public ProgramNode compile(String source, String programName) throws CompilationException {
        ParseResult result = parse(source, programName);
        if (result.hasErrors()) {
            throw new CompilationException(result.summary());
        }
        return result.program();
    }

    @Override
    public ExpressionNode parseExpression(String source) throws CompilationException {
        applyVerbosity();
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source), diagnostics, EXPRESSION_SOURCE);

        Optional<ExpressionNode> expression = parser.parseExpression(Precedence.LOWEST);
        if (expression.isPresent()) {
            if (parser.peekIs(TokenType.SEMICOLON)) {
                parser.nextToken();
            }
            if (!parser.peekIs(TokenType.EOF)) {
                diagnostics.reportError("unexpected token: " + parser.peek().text(),
                        EXPRESSION_SOURCE, parser.peek().line());
            }
        }
        if (diagnostics.hasErrors() || expression.isEmpty()) {
            throw new CompilationException(diagnostics.summary());
        }
        return expression.get();
    }

    @Override
    public void setVerbosity(int level) {
        this.verbosity = level;
    }

    private void applyVerbosity() {
        if (verbosity >= 0) {
            CompilerLogger.setLevel(verbosity);
        }
    }
}
