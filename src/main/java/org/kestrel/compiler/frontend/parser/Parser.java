package org.kestrel.compiler.frontend.parser;

import org.kestrel.compiler.diagnostics.CompilerLogger;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.lexer.Lexer;
import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ast.*;
import org.kestrel.compiler.frontend.statement.IStatementHandler;
import org.kestrel.compiler.frontend.statement.StatementHandlerRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The parser for the Kestrel language. It pulls tokens from a {@link Lexer} through a
 * three-token window and produces an Abstract Syntax Tree (AST).
 * <p>
 * Expressions are parsed with operator-precedence climbing (see {@link Precedence}).
 * Statements introduced by a keyword are delegated to the handlers of a
 * {@link StatementHandlerRegistry}; everything else is an expression statement.
 * <p>
 * Syntax errors never abort the parse. They are reported to the {@link DiagnosticsEngine},
 * the broken statement is dropped, and the parser resynchronizes at the next statement
 * boundary, so that one defect produces one error.
 */
public class Parser implements ParsingContext {

    private static final String DEFAULT_FILE_NAME = "<input>";

    private final Lexer lexer;
    private final DiagnosticsEngine diagnostics;
    private final StatementHandlerRegistry statementRegistry;
    private final String fileName;

    private Token current;
    private Token peek;
    private Token peekNext;

    /**
     * Constructs a new Parser for anonymous input.
     * @param lexer The lexer to pull tokens from.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this(lexer, diagnostics, DEFAULT_FILE_NAME);
    }

    /**
     * Constructs a new Parser.
     * @param lexer The lexer to pull tokens from.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param fileName The name of the source, used in diagnostics.
     */
    public Parser(Lexer lexer, DiagnosticsEngine diagnostics, String fileName) {
        this.lexer = lexer;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.statementRegistry = StatementHandlerRegistry.initialize();
        this.current = lexer.nextToken();
        this.peek = lexer.nextToken();
        this.peekNext = lexer.nextToken();
    }

    /**
     * Parses the entire input.
     * @return The program. If errors were reported, the statements that failed are missing.
     */
    public ProgramNode parseProgram() {
        List<StatementNode> statements = new ArrayList<>();
        while (!curIs(TokenType.EOF)) {
            int errorsBefore = diagnostics.errorCount();
            Optional<StatementNode> statement = parseStatement();
            if (statement.isPresent()) {
                statements.add(statement.get());
            } else if (diagnostics.errorCount() > errorsBefore) {
                // A stray '}' at top level has no enclosing block and is skipped like any other token.
                synchronize();
            }
            nextToken();
        }
        if (CompilerLogger.isEnabled(CompilerLogger.DEBUG)) {
            CompilerLogger.debug("Parser: " + fileName + ": " + statements.size() + " statement(s), "
                    + diagnostics.errorCount() + " error(s)");
        }
        return new ProgramNode(statements);
    }

    /**
     * Returns the messages of all errors reported so far, in order.
     * @return The error messages.
     */
    public List<String> getErrors() {
        return diagnostics.getErrorMessages();
    }

    @Override
    public Optional<StatementNode> parseStatement() {
        TokenType type = current.type();
        if (type == TokenType.RBRACE || type == TokenType.SEMICOLON || type == TokenType.EOF) {
            return Optional.empty();
        }
        Optional<IStatementHandler> handler = statementRegistry.get(type);
        if (handler.isPresent()) {
            return handler.get().parse(this);
        }
        return parseExpressionStatement();
    }

    private Optional<StatementNode> parseExpressionStatement() {
        Token start = current;
        Optional<ExpressionNode> expression = parseExpression(Precedence.LOWEST);
        if (expression.isEmpty()) {
            // Only a leading token that could not start an expression is left unconsumed.
            if (current == start
                    && !curIs(TokenType.RBRACE) && !curIs(TokenType.SEMICOLON) && !curIs(TokenType.EOF)) {
                reportError("unexpected token: " + current.text());
            }
            return Optional.empty();
        }
        if (peekIs(TokenType.SEMICOLON)) {
            nextToken();
        }
        return Optional.of(new ExpressionStatementNode(start, expression.get()));
    }

    @Override
    public BlockNode parseBlock() {
        Token open = current;
        nextToken();
        List<StatementNode> statements = new ArrayList<>();
        while (!curIs(TokenType.RBRACE) && !curIs(TokenType.EOF)) {
            int errorsBefore = diagnostics.errorCount();
            Optional<StatementNode> statement = parseStatement();
            if (statement.isPresent()) {
                statements.add(statement.get());
            } else if (diagnostics.errorCount() > errorsBefore && !synchronize()) {
                // Stopped on the closing brace of this block.
                continue;
            }
            nextToken();
        }
        if (curIs(TokenType.EOF)) {
            reportError(String.format("expected next token to be %s, got %s instead",
                    TokenType.RBRACE.display(), TokenType.EOF.display()));
        }
        return new BlockNode(open, statements);
    }

    @Override
    public Optional<BlockNode> parseBody() {
        if (peekIs(TokenType.LBRACE)) {
            nextToken();
            return Optional.of(parseBlock());
        }
        nextToken();
        Token start = current;
        if (curIs(TokenType.RBRACE) || curIs(TokenType.SEMICOLON) || curIs(TokenType.EOF)) {
            reportError("expected statement, got " + current.type().display() + " instead");
            return Optional.empty();
        }
        return parseStatement().map(statement -> new BlockNode(start, List.of(statement)));
    }

    /**
     * Skips the rest of a statement that failed to parse. Braces opened inside the
     * statement are skipped as a unit.
     *
     * @return true if the current token is now the last token of the broken statement and
     *         the caller should advance, false if the current token is a closing brace that
     *         belongs to the enclosing block and must not be consumed.
     */
    private boolean synchronize() {
        int depth = 0;
        while (!curIs(TokenType.EOF)) {
            if (curIs(TokenType.LBRACE)) {
                depth++;
            } else if (curIs(TokenType.RBRACE)) {
                if (depth == 0) {
                    return false;
                }
                // An else continues the broken if statement.
                if (--depth == 0 && !peekIs(TokenType.ELSE)) {
                    return true;
                }
            } else if (curIs(TokenType.SEMICOLON) && depth == 0 && !peekIs(TokenType.ELSE)) {
                return true;
            }
            if (depth == 0 && (peekIs(TokenType.RBRACE) || peekIs(TokenType.EOF)
                    || statementRegistry.handles(peek.type()))) {
                return true;
            }
            nextToken();
        }
        return true;
    }

    @Override
    public Optional<ExpressionNode> parseExpression(Precedence precedence) {
        Optional<ExpressionNode> prefix = parsePrefix();
        if (prefix.isEmpty()) {
            return prefix;
        }
        ExpressionNode left = prefix.get();
        while (!peekIs(TokenType.SEMICOLON) && !peekIs(TokenType.EOF)
                && Precedence.of(peek.type()).bindsTighterThan(precedence)) {
            nextToken();
            Optional<ExpressionNode> infix = parseInfix(left);
            if (infix.isEmpty()) {
                return infix;
            }
            left = infix.get();
        }
        return Optional.of(left);
    }

    private Optional<ExpressionNode> parsePrefix() {
        Token token = current;
        switch (token.type()) {
            case IDENT:
                return Optional.of(new IdentifierNode(token));
            case INT:
                return parseIntegerLiteral(token);
            case FLOAT:
                return parseFloatLiteral(token);
            case STRING:
                return Optional.of(new StringLiteralNode(token, token.text()));
            case BOOL:
                return Optional.of(new BooleanLiteralNode(token, "true".equals(token.text())));
            case NIL:
                return Optional.of(new NilLiteralNode(token));
            case VOID:
                return Optional.of(new VoidLiteralNode(token));
            case LPAREN:
                return parseGroupedExpression();
            case ADD:
            case SUB:
                return parsePrefixOperator(token);
            case TYPEOF:
                return parseTypeOf(token);
            case EOF:
                reportError("unexpected end of input");
                return Optional.empty();
            default:
                reportError("no prefix parse function for " + token.type().display() + " found");
                return Optional.empty();
        }
    }

    private Optional<ExpressionNode> parseIntegerLiteral(Token token) {
        try {
            return Optional.of(new IntegerLiteralNode(token, Long.parseLong(token.text())));
        } catch (NumberFormatException e) {
            reportError(String.format("could not parse \"%s\" as integer", token.text()));
            return Optional.empty();
        }
    }

    private Optional<ExpressionNode> parseFloatLiteral(Token token) {
        try {
            return Optional.of(new FloatLiteralNode(token, Double.parseDouble(token.text())));
        } catch (NumberFormatException e) {
            reportError(String.format("could not parse \"%s\" as float", token.text()));
            return Optional.empty();
        }
    }

    private Optional<ExpressionNode> parseGroupedExpression() {
        nextToken();
        Optional<ExpressionNode> inner = parseExpression(Precedence.LOWEST);
        if (inner.isEmpty() || !expectPeek(TokenType.RPAREN)) {
            return Optional.empty();
        }
        return inner;
    }

    private Optional<ExpressionNode> parsePrefixOperator(Token operator) {
        nextToken();
        return parseExpression(Precedence.PREFIX)
                .map(operand -> new PrefixExpressionNode(operator, operator.text(), operand));
    }

    private Optional<ExpressionNode> parseTypeOf(Token token) {
        if (!expectPeek(TokenType.LPAREN)) {
            return Optional.empty();
        }
        nextToken();
        Optional<ExpressionNode> operand = parseExpression(Precedence.LOWEST);
        if (operand.isEmpty() || !expectPeek(TokenType.RPAREN)) {
            return Optional.empty();
        }
        return Optional.of(new TypeOfExpressionNode(token, operand.get()));
    }

    private Optional<ExpressionNode> parseInfix(ExpressionNode left) {
        Token operator = current;
        if (operator.is(TokenType.LPAREN)) {
            reportError("no infix parse function for " + operator.type().display() + " found");
            return Optional.empty();
        }
        Precedence precedence = Precedence.of(operator.type());
        nextToken();
        return parseExpression(precedence)
                .map(right -> new InfixExpressionNode(operator, operator.text(), left, right));
    }

    @Override
    public boolean expectPeek(TokenType type) {
        if (peekIs(type)) {
            nextToken();
            return true;
        }
        diagnostics.reportError(String.format("expected next token to be %s, got %s instead",
                type.display(), peek.type().display()), fileName, peek.line());
        return false;
    }

    @Override
    public void nextToken() {
        current = peek;
        peek = peekNext;
        peekNext = lexer.nextToken();
    }

    @Override
    public Token current() {
        return current;
    }

    @Override
    public Token peek() {
        return peek;
    }

    @Override
    public boolean curIs(TokenType type) {
        return current.type() == type;
    }

    @Override
    public boolean peekIs(TokenType type) {
        return peek.type() == type;
    }

    @Override
    public boolean peekNextIs(TokenType type) {
        return peekNext.type() == type;
    }

    @Override
    public void reportError(String message) {
        diagnostics.reportError(message, fileName, current.line());
    }
}
