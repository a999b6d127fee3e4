package org.kestrel.compiler.frontend.parser.features.function;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.ast.BlockNode;
import org.kestrel.compiler.frontend.parser.ast.FunctionNode;
import org.kestrel.compiler.frontend.parser.ast.IdentifierNode;
import org.kestrel.compiler.frontend.parser.ast.ParameterNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles function declarations. Registered for {@code fn}/{@code func}, which declares a
 * function returning {@code void}; the typed forms are routed here by the declaration handler.
 * <pre>
 *     fn log(string message) { ... }
 *     int add(int a, int b) { ... }
 * </pre>
 */
public class FunctionStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token fnToken = context.current();
        return parseNamedFunction(context, fnToken, Token.synthetic(TokenType.VOID, "void"));
    }

    /**
     * Parses the name, parameter list and body of a function. The current token is the token
     * right before the name.
     *
     * @param context The parsing context.
     * @param start The first token of the declaration.
     * @param returnType The return type of the function.
     * @return The function, or empty if any part of it failed.
     */
    public Optional<StatementNode> parseNamedFunction(ParsingContext context, Token start, Token returnType) {
        if (!context.expectPeek(TokenType.IDENT)) {
            return Optional.empty();
        }
        IdentifierNode name = new IdentifierNode(context.current());
        if (!context.expectPeek(TokenType.LPAREN)) {
            return Optional.empty();
        }
        Optional<List<ParameterNode>> parameters = parseParameters(context);
        if (parameters.isEmpty() || !context.expectPeek(TokenType.LBRACE)) {
            return Optional.empty();
        }
        BlockNode body = context.parseBlock();
        return Optional.of(new FunctionNode(start, returnType, name, parameters.get(), body));
    }

    private Optional<List<ParameterNode>> parseParameters(ParsingContext context) {
        List<ParameterNode> parameters = new ArrayList<>();
        if (context.peekIs(TokenType.RPAREN)) {
            context.nextToken();
            return Optional.of(parameters);
        }

        context.nextToken();
        Optional<ParameterNode> first = parseParameter(context);
        if (first.isEmpty()) {
            return Optional.empty();
        }
        parameters.add(first.get());

        while (context.peekIs(TokenType.COMMA)) {
            context.nextToken(); // consume ','
            context.nextToken();
            Optional<ParameterNode> next = parseParameter(context);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            parameters.add(next.get());
        }

        if (!context.expectPeek(TokenType.RPAREN)) {
            return Optional.empty();
        }
        return Optional.of(parameters);
    }

    private Optional<ParameterNode> parseParameter(ParsingContext context) {
        if (!context.curIs(TokenType.TYPE)) {
            context.reportError("expected parameter type, got " + context.current().type().display());
            return Optional.empty();
        }
        Token type = context.current();
        if (!context.expectPeek(TokenType.IDENT)) {
            return Optional.empty();
        }
        return Optional.of(new ParameterNode(type, new IdentifierNode(context.current())));
    }
}
