package org.kestrel.compiler.frontend.parser.features.jump;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.ReturnStatementNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles {@code return [expr] [;]}. A following {@code ;}, {@code }} or the end of input
 * makes the return bare.
 */
public class ReturnStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token returnToken = context.current();

        if (context.peekIs(TokenType.SEMICOLON)) {
            context.nextToken();
            return Optional.of(new ReturnStatementNode(returnToken, Optional.empty()));
        }
        if (context.peekIs(TokenType.RBRACE) || context.peekIs(TokenType.EOF)) {
            return Optional.of(new ReturnStatementNode(returnToken, Optional.empty()));
        }

        context.nextToken();
        Optional<ExpressionNode> value = context.parseExpression(Precedence.LOWEST);
        if (value.isEmpty()) {
            return Optional.empty();
        }
        if (context.peekIs(TokenType.SEMICOLON)) {
            context.nextToken();
        }
        return Optional.of(new ReturnStatementNode(returnToken, value));
    }
}
