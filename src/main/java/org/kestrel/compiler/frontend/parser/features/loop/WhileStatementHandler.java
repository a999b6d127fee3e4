package org.kestrel.compiler.frontend.parser.features.loop;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.parser.ast.WhileStatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles {@code while (cond) { ... }}. The body must be braced.
 */
public class WhileStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token whileToken = context.current();
        if (!context.expectPeek(TokenType.LPAREN)) {
            return Optional.empty();
        }
        context.nextToken();
        Optional<ExpressionNode> condition = context.parseExpression(Precedence.LOWEST);
        if (condition.isEmpty()
                || !context.expectPeek(TokenType.RPAREN)
                || !context.expectPeek(TokenType.LBRACE)) {
            return Optional.empty();
        }
        return Optional.of(new WhileStatementNode(whileToken, condition.get(), context.parseBlock()));
    }
}
