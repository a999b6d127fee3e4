package org.kestrel.compiler.frontend.parser.features.loop;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.ForStatementNode;
import org.kestrel.compiler.frontend.parser.ast.IdentifierNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles {@code for (name in iterable) { ... }}. The body must be braced.
 */
public class ForStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token forToken = context.current();
        if (!context.expectPeek(TokenType.LPAREN) || !context.expectPeek(TokenType.IDENT)) {
            return Optional.empty();
        }
        IdentifierNode variable = new IdentifierNode(context.current());
        if (!context.expectPeek(TokenType.IN)) {
            return Optional.empty();
        }
        context.nextToken();
        Optional<ExpressionNode> iterable = context.parseExpression(Precedence.LOWEST);
        if (iterable.isEmpty()
                || !context.expectPeek(TokenType.RPAREN)
                || !context.expectPeek(TokenType.LBRACE)) {
            return Optional.empty();
        }
        return Optional.of(new ForStatementNode(forToken, variable, iterable.get(), context.parseBlock()));
    }
}
