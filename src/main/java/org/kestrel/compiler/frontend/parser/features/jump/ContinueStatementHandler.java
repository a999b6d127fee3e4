package org.kestrel.compiler.frontend.parser.features.jump;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.ast.ContinueStatementNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles {@code continue [;]}.
 */
public class ContinueStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token continueToken = context.current();
        if (context.peekIs(TokenType.SEMICOLON)) {
            context.nextToken();
        }
        return Optional.of(new ContinueStatementNode(continueToken));
    }
}
