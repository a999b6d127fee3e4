package org.kestrel.compiler.frontend.parser.features.loop;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.ast.LoopStatementNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles the unconditional {@code loop { ... }}.
 */
public class LoopStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token loopToken = context.current();
        if (!context.expectPeek(TokenType.LBRACE)) {
            return Optional.empty();
        }
        return Optional.of(new LoopStatementNode(loopToken, context.parseBlock()));
    }
}
