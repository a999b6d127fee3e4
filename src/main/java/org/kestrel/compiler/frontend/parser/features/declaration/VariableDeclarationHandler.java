package org.kestrel.compiler.frontend.parser.features.declaration;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.IdentifierNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles {@code <type> <name> = <expr> [;]}. The initializer is mandatory;
 * a missing name or {@code =} is reported by {@link ParsingContext#expectPeek}.
 */
public class VariableDeclarationHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token type = context.current();
        if (!context.expectPeek(TokenType.IDENT)) {
            return Optional.empty();
        }
        IdentifierNode name = new IdentifierNode(context.current());
        if (!context.expectPeek(TokenType.ASSIGN)) {
            return Optional.empty();
        }
        context.nextToken();
        Optional<ExpressionNode> initializer = context.parseExpression(Precedence.LOWEST);
        if (initializer.isEmpty()) {
            return Optional.empty();
        }
        if (context.peekIs(TokenType.SEMICOLON)) {
            context.nextToken();
        }
        return Optional.of(new VariableDeclarationNode(type, name, initializer.get()));
    }
}
