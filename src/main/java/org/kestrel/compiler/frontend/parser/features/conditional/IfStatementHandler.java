package org.kestrel.compiler.frontend.parser.features.conditional;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.Precedence;
import org.kestrel.compiler.frontend.parser.ast.BlockNode;
import org.kestrel.compiler.frontend.parser.ast.ElseIfClause;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.IfStatementNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles {@code if (cond) body [else if (cond) body]* [else body]}.
 * Each body is either a braced block or a single statement.
 * The chain ends at the first plain {@code else}.
 */
public class IfStatementHandler implements IStatementHandler {

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token ifToken = context.current();

        Optional<ExpressionNode> condition = parseCondition(context);
        if (condition.isEmpty()) {
            return Optional.empty();
        }
        Optional<BlockNode> thenBlock = context.parseBody();
        if (thenBlock.isEmpty()) {
            return Optional.empty();
        }

        List<ElseIfClause> elseIfs = new ArrayList<>();
        Optional<BlockNode> elseBlock = Optional.empty();
        while (context.peekIs(TokenType.ELSE)) {
            context.nextToken(); // consume 'else'
            if (context.peekIs(TokenType.IF)) {
                context.nextToken(); // consume 'if'
                Optional<ExpressionNode> elseIfCondition = parseCondition(context);
                if (elseIfCondition.isEmpty()) {
                    return Optional.empty();
                }
                Optional<BlockNode> elseIfBlock = context.parseBody();
                if (elseIfBlock.isEmpty()) {
                    return Optional.empty();
                }
                elseIfs.add(new ElseIfClause(elseIfCondition.get(), elseIfBlock.get()));
            } else {
                elseBlock = context.parseBody();
                if (elseBlock.isEmpty()) {
                    return Optional.empty();
                }
                break;
            }
        }

        return Optional.of(new IfStatementNode(ifToken, condition.get(), thenBlock.get(), elseIfs, elseBlock));
    }

    private Optional<ExpressionNode> parseCondition(ParsingContext context) {
        if (!context.expectPeek(TokenType.LPAREN)) {
            return Optional.empty();
        }
        context.nextToken();
        Optional<ExpressionNode> condition = context.parseExpression(Precedence.LOWEST);
        if (condition.isEmpty() || !context.expectPeek(TokenType.RPAREN)) {
            return Optional.empty();
        }
        return condition;
    }
}
