package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * A {@code while (condition) block} loop.
 *
 * @param token The WHILE token.
 * @param condition The loop condition.
 * @param block The loop body.
 */
public record WhileStatementNode(Token token, ExpressionNode condition, BlockNode block) implements StatementNode {

    public WhileStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(block, "block");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, block);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitWhileStatement(this);
    }

    @Override
    public String toString() {
        return "while (" + condition + ") " + block;
    }
}
