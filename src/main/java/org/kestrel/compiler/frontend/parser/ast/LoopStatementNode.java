package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An unconditional {@code loop block}.
 *
 * @param token The LOOP token.
 * @param block The loop body.
 */
public record LoopStatementNode(Token token, BlockNode block) implements StatementNode {

    public LoopStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(block, "block");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(block);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitLoopStatement(this);
    }

    @Override
    public String toString() {
        return "loop " + block;
    }
}
