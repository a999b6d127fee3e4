package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code if} statement with any number of {@code else if} arms and an optional
 * {@code else} block. The arms are kept in source order.
 *
 * @param token The IF token.
 * @param condition The condition of the leading {@code if}.
 * @param thenBlock The body executed when the condition holds.
 * @param elseIfs The {@code else if} arms in source order.
 * @param elseBlock The trailing {@code else} block, if present.
 */
public record IfStatementNode(
        Token token,
        ExpressionNode condition,
        BlockNode thenBlock,
        List<ElseIfClause> elseIfs,
        Optional<BlockNode> elseBlock
) implements StatementNode {

    public IfStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(thenBlock, "thenBlock");
        Objects.requireNonNull(elseBlock, "elseBlock");
        elseIfs = List.copyOf(elseIfs);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(condition);
        children.add(thenBlock);
        children.addAll(elseIfs);
        elseBlock.ifPresent(children::add);
        return children;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitIfStatement(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("if (").append(condition).append(") ").append(thenBlock);
        for (ElseIfClause clause : elseIfs) {
            sb.append(' ').append(clause);
        }
        elseBlock.ifPresent(block -> sb.append(" else ").append(block));
        return sb.toString();
    }
}
