package org.kestrel.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * One {@code else if (condition) block} arm of an {@link IfStatementNode}.
 *
 * @param condition The condition of the arm.
 * @param block The body of the arm.
 */
public record ElseIfClause(ExpressionNode condition, BlockNode block) implements AstNode {

    public ElseIfClause {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(block, "block");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(condition, block);
    }

    @Override
    public String toString() {
        return "else if (" + condition + ") " + block;
    }
}
