package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * A {@code for (variable in iterable) block} loop.
 *
 * @param token The FOR token.
 * @param variable The loop variable.
 * @param iterable The expression iterated over.
 * @param block The loop body.
 */
public record ForStatementNode(Token token, IdentifierNode variable, ExpressionNode iterable, BlockNode block)
        implements StatementNode {

    public ForStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(iterable, "iterable");
        Objects.requireNonNull(block, "block");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(variable, iterable, block);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitForStatement(this);
    }

    @Override
    public String toString() {
        return "for (" + variable + " in " + iterable + ") " + block;
    }
}
