package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An ordered sequence of statements. Single-statement bodies written without braces
 * are wrapped in a block as well, so every body in the tree is a {@code BlockNode}.
 *
 * @param token The opening brace, or the first token of an unbraced body.
 * @param statements The statements in source order.
 */
public record BlockNode(Token token, List<StatementNode> statements) implements StatementNode {

    public BlockNode {
        Objects.requireNonNull(token, "token");
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBlock(this);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{ ");
        for (StatementNode statement : statements) {
            sb.append(statement).append(' ');
        }
        return sb.append('}').toString();
    }
}
