package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * A {@code break} statement.
 *
 * @param token The BREAK token.
 */
public record BreakStatementNode(Token token) implements StatementNode {

    public BreakStatementNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitBreakStatement(this);
    }

    @Override
    public String toString() {
        return "break;";
    }
}
