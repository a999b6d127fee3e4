package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * A {@code continue} statement.
 *
 * @param token The CONTINUE token.
 */
public record ContinueStatementNode(Token token) implements StatementNode {

    public ContinueStatementNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitContinueStatement(this);
    }

    @Override
    public String toString() {
        return "continue;";
    }
}
