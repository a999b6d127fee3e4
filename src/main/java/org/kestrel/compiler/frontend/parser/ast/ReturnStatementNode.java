package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A {@code return} statement with an optional value.
 *
 * @param token The RETURN token.
 * @param value The returned expression, empty for a bare {@code return;}.
 */
public record ReturnStatementNode(Token token, Optional<ExpressionNode> value) implements StatementNode {

    public ReturnStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public List<AstNode> getChildren() {
        return value.<List<AstNode>>map(List::of).orElse(List.of());
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitReturnStatement(this);
    }

    @Override
    public String toString() {
        return value.map(v -> "return " + v + ";").orElse("return;");
    }
}
