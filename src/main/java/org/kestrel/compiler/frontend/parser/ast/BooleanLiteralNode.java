package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for {@code true} and {@code false}.
 *
 * @param token The BOOL token.
 * @param value The literal value.
 */
public record BooleanLiteralNode(Token token, boolean value) implements ExpressionNode {

    public BooleanLiteralNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBooleanLiteral(this);
    }

    @Override
    public String toString() {
        return token.text();
    }
}
