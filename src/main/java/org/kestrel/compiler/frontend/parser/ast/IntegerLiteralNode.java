package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node that represents an integer literal.
 *
 * @param token The INT token, which also provides the rendering.
 * @param value The parsed 64-bit value.
 */
public record IntegerLiteralNode(Token token, long value) implements ExpressionNode {

    public IntegerLiteralNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIntegerLiteral(this);
    }

    @Override
    public String toString() {
        return token.text();
    }
}
