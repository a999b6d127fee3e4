package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node that represents a floating-point literal.
 *
 * @param token The FLOAT token, which also provides the rendering.
 * @param value The parsed 64-bit value.
 */
public record FloatLiteralNode(Token token, double value) implements ExpressionNode {

    public FloatLiteralNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitFloatLiteral(this);
    }

    @Override
    public String toString() {
        return token.text();
    }
}
