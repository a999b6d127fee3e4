package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for the {@code void} literal.
 *
 * @param token The VOID token.
 */
public record VoidLiteralNode(Token token) implements ExpressionNode {

    public VoidLiteralNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVoidLiteral(this);
    }

    @Override
    public String toString() {
        return token.text();
    }
}
