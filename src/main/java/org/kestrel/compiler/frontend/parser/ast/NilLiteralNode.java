package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node for {@code nil} (or its spelling {@code null}).
 *
 * @param token The NIL token.
 */
public record NilLiteralNode(Token token) implements ExpressionNode {

    public NilLiteralNode {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNilLiteral(this);
    }

    @Override
    public String toString() {
        return token.text();
    }
}
