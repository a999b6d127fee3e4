package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node that represents a string literal. No escape sequences are processed;
 * the value is the raw text between the quotes.
 *
 * @param token The STRING token.
 * @param value The text between the quotes.
 */
public record StringLiteralNode(Token token, String value) implements ExpressionNode {

    public StringLiteralNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(value, "value");
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitStringLiteral(this);
    }

    @Override
    public String toString() {
        return "\"" + value + "\"";
    }
}
