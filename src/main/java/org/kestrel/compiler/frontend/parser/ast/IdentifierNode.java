package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.Objects;

/**
 * An AST node that represents an identifier (e.g., a variable or function name).
 *
 * @param token The IDENT token.
 * @param name The name of the identifier.
 */
public record IdentifierNode(Token token, String name) implements ExpressionNode {

    public IdentifierNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(name, "name");
    }

    /**
     * Creates an identifier named after the text of its token.
     * @param token The IDENT token.
     */
    public IdentifierNode(Token token) {
        this(token, token.text());
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitIdentifier(this);
    }

    @Override
    public String toString() {
        return name;
    }
}
