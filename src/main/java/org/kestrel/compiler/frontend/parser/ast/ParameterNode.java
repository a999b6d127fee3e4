package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * A typed function parameter such as {@code int x}.
 *
 * @param type The TYPE token of the parameter.
 * @param name The parameter name.
 */
public record ParameterNode(Token type, IdentifierNode name) implements AstNode {

    public ParameterNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(name);
    }

    @Override
    public String toString() {
        return type.text() + " " + name;
    }
}
