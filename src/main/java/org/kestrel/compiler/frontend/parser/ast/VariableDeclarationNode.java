package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * A typed variable declaration such as {@code int x = 5;}. The initializer is mandatory.
 *
 * @param type The TYPE token naming the declared type.
 * @param name The declared variable.
 * @param initializer The initializing expression.
 */
public record VariableDeclarationNode(Token type, IdentifierNode name, ExpressionNode initializer)
        implements StatementNode {

    public VariableDeclarationNode {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(initializer, "initializer");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(name, initializer);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitVariableDeclaration(this);
    }

    @Override
    public String toString() {
        return type.text() + " " + name + " = " + initializer + ";";
    }
}
