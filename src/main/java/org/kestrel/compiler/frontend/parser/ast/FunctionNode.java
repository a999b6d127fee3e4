package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A function declaration. Both {@code int add(int a, int b) { ... }} and
 * {@code fn add(int a, int b) { ... }} produce this node; the latter carries a
 * synthetic {@code void} return type unless a type precedes the {@code fn} keyword.
 *
 * @param token The first token of the declaration.
 * @param returnType The return type token.
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param body The function body.
 */
public record FunctionNode(
        Token token,
        Token returnType,
        IdentifierNode name,
        List<ParameterNode> parameters,
        BlockNode body
) implements StatementNode {

    public FunctionNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(returnType, "returnType");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(body, "body");
        parameters = List.copyOf(parameters);
    }

    @Override
    public List<AstNode> getChildren() {
        List<AstNode> children = new ArrayList<>();
        children.add(name);
        children.addAll(parameters);
        children.add(body);
        return children;
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitFunction(this);
    }

    @Override
    public String toString() {
        String params = parameters.stream().map(ParameterNode::toString).collect(Collectors.joining(", "));
        return returnType.text() + " " + name + "(" + params + ") " + body;
    }
}
