package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * A statement consisting of a single expression. Renders as the expression alone.
 *
 * @param token The first token of the expression.
 * @param expression The expression.
 */
public record ExpressionStatementNode(Token token, ExpressionNode expression) implements StatementNode {

    public ExpressionStatementNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(expression, "expression");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(expression);
    }

    @Override
    public <R> R accept(StatementVisitor<R> visitor) {
        return visitor.visitExpressionStatement(this);
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
