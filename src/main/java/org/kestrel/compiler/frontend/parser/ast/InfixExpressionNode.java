package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for a binary operation. The rendering is fully parenthesized,
 * so {@code 1 + 2 * 3} renders as {@code (1 + (2 * 3))}.
 *
 * @param token The operator token.
 * @param operator The operator text.
 * @param left The left operand.
 * @param right The right operand.
 */
public record InfixExpressionNode(Token token, String operator, ExpressionNode left, ExpressionNode right)
        implements ExpressionNode {

    public InfixExpressionNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(left, right);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitInfixExpression(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
