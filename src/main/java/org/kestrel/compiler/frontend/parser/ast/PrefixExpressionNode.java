package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for a unary prefix operation such as {@code -x}.
 *
 * @param token The operator token.
 * @param operator The operator text.
 * @param operand The operand.
 */
public record PrefixExpressionNode(Token token, String operator, ExpressionNode operand) implements ExpressionNode {

    public PrefixExpressionNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitPrefixExpression(this);
    }

    @Override
    public String toString() {
        return "(" + operator + operand + ")";
    }
}
