package org.kestrel.compiler.frontend.parser.ast;

import org.kestrel.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;

/**
 * An AST node for {@code typeof(expr)}.
 *
 * @param token The TYPEOF token.
 * @param operand The expression whose type is queried.
 */
public record TypeOfExpressionNode(Token token, ExpressionNode operand) implements ExpressionNode {

    public TypeOfExpressionNode {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public List<AstNode> getChildren() {
        return List.of(operand);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitTypeOfExpression(this);
    }

    @Override
    public String toString() {
        return "typeof(" + operand + ")";
    }
}
