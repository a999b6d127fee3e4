package org.kestrel.compiler.frontend.parser.ast;

/**
 * A visitor over all expression kinds. Implementations must handle every kind;
 * adding a node kind breaks every implementation at compile time.
 *
 * @param <R> The result type.
 */
public interface ExpressionVisitor<R> {
    R visitIdentifier(IdentifierNode node);

    R visitIntegerLiteral(IntegerLiteralNode node);

    R visitFloatLiteral(FloatLiteralNode node);

    R visitStringLiteral(StringLiteralNode node);

    R visitBooleanLiteral(BooleanLiteralNode node);

    R visitNilLiteral(NilLiteralNode node);

    R visitVoidLiteral(VoidLiteralNode node);

    R visitPrefixExpression(PrefixExpressionNode node);

    R visitInfixExpression(InfixExpressionNode node);

    R visitTypeOfExpression(TypeOfExpressionNode node);
}
