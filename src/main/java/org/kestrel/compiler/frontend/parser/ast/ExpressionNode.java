package org.kestrel.compiler.frontend.parser.ast;

/**
 * An AST node that produces a value. The set of expression kinds is closed;
 * consumers dispatch over it with an {@link ExpressionVisitor}.
 */
public sealed interface ExpressionNode extends AstNode permits
        IdentifierNode,
        IntegerLiteralNode,
        FloatLiteralNode,
        StringLiteralNode,
        BooleanLiteralNode,
        NilLiteralNode,
        VoidLiteralNode,
        PrefixExpressionNode,
        InfixExpressionNode,
        TypeOfExpressionNode {

    /**
     * Dispatches to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <R> R accept(ExpressionVisitor<R> visitor);
}
