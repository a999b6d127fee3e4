package org.kestrel.compiler.frontend.parser.ast;

/**
 * An AST node that forms a statement of a program or block. The set of statement kinds
 * is closed; consumers dispatch over it with a {@link StatementVisitor}.
 */
public sealed interface StatementNode extends AstNode permits
        ExpressionStatementNode,
        VariableDeclarationNode,
        ReturnStatementNode,
        BreakStatementNode,
        ContinueStatementNode,
        BlockNode,
        IfStatementNode,
        WhileStatementNode,
        LoopStatementNode,
        ForStatementNode,
        FunctionNode {

    /**
     * Dispatches to the matching method of the visitor.
     * @param visitor The visitor.
     * @param <R> The result type of the visitor.
     * @return The visitor's result for this node.
     */
    <R> R accept(StatementVisitor<R> visitor);
}
