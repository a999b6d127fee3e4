package org.kestrel.compiler.frontend.parser.ast;

/**
 * A visitor over all statement kinds. Implementations must handle every kind;
 * adding a node kind breaks every implementation at compile time.
 *
 * @param <R> The result type.
 */
public interface StatementVisitor<R> {
    R visitExpressionStatement(ExpressionStatementNode node);

    R visitVariableDeclaration(VariableDeclarationNode node);

    R visitReturnStatement(ReturnStatementNode node);

    R visitBreakStatement(BreakStatementNode node);

    R visitContinueStatement(ContinueStatementNode node);

    R visitBlock(BlockNode node);

    R visitIfStatement(IfStatementNode node);

    R visitWhileStatement(WhileStatementNode node);

    R visitLoopStatement(LoopStatementNode node);

    R visitForStatement(ForStatementNode node);

    R visitFunction(FunctionNode node);
}
