package org.kestrel.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * <p>
 * Nodes are immutable records. Every node is created exactly once by the parse function
 * that owns it, and its children are complete before it is constructed: a child that
 * failed to parse never appears as {@code null}, the parent is simply not built.
 * The {@link Object#toString()} of every node is its canonical source rendering.
 */
public sealed interface AstNode permits ExpressionNode, StatementNode, ParameterNode, ElseIfClause, ProgramNode {
    /**
     * Returns a list of the direct child nodes in source order.
     * This allows generic traversals without knowing the structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return List.of();
    }
}
