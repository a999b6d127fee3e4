package org.kestrel.compiler.frontend.parser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The root of the tree: the top-level statements of one source text.
 * Renders each statement followed by a newline.
 *
 * @param statements The top-level statements in source order.
 */
public record ProgramNode(List<StatementNode> statements) implements AstNode {

    public ProgramNode {
        statements = List.copyOf(statements);
    }

    @Override
    public List<AstNode> getChildren() {
        return new ArrayList<>(statements);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (StatementNode statement : statements) {
            sb.append(statement).append('\n');
        }
        return sb.toString();
    }
}
