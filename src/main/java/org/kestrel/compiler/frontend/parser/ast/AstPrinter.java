package org.kestrel.compiler.frontend.parser.ast;

/**
 * Renders an AST as an indented tree, one node per line, for inspection on the command line.
 * Unlike the canonical {@code toString()} rendering, this output shows the node kinds
 * and the role each child plays in its parent.
 * <pre>
 * Program
 *   VariableDeclaration int x
 *     InfixExpression +
 *       IntegerLiteral 1
 *       IntegerLiteral 2
 * </pre>
 */
public final class AstPrinter implements ExpressionVisitor<Void>, StatementVisitor<Void> {

    private static final String INDENT = "  ";

    private final StringBuilder out = new StringBuilder();
    private int depth = 0;

    private AstPrinter() {}

    /**
     * Renders a whole program.
     * @param program The program to render.
     * @return The indented tree, terminated by a newline.
     */
    public static String print(ProgramNode program) {
        AstPrinter printer = new AstPrinter();
        printer.line("Program");
        printer.nested(() -> program.statements().forEach(printer::statement));
        return printer.out.toString();
    }

    /**
     * Renders a single expression.
     * @param expression The expression to render.
     * @return The indented tree, terminated by a newline.
     */
    public static String print(ExpressionNode expression) {
        AstPrinter printer = new AstPrinter();
        printer.expression(expression);
        return printer.out.toString();
    }

    @Override
    public Void visitIdentifier(IdentifierNode node) {
        line("Identifier " + node.name());
        return null;
    }

    @Override
    public Void visitIntegerLiteral(IntegerLiteralNode node) {
        line("IntegerLiteral " + node.value());
        return null;
    }

    @Override
    public Void visitFloatLiteral(FloatLiteralNode node) {
        line("FloatLiteral " + node.token().text());
        return null;
    }

    @Override
    public Void visitStringLiteral(StringLiteralNode node) {
        line("StringLiteral " + node);
        return null;
    }

    @Override
    public Void visitBooleanLiteral(BooleanLiteralNode node) {
        line("BooleanLiteral " + node.value());
        return null;
    }

    @Override
    public Void visitNilLiteral(NilLiteralNode node) {
        line("NilLiteral");
        return null;
    }

    @Override
    public Void visitVoidLiteral(VoidLiteralNode node) {
        line("VoidLiteral");
        return null;
    }

    @Override
    public Void visitPrefixExpression(PrefixExpressionNode node) {
        line("PrefixExpression " + node.operator());
        nested(() -> expression(node.operand()));
        return null;
    }

    @Override
    public Void visitInfixExpression(InfixExpressionNode node) {
        line("InfixExpression " + node.operator());
        nested(() -> {
            expression(node.left());
            expression(node.right());
        });
        return null;
    }

    @Override
    public Void visitTypeOfExpression(TypeOfExpressionNode node) {
        line("TypeOf");
        nested(() -> expression(node.operand()));
        return null;
    }

    @Override
    public Void visitExpressionStatement(ExpressionStatementNode node) {
        line("ExpressionStatement");
        nested(() -> expression(node.expression()));
        return null;
    }

    @Override
    public Void visitVariableDeclaration(VariableDeclarationNode node) {
        line("VariableDeclaration " + node.type().text() + " " + node.name());
        nested(() -> expression(node.initializer()));
        return null;
    }

    @Override
    public Void visitReturnStatement(ReturnStatementNode node) {
        line("ReturnStatement");
        node.value().ifPresent(value -> nested(() -> expression(value)));
        return null;
    }

    @Override
    public Void visitBreakStatement(BreakStatementNode node) {
        line("BreakStatement");
        return null;
    }

    @Override
    public Void visitContinueStatement(ContinueStatementNode node) {
        line("ContinueStatement");
        return null;
    }

    @Override
    public Void visitBlock(BlockNode node) {
        line("Block");
        nested(() -> node.statements().forEach(this::statement));
        return null;
    }

    @Override
    public Void visitIfStatement(IfStatementNode node) {
        line("IfStatement");
        nested(() -> {
            labeled("condition", () -> expression(node.condition()));
            labeled("then", () -> statement(node.thenBlock()));
            for (ElseIfClause clause : node.elseIfs()) {
                labeled("else if", () -> {
                    expression(clause.condition());
                    statement(clause.block());
                });
            }
            node.elseBlock().ifPresent(block -> labeled("else", () -> statement(block)));
        });
        return null;
    }

    @Override
    public Void visitWhileStatement(WhileStatementNode node) {
        line("WhileStatement");
        nested(() -> {
            labeled("condition", () -> expression(node.condition()));
            statement(node.block());
        });
        return null;
    }

    @Override
    public Void visitLoopStatement(LoopStatementNode node) {
        line("LoopStatement");
        nested(() -> statement(node.block()));
        return null;
    }

    @Override
    public Void visitForStatement(ForStatementNode node) {
        line("ForStatement " + node.variable());
        nested(() -> {
            labeled("in", () -> expression(node.iterable()));
            statement(node.block());
        });
        return null;
    }

    @Override
    public Void visitFunction(FunctionNode node) {
        line("Function " + node.returnType().text() + " " + node.name());
        nested(() -> {
            node.parameters().forEach(parameter -> line("Parameter " + parameter));
            statement(node.body());
        });
        return null;
    }

    private void statement(StatementNode node) {
        node.accept(this);
    }

    private void expression(ExpressionNode node) {
        node.accept(this);
    }

    private void labeled(String label, Runnable body) {
        line(label + ":");
        nested(body);
    }

    private void nested(Runnable body) {
        depth++;
        try {
            body.run();
        } finally {
            depth--;
        }
    }

    private void line(String text) {
        out.append(INDENT.repeat(depth)).append(text).append('\n');
    }
}
