package org.kestrel.compiler.frontend.parser;

import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.lexer.Lexer;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ast.*;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify operator precedence, the statement grammar and the
 * disambiguation of statements that start with a type name.
 */
@Tag("unit")
public class ParserTest {

    private DiagnosticsEngine diagnostics;

    private ProgramNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        Parser parser = new Parser(new Lexer(source), diagnostics);
        return parser.parseProgram();
    }

    private StatementNode parseSingle(String source) {
        ProgramNode program = parse(source);
        assertThat(diagnostics.getErrorMessages()).isEmpty();
        assertThat(program.statements()).hasSize(1);
        return program.statements().get(0);
    }

    @ParameterizedTest
    @CsvSource(delimiterString = "=>", value = {
            "1 + 2 * 3           => (1 + (2 * 3))",
            "1 * 2 + 3           => ((1 * 2) + 3)",
            "a - b - c           => ((a - b) - c)",
            "a / b * c           => ((a / b) * c)",
            "-a * b              => ((-a) * b)",
            "--a                 => (-(-a))",
            "+a - b              => ((+a) - b)",
            "a < b == c > d      => ((a < b) == (c > d))",
            "a || b && c         => (a || (b && c))",
            "a && b || c         => ((a && b) || c)",
            "(1 + 2) * 3         => ((1 + 2) * 3)",
            "a + b % c <= d      => ((a + (b % c)) <= d)",
            "a != b >= c         => (a != (b >= c))",
            "1.5 + 2             => (1.5 + 2)",
            "-(a + b)            => (-(a + b))"
    })
    void testOperatorPrecedence(String source, String expected) {
        // Act
        StatementNode statement = parseSingle(source);

        // Assert
        assertThat(statement).isInstanceOf(ExpressionStatementNode.class);
        assertThat(statement.toString()).isEqualTo(expected);
    }

    @Test
    void testLiteralNodes() {
        // Act
        ProgramNode program = parse("42; 2.5; \"hi\"; true; false; nil; null; name;");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.statements())
                .extracting(s -> ((ExpressionStatementNode) s).expression())
                .satisfiesExactly(
                        e -> assertThat(((IntegerLiteralNode) e).value()).isEqualTo(42L),
                        e -> assertThat(((FloatLiteralNode) e).value()).isEqualTo(2.5),
                        e -> assertThat(((StringLiteralNode) e).value()).isEqualTo("hi"),
                        e -> assertThat(((BooleanLiteralNode) e).value()).isTrue(),
                        e -> assertThat(((BooleanLiteralNode) e).value()).isFalse(),
                        e -> assertThat(e).isInstanceOf(NilLiteralNode.class),
                        e -> assertThat(e.toString()).isEqualTo("null"),
                        e -> assertThat(((IdentifierNode) e).name()).isEqualTo("name"));
    }

    @Test
    void testTypeOfExpression() {
        // Act
        StatementNode statement = parseSingle("typeof(x + 1) == \"int\"");

        // Assert
        InfixExpressionNode comparison = (InfixExpressionNode) ((ExpressionStatementNode) statement).expression();
        assertThat(comparison.left()).isInstanceOf(TypeOfExpressionNode.class);
        assertThat(statement.toString()).isEqualTo("(typeof((x + 1)) == \"int\")");
    }

    /**
     * Verifies that a type followed by an identifier and '(' starts a function declaration.
     */
    @Test
    void testTypeIdentParenIsFunction() {
        // Act
        StatementNode statement = parseSingle("int foo() { }");

        // Assert
        assertThat(statement).isInstanceOf(FunctionNode.class);
        FunctionNode function = (FunctionNode) statement;
        assertThat(function.name().name()).isEqualTo("foo");
        assertThat(function.returnType().text()).isEqualTo("int");
        assertThat(function.parameters()).isEmpty();
        assertThat(function.body().statements()).isEmpty();
    }

    @Test
    void testTypeIdentAssignIsDeclaration() {
        // Act
        StatementNode statement = parseSingle("int foo = 1;");

        // Assert
        assertThat(statement).isInstanceOf(VariableDeclarationNode.class);
        VariableDeclarationNode declaration = (VariableDeclarationNode) statement;
        assertThat(declaration.type().text()).isEqualTo("int");
        assertThat(declaration.name().name()).isEqualTo("foo");
        assertThat(declaration.initializer()).isInstanceOf(IntegerLiteralNode.class);
        assertThat(declaration.toString()).isEqualTo("int foo = 1;");
    }

    @Test
    void testDeclarationWithoutInitializerReportsMissingAssign() {
        // Act
        ProgramNode program = parse("int foo");

        // Assert
        assertThat(program.statements()).isEmpty();
        assertThat(diagnostics.getErrorMessages()).containsExactly("expected next token to be =, got EOF instead");
    }

    /**
     * A void function whose body holds a bare return.
     */
    @Test
    void testVoidFunctionWithBareReturn() {
        // Act
        StatementNode statement = parseSingle("void test() { return; }");

        // Assert
        FunctionNode function = (FunctionNode) statement;
        assertThat(function.name().name()).isEqualTo("test");
        assertThat(function.parameters()).isEmpty();
        assertThat(function.returnType().text()).isEqualTo("void");
        assertThat(function.body().statements()).singleElement()
                .isInstanceOfSatisfying(ReturnStatementNode.class, r -> assertThat(r.value()).isEmpty());
        assertThat(function.toString()).isEqualTo("void test() { return; }");
    }

    @Test
    void testTypedFnKeywordFunction() {
        // Act
        StatementNode statement = parseSingle("int fn main(int x, string y) { return 123 + 4 * 5; }");

        // Assert
        FunctionNode function = (FunctionNode) statement;
        assertThat(function.returnType().text()).isEqualTo("int");
        assertThat(function.parameters()).extracting(ParameterNode::toString).containsExactly("int x", "string y");
        assertThat(function.toString()).isEqualTo("int main(int x, string y) { return (123 + (4 * 5)); }");
    }

    @Test
    void testUntypedFnDefaultsToVoid() {
        // Act
        StatementNode statement = parseSingle("func greet(string name) { }");

        // Assert
        FunctionNode function = (FunctionNode) statement;
        assertThat(function.returnType().type()).isEqualTo(TokenType.VOID);
        assertThat(function.toString()).isEqualTo("void greet(string name) { }");
    }

    /**
     * Verifies that else-if arms are kept in source order and the chain ends at the plain else.
     */
    @Test
    void testElseIfChainPreservesOrder() {
        // Arrange
        String source = "if (x > 10) { return x; } else if (x > 5) { return x + 1; } "
                + "else if (x > 1) { return 2; } else { return 0; }";

        // Act
        StatementNode statement = parseSingle(source);

        // Assert
        IfStatementNode ifStatement = (IfStatementNode) statement;
        assertThat(ifStatement.elseIfs()).extracting(c -> c.condition().toString())
                .containsExactly("(x > 5)", "(x > 1)");
        assertThat(ifStatement.elseBlock()).isPresent();
        assertThat(ifStatement.toString()).isEqualTo("if ((x > 10)) { return x; } else if ((x > 5)) { return (x + 1); } "
                + "else if ((x > 1)) { return 2; } else { return 0; }");
    }

    @Test
    void testUnbracedBodiesAreWrappedInBlocks() {
        // Act
        StatementNode statement = parseSingle("if (x > 10) return x; else return 0;");

        // Assert
        IfStatementNode ifStatement = (IfStatementNode) statement;
        assertThat(ifStatement.thenBlock().statements()).singleElement().isInstanceOf(ReturnStatementNode.class);
        assertThat(ifStatement.elseBlock()).get()
                .satisfies(block -> assertThat(block.statements()).singleElement().isInstanceOf(ReturnStatementNode.class));
        assertThat(ifStatement.toString()).isEqualTo("if ((x > 10)) { return x; } else { return 0; }");
    }

    @Test
    void testIfWithoutElse() {
        // Act
        IfStatementNode ifStatement = (IfStatementNode) parseSingle("if (ok) { go; }");

        // Assert
        assertThat(ifStatement.elseIfs()).isEmpty();
        assertThat(ifStatement.elseBlock()).isEmpty();
    }

    @Test
    void testLoopStatements() {
        // Act
        ProgramNode program = parse("while (x < 10) { x; } loop { break; } for (item in items) { continue; }");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.toString()).isEqualTo(
                "while ((x < 10)) { x }\n"
                        + "loop { break; }\n"
                        + "for (item in items) { continue; }\n");
    }

    @Test
    void testReturnForms() {
        // Act
        ProgramNode program = parse("fn a() { return } fn b() { return; } fn c() { return 1 + 2; } return");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.toString()).isEqualTo(
                "void a() { return; }\n"
                        + "void b() { return; }\n"
                        + "void c() { return (1 + 2); }\n"
                        + "return;\n");
    }

    @Test
    void testStringDeclarationRendering() {
        assertThat(parseSingle("string s = \"hi\";").toString()).isEqualTo("string s = \"hi\";");
    }

    @Test
    void testEmptyAndSemicolonOnlyInput() {
        assertThat(parse("").statements()).isEmpty();
        assertThat(parse(" ; ;; ").statements()).isEmpty();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void testNestedBlocks() {
        // Act
        StatementNode statement = parseSingle("fn f() { while (a) { if (b) { break; } else continue; } }");

        // Assert
        assertThat(statement.toString())
                .isEqualTo("void f() { while (a) { if (b) { break; } else { continue; } } }");
    }
}
