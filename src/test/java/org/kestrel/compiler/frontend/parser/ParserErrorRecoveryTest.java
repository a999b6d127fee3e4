package org.kestrel.compiler.frontend.parser;

import org.kestrel.compiler.diagnostics.Diagnostic;
import org.kestrel.compiler.diagnostics.DiagnosticsEngine;
import org.kestrel.compiler.frontend.lexer.Lexer;
import org.kestrel.compiler.frontend.parser.ast.AstNode;
import org.kestrel.compiler.frontend.parser.ast.FunctionNode;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;
import org.kestrel.compiler.frontend.parser.ast.VariableDeclarationNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests how the {@link Parser} reports syntax errors and how it recovers from them.
 * A single defect must produce a single error, and the statements around it must survive.
 */
@Tag("unit")
public class ParserErrorRecoveryTest {

    private DiagnosticsEngine diagnostics;
    private Parser parser;

    private ProgramNode parse(String source) {
        diagnostics = new DiagnosticsEngine();
        parser = new Parser(new Lexer(source), diagnostics, "test.ks");
        return parser.parseProgram();
    }

    @Test
    void testEachMalformedIfReportsOneError() {
        // Act
        ProgramNode program = parse("if x) {1} if y) {2}");

        // Assert
        assertThat(program.statements()).isEmpty();
        assertThat(parser.getErrors()).containsExactly(
                "expected next token to be (, got IDENT instead",
                "expected next token to be (, got IDENT instead");
    }

    /**
     * A parenthesis right after a complete expression would be a call, which the language does not have.
     */
    @Test
    void testCallSyntaxIsRejected() {
        // Act
        ProgramNode program = parse("foo(1)");

        // Assert
        assertThat(program.statements()).isEmpty();
        assertThat(parser.getErrors()).containsExactly("no infix parse function for ( found");
    }

    @Test
    void testCallSyntaxInsideExpressionIsRejected() {
        // Act
        ProgramNode program = parse("int a = 1 + f(2);\nint b = 3;");

        // Assert
        assertThat(parser.getErrors()).containsExactly("no infix parse function for ( found");
        assertThat(program.toString()).isEqualTo("int b = 3;\n");
    }

    @Test
    void testMalformedElseIfReportsOneError() {
        // Act
        ProgramNode program = parse("if (a) {1} else if b) {2} else {3}\nx;");

        // Assert
        assertThat(parser.getErrors()).containsExactly("expected next token to be (, got IDENT instead");
        assertThat(program.toString()).isEqualTo("x\n");
    }

    @Test
    void testMalformedElseIfWithoutBracesReportsOneError() {
        // Act
        ProgramNode program = parse("fn f() { if (a) x; else if b) y; else z; return 1; }");

        // Assert
        assertThat(parser.getErrors()).containsExactly("expected next token to be (, got IDENT instead");
        assertThat(program.statements()).singleElement()
                .isInstanceOfSatisfying(FunctionNode.class,
                        f -> assertThat(f.body().toString()).isEqualTo("{ return 1; }"));
    }

    @Test
    void testMissingInitializerDoesNotSwallowNextStatement() {
        // Act
        ProgramNode program = parse("int a = ; int b = 2;");

        // Assert
        assertThat(parser.getErrors()).containsExactly("no prefix parse function for ; found");
        assertThat(program.statements()).singleElement()
                .isInstanceOfSatisfying(VariableDeclarationNode.class,
                        d -> assertThat(d.name().name()).isEqualTo("b"));
    }

    /**
     * A broken statement inside a function body must not consume the closing brace of the body.
     */
    @Test
    void testErrorInsideBlockKeepsEnclosingFunction() {
        // Act
        ProgramNode program = parse("fn f() { int a = ; return 1; }\nint after = 3;");

        // Assert
        assertThat(parser.getErrors()).hasSize(1);
        assertThat(program.statements()).hasSize(2);
        FunctionNode function = (FunctionNode) program.statements().get(0);
        assertThat(function.body().toString()).isEqualTo("{ return 1; }");
        assertThat(program.statements().get(1).toString()).isEqualTo("int after = 3;");
    }

    @Test
    void testUnterminatedBlockIsReportedButKept() {
        // Act
        ProgramNode program = parse("fn f() { return 1;");

        // Assert
        assertThat(parser.getErrors()).containsExactly("expected next token to be }, got EOF instead");
        assertThat(program.statements()).singleElement().isInstanceOf(FunctionNode.class);
    }

    @Test
    void testStrayClosingBraceIsSkipped() {
        // Act
        ProgramNode program = parse("} x; }");

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(program.toString()).isEqualTo("x\n");
    }

    @Test
    void testIllegalTokenHasNoPrefixFunction() {
        // Act
        parse("@");

        // Assert
        assertThat(parser.getErrors()).containsExactly(
                "no prefix parse function for ILLEGAL found",
                "unexpected token: @");
    }

    @Test
    void testUnexpectedClosingParenthesis() {
        // Act
        parse("int x = );");

        // Assert
        assertThat(parser.getErrors()).containsExactly("no prefix parse function for ) found");
    }

    @Test
    void testIntegerLiteralOutOfRange() {
        // Act
        parse("99999999999999999999");

        // Assert
        assertThat(parser.getErrors()).first()
                .isEqualTo("could not parse \"99999999999999999999\" as integer");
    }

    @Test
    void testParameterWithoutType() {
        // Act
        ProgramNode program = parse("int f(x) { }");

        // Assert
        assertThat(program.statements()).isEmpty();
        assertThat(parser.getErrors()).containsExactly("expected parameter type, got IDENT");
    }

    @Test
    void testMissingBodyAtEndOfInput() {
        // Act
        parse("if (x)");

        // Assert
        assertThat(parser.getErrors()).containsExactly("expected statement, got EOF instead");
    }

    @Test
    void testDanglingOperatorReportsEndOfInput() {
        // Act
        parse("1 +");

        // Assert
        assertThat(parser.getErrors()).containsExactly("unexpected end of input");
    }

    @Test
    void testDiagnosticsCarryFileAndLine() {
        // Act
        parse("int a = 1;\nif x) { }");

        // Assert
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.fileName()).isEqualTo("test.ks");
            assertThat(d.lineNumber()).isEqualTo(2);
        });
    }

    @Test
    void testGarbageInputTerminates() {
        // Act
        ProgramNode program = parse("} } ) ( { if while fn");

        // Assert
        assertThat(program.statements()).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    /**
     * Every node of a successfully parsed tree must be owned by exactly one parent.
     */
    @Test
    void testNoNodeIsReachableTwice() {
        // Arrange
        String source = "int fn main(int x, string y) {\n"
                + "  if (x > 1) { return x; } else if (x < 0) return -x; else { return typeof(y) == \"string\"; }\n"
                + "  while (x) { x; }\n"
                + "  for (c in y) { continue; }\n"
                + "  loop { break; }\n"
                + "}\n";

        // Act
        ProgramNode program = parse(source);

        // Assert
        assertThat(diagnostics.hasErrors()).isFalse();
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<AstNode> pending = new ArrayDeque<>();
        pending.push(program);
        int visited = 0;
        while (!pending.isEmpty()) {
            AstNode node = pending.pop();
            assertThat(seen.add(node)).as("node visited twice: %s", node).isTrue();
            visited++;
            node.getChildren().forEach(pending::push);
        }
        assertThat(visited).isGreaterThan(20);
    }
}
