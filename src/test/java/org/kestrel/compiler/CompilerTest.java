package org.kestrel.compiler;

import org.kestrel.compiler.api.CompilationException;
import org.kestrel.compiler.api.ParseResult;
import org.kestrel.compiler.diagnostics.Diagnostic;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.FunctionNode;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests the public front end API of {@link Compiler}.
 */
@Tag("unit")
public class CompilerTest {

    private final Compiler compiler = new Compiler();

    @Test
    void testParseCollectsAllErrors() {
        // Act
        ParseResult result = compiler.parse("if x) { }\nint y = 1;\nint z", "broken.ks");

        // Assert
        assertThat(result.hasErrors()).isTrue();
        assertThat(result.program().statements()).hasSize(1);
        assertThat(result.diagnostics())
                .extracting(Diagnostic::fileName, Diagnostic::lineNumber, Diagnostic::message)
                .containsExactly(
                        tuple("broken.ks", 1, "expected next token to be (, got IDENT instead"),
                        tuple("broken.ks", 3, "expected next token to be =, got EOF instead"));
        assertThat(result.errors()).hasSize(2);
        assertThat(result.summary()).contains("[ERROR] broken.ks:1:");
    }

    @Test
    void testCompileReturnsProgramWithoutErrors() throws CompilationException {
        // Act
        ProgramNode program = compiler.compile("fn main() { return 1; }", "main.ks");

        // Assert
        assertThat(program.statements()).singleElement().isInstanceOf(FunctionNode.class);
    }

    @Test
    void testCompileThrowsWithEveryError() {
        assertThatThrownBy(() -> compiler.compile("int a = ;\nint b = );", "bad.ks"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("bad.ks:1: no prefix parse function for ; found")
                .hasMessageContaining("bad.ks:2: no prefix parse function for ) found");
    }

    @Test
    void testCompileFromFile(@TempDir Path tempDir) throws IOException, CompilationException {
        // Arrange
        Path source = tempDir.resolve("loop.ks");
        Files.writeString(source, "loop { break; }\n");

        // Act
        ProgramNode program = compiler.compile(source);

        // Assert
        assertThat(program.toString()).isEqualTo("loop { break; }\n");
    }

    @Test
    void testParseExpressionAcceptsTrailingSemicolon() throws CompilationException {
        // Act
        ExpressionNode expression = compiler.parseExpression("1 + 2 * x;");

        // Assert
        assertThat(expression.toString()).isEqualTo("(1 + (2 * x))");
    }

    @Test
    void testParseExpressionRejectsTrailingInput() {
        assertThatThrownBy(() -> compiler.parseExpression("1 2"))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("<expression>:1: unexpected token: 2");
    }

    @Test
    void testParseExpressionRejectsEmptyInput() {
        assertThatThrownBy(() -> compiler.parseExpression("   "))
                .isInstanceOf(CompilationException.class)
                .hasMessageContaining("unexpected end of input");
    }

    @Test
    void testCallsAreIndependent() {
        // Act
        compiler.parse("if x) { }", "first.ks");
        ParseResult second = compiler.parse("int ok = 1;", "second.ks");

        // Assert
        assertThat(second.hasErrors()).isFalse();
        assertThat(second.diagnostics()).isEmpty();
    }
}
