package org.kestrel.cli;

import org.kestrel.cli.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the command line end to end against files in a temporary directory and checks
 * the printed output and the exit codes.
 */
@Tag("unit")
public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        LoggingConfigurator.reset();
        out = new StringWriter();
        err = new StringWriter();
        commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    void testParsePrintsCanonicalProgram() throws IOException {
        // Arrange
        Path source = write("ok.ks", "int x = 1 + 2 * 3;\nfn f() { return x; }\n");

        // Act
        int exitCode = commandLine.execute("parse", "-f", source.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("int x = (1 + (2 * 3));\nvoid f() { return x; }\n");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    void testParsePrintsTreeOnRequest() throws IOException {
        // Arrange
        Path source = write("tree.ks", "x;");

        // Act
        int exitCode = commandLine.execute("parse", "--tree", "-f", source.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("Program\n  ExpressionStatement\n    Identifier x\n");
    }

    @Test
    void testParseReportsErrors() throws IOException {
        // Arrange
        Path source = write("bad.ks", "if x) { }");

        // Act
        int exitCode = commandLine.execute("parse", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).isEmpty();
        assertThat(err.toString())
                .contains("Parser errors:")
                .contains(" - [ERROR] bad.ks:1: expected next token to be (, got IDENT instead");
    }

    @Test
    void testParseMissingFile() {
        // Act
        int exitCode = commandLine.execute("parse", "-f", tempDir.resolve("absent.ks").toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Cannot read file:");
    }

    @Test
    void testConfigFileSelectsTreeOutput() throws IOException {
        // Arrange
        Path config = write("custom.conf", "kestrel.cli.output = \"TREE\"\n");
        Path source = write("tree.ks", "1;");

        // Act
        int exitCode = commandLine.execute("-c", config.toString(), "parse", "-f", source.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("Program\n");
    }

    @Test
    void testMissingConfigFileFails() throws IOException {
        // Arrange
        Path source = write("ok.ks", "1;");

        // Act
        int exitCode = commandLine.execute("-c", tempDir.resolve("none.conf").toString(), "parse", "-f", source.toString());

        // Assert
        assertThat(exitCode).isNotZero();
        assertThat(out.toString()).isEmpty();
    }

    @Test
    void testTokensListsEveryToken() throws IOException {
        // Arrange
        Path source = write("t.ks", "int x = 5;");

        // Act
        int exitCode = commandLine.execute("tokens", "-f", source.toString());

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString())
                .containsPattern("1:1\\s+TYPE\\s+int")
                .containsPattern("1:5\\s+IDENT\\s+x")
                .containsPattern("1:9\\s+INT\\s+5")
                .contains("EOF");
    }

    @Test
    void testTokensFailsOnIllegalInput() throws IOException {
        // Arrange
        Path source = write("t.ks", "a @ b & c");

        // Act
        int exitCode = commandLine.execute("tokens", "-f", source.toString());

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString()).contains("ILLEGAL");
        assertThat(err.toString()).contains("2 illegal token(s)");
    }

    @Test
    void testEvalPrintsValueAndType() {
        // Act
        int exitCode = commandLine.execute("eval", "-e", "typeof(x + 5)", "--var", "x=100");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualTo("int (type: string)" + System.lineSeparator());
    }

    @Test
    void testEvalArithmeticWithFloatBinding() {
        // Act
        int exitCode = commandLine.execute("eval", "-e", "x * 2", "--var", "x=1.25");

        // Assert
        assertThat(exitCode).isZero();
        assertThat(out.toString()).startsWith("2.5 (type: float)");
    }

    @Test
    void testEvalReportsEvaluationError() {
        // Act
        int exitCode = commandLine.execute("eval", "-e", "10 / 0");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Evaluation error: division by zero");
    }

    @Test
    void testEvalReportsParserError() {
        // Act
        int exitCode = commandLine.execute("eval", "-e", "1 +");

        // Assert
        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Parser errors:").contains("unexpected end of input");
    }
}
