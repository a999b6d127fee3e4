package org.kestrel.cli.commands;

import com.typesafe.config.Config;
import org.kestrel.cli.CommandLineInterface;
import org.kestrel.cli.OutputFormat;
import org.kestrel.compiler.Compiler;
import org.kestrel.compiler.api.ParseResult;
import org.kestrel.compiler.diagnostics.Diagnostic;
import org.kestrel.compiler.frontend.parser.ast.AstNode;
import org.kestrel.compiler.frontend.parser.ast.AstPrinter;
import org.kestrel.compiler.frontend.parser.ast.ProgramNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "parse", mixinStandardHelpOptions = true,
        description = "Parses a source file and prints the program, or every syntax error.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @Option(names = {"-t", "--tree"}, description = "Print an indented syntax tree instead of the source form.")
    private boolean tree;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        String source;
        try {
            source = Files.readString(file.toPath());
        } catch (IOException e) {
            LOG.error("Failed to read {}", file, e);
            err.println("Cannot read file: " + file);
            return 1;
        }

        Compiler compiler = new Compiler();
        compiler.setVerbosity(config.getInt("kestrel.compiler.verbosity"));
        ParseResult result = compiler.parse(source, file.getName());

        if (result.hasErrors()) {
            err.println("Parser errors:");
            for (Diagnostic diagnostic : result.diagnostics()) {
                err.println(" - " + diagnostic);
            }
            return 1;
        }

        ProgramNode program = result.program();
        OutputFormat format = tree ? OutputFormat.TREE : config.getEnum(OutputFormat.class, "kestrel.cli.output");
        out.print(format == OutputFormat.TREE ? AstPrinter.print(program) : program.toString());
        out.flush();

        LOG.info("Parsed {}: {} statement(s), {} node(s)", file.getName(), program.statements().size(), countNodes(program));
        return 0;
    }

    private static int countNodes(AstNode node) {
        int count = 1;
        for (AstNode child : node.getChildren()) {
            count += countNodes(child);
        }
        return count;
    }
}
