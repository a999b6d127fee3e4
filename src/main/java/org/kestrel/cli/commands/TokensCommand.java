package org.kestrel.cli.commands;

import org.kestrel.cli.CommandLineInterface;
import org.kestrel.compiler.frontend.lexer.Lexer;
import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
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
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", mixinStandardHelpOptions = true,
        description = "Prints the token stream of a source file, one token per line.")
public class TokensCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokensCommand.class);

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the source file.")
    private File file;

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        parent.getConfig();
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

        List<Token> tokens = new Lexer(source).scanTokens();
        long illegal = tokens.stream().filter(t -> t.is(TokenType.ILLEGAL)).count();
        for (Token token : tokens) {
            out.println(String.format("%4d:%-4d %-10s %s", token.line(), token.column(), token.type().name(), token.text()));
        }
        out.flush();

        if (illegal > 0) {
            err.println(illegal + " illegal token(s)");
            return 1;
        }
        return 0;
    }
}
