package org.kestrel.cli.commands;

import com.typesafe.config.Config;
import org.kestrel.cli.CommandLineInterface;
import org.kestrel.compiler.Compiler;
import org.kestrel.compiler.api.CompilationException;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.runtime.EvalEnvironment;
import org.kestrel.runtime.EvaluationException;
import org.kestrel.runtime.Evaluator;
import org.kestrel.runtime.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "eval", mixinStandardHelpOptions = true,
        description = "Evaluates a single expression and prints its value and type.")
public class EvalCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(EvalCommand.class);

    @Option(names = {"-e", "--expression"}, required = true, description = "The expression, e.g. 'typeof(x + 5)'.")
    private String expression;

    @Option(names = "--var", paramLabel = "NAME=VALUE",
            description = "Binds a variable. Values that look like integers or floats become numbers, "
                    + "anything else a string.")
    private Map<String, String> variables = new LinkedHashMap<>();

    @ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EvalEnvironment environment = new EvalEnvironment();
        variables.forEach((name, text) -> environment.set(name, Value.parse(text)));
        LOG.debug("Bindings: {}", environment.types().asMap());

        Compiler compiler = new Compiler();
        compiler.setVerbosity(config.getInt("kestrel.compiler.verbosity"));
        try {
            ExpressionNode parsed = compiler.parseExpression(expression);
            Value result = new Evaluator(environment).evaluate(parsed);
            out.println(result.inspect() + " (type: " + result.type() + ")");
            out.flush();
            return 0;
        } catch (CompilationException e) {
            err.println("Parser errors:");
            err.println(e.getMessage());
            return 1;
        } catch (EvaluationException e) {
            err.println("Evaluation error: " + e.getMessage());
            return 1;
        }
    }
}
