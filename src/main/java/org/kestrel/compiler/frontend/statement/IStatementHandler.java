package org.kestrel.compiler.frontend.statement;

import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;

import java.util.Optional;

/**
 * The base interface for all statement handlers.
 * Each handler is responsible for parsing one statement form introduced by a keyword
 * (e.g., {@code if}, {@code while}).
 */
public interface IStatementHandler {

    /**
     * Parses the statement. The current token is the introducing keyword; on return the
     * current token is the last token of the statement.
     *
     * @param context The context that provides access to the token stream and sub-parsers.
     * @return The statement node, or empty if the statement could not be parsed.
     *         An empty result is always accompanied by a reported error.
     */
    Optional<StatementNode> parse(ParsingContext context);
}
