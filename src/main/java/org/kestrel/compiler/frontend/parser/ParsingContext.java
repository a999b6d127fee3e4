package org.kestrel.compiler.frontend.parser;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ast.BlockNode;
import org.kestrel.compiler.frontend.parser.ast.ExpressionNode;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;

import java.util.Optional;

/**
 * An interface that encapsulates the contextual state during parsing.
 * It provides statement handlers with access to the token window and the shared
 * sub-parsers without coupling them directly to the {@link Parser} implementation.
 * <p>
 * Every parse function follows the same positioning contract: it is entered with
 * {@link #current()} on the first token of its construct and returns with
 * {@link #current()} on the last token it consumed. The caller advances past it.
 * A failed parse returns an empty {@link Optional} and has recorded at least one error.
 */
public interface ParsingContext {

    /**
     * Returns the token under the cursor.
     * @return The current token.
     */
    Token current();

    /**
     * Returns the token after the current one.
     * @return The first lookahead token.
     */
    Token peek();

    /**
     * Shifts the token window by one token.
     */
    void nextToken();

    /**
     * Checks the type of the current token.
     * @param type The token type to check.
     * @return true if the current token is of the given type.
     */
    boolean curIs(TokenType type);

    /**
     * Checks the type of the first lookahead token.
     * @param type The token type to check.
     * @return true if the peek token is of the given type.
     */
    boolean peekIs(TokenType type);

    /**
     * Checks the type of the second lookahead token.
     * @param type The token type to check.
     * @return true if the token after the peek token is of the given type.
     */
    boolean peekNextIs(TokenType type);

    /**
     * Advances if the next token has the expected type. Otherwise reports
     * {@code expected next token to be <type>, got <actual> instead} and stays put.
     * @param type The expected token type.
     * @return true if the token was consumed.
     */
    boolean expectPeek(TokenType type);

    /**
     * Parses an expression starting at the current token.
     * @param precedence The precedence the expression is parsed at.
     * @return The expression, or empty if it could not be parsed.
     */
    Optional<ExpressionNode> parseExpression(Precedence precedence);

    /**
     * Parses the statement starting at the current token.
     * @return The statement, or empty if there is none or it failed.
     */
    Optional<StatementNode> parseStatement();

    /**
     * Parses a braced block. The current token must be the opening brace;
     * on return the current token is the closing brace.
     * @return The block.
     */
    BlockNode parseBlock();

    /**
     * Parses the body following a condition: either a braced block, or a single
     * statement that is wrapped in a block of its own.
     * @return The body, or empty if it failed.
     */
    Optional<BlockNode> parseBody();

    /**
     * Reports an error at the line of the current token.
     * @param message The error message.
     */
    void reportError(String message);
}
