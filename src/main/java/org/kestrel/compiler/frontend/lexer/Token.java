package org.kestrel.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., IDENT, INT, IF).
 * @param text The text of the token. For string literals this is the body without quotes.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {

    /**
     * Creates a token that does not originate from the source text, e.g. the implicit
     * {@code void} return type of a function declared with {@code fn}.
     * @param type The token type.
     * @param text The token text.
     * @return A token positioned at line 0, column 0.
     */
    public static Token synthetic(TokenType type, String text) {
        return new Token(type, text, 0, 0);
    }

    /**
     * Checks whether this token is of the given type.
     * @param expected The type to compare against.
     * @return true if the types match.
     */
    public boolean is(TokenType expected) {
        return type == expected;
    }
}
