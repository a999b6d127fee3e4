package org.kestrel.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 * <p>
 * Every type carries a display string that is used when a type is named in a
 * diagnostic message: punctuation, operators and keywords show their spelling,
 * token classes show their name.
 */
public enum TokenType {
    // Structural tokens.
    /** The '(' character. */
    LPAREN("("),
    /** The ')' character. */
    RPAREN(")"),
    /** The '{' character. */
    LBRACE("{"),
    /** The '}' character. */
    RBRACE("}"),
    /** The ',' character, separating parameters. */
    COMMA(","),
    /** The ';' character, an optional statement terminator. */
    SEMICOLON(";"),

    // Literals.
    /** An identifier, such as a variable or function name. */
    IDENT("IDENT"),
    /** An integer literal. */
    INT("INT"),
    /** A floating-point literal. */
    FLOAT("FLOAT"),
    /** A string literal; the token text is the body without quotes. */
    STRING("STRING"),
    /** The boolean literals {@code true} and {@code false}. */
    BOOL("BOOL"),
    /** The literals {@code nil} and {@code null}. */
    NIL("NIL"),

    // Operators.
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    ASSIGN("="),
    EQ("=="),
    NOT_EQ("!="),
    LT("<"),
    GT(">"),
    LE("<="),
    GE(">="),
    NOT("!"),
    AND("&&"),
    OR("||"),

    // Keywords.
    IF("if"),
    ELSE("else"),
    WHILE("while"),
    FOR("for"),
    LOOP("loop"),
    IN("in"),
    /** The keywords {@code fn} and {@code func}. */
    FUNC("fn"),
    RETURN("return"),
    /** Any primitive type name: {@code int}, {@code string}, {@code float} or {@code void}. */
    TYPE("TYPE"),
    /** A void marker. The lexer spells {@code void} as {@link #TYPE}. */
    VOID("void"),
    TYPEOF("typeof"),
    BREAK("break"),
    CONTINUE("continue"),

    // Miscellaneous.
    /** Represents an unexpected or unknown character. */
    ILLEGAL("ILLEGAL"),
    /** Represents the end of the source text. */
    EOF("EOF");

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * Gets the text used for this token type in diagnostic messages.
     * @return The display text.
     */
    public String display() {
        return display;
    }

    @Override
    public String toString() {
        return display;
    }
}
