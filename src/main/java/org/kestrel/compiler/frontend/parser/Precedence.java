package org.kestrel.compiler.frontend.parser;

import org.kestrel.compiler.frontend.lexer.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Binding strength of operators, weakest first. An infix operator continues an expression
 * only while it binds tighter than the precedence the expression was started with, which
 * makes all binary operators left-associative.
 */
public enum Precedence {
    LOWEST,
    OR,
    AND,
    EQUALS,
    LESSGREATER,
    SUM,
    PRODUCT,
    PREFIX,
    /** Call syntax. The language has no calls, so the parser rejects an infix {@code (}. */
    CALL;

    private static final Map<TokenType, Precedence> INFIX;

    static {
        Map<TokenType, Precedence> map = new EnumMap<>(TokenType.class);
        map.put(TokenType.OR, OR);
        map.put(TokenType.AND, AND);
        map.put(TokenType.EQ, EQUALS);
        map.put(TokenType.NOT_EQ, EQUALS);
        map.put(TokenType.LT, LESSGREATER);
        map.put(TokenType.GT, LESSGREATER);
        map.put(TokenType.LE, LESSGREATER);
        map.put(TokenType.GE, LESSGREATER);
        map.put(TokenType.ADD, SUM);
        map.put(TokenType.SUB, SUM);
        map.put(TokenType.MUL, PRODUCT);
        map.put(TokenType.DIV, PRODUCT);
        map.put(TokenType.MOD, PRODUCT);
        map.put(TokenType.LPAREN, CALL);
        INFIX = Collections.unmodifiableMap(map);
    }

    /**
     * Looks up the infix precedence of a token type.
     * @param type The token type.
     * @return The precedence, or {@link #LOWEST} if the type is not an infix operator.
     */
    public static Precedence of(TokenType type) {
        return INFIX.getOrDefault(type, LOWEST);
    }

    /**
     * Compares two precedences.
     * @param other The precedence to compare against.
     * @return true if this level binds strictly tighter than {@code other}.
     */
    public boolean bindsTighterThan(Precedence other) {
        return compareTo(other) > 0;
    }
}
