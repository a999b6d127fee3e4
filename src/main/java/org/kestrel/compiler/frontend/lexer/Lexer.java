package org.kestrel.compiler.frontend.lexer;

import org.kestrel.compiler.diagnostics.CompilerLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand, one per call to {@link #nextToken()}. The lexer never
 * rewinds; callers that need lookahead buffer tokens themselves. Once the input is
 * exhausted every further call returns an {@link TokenType#EOF} token with empty text.
 * Malformed input never raises an error here: it surfaces as {@link TokenType#ILLEGAL}
 * tokens that the parser reports.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
            Map.entry("if", TokenType.IF),
            Map.entry("else", TokenType.ELSE),
            Map.entry("while", TokenType.WHILE),
            Map.entry("for", TokenType.FOR),
            Map.entry("loop", TokenType.LOOP),
            Map.entry("in", TokenType.IN),
            Map.entry("fn", TokenType.FUNC),
            Map.entry("func", TokenType.FUNC),
            Map.entry("return", TokenType.RETURN),
            Map.entry("typeof", TokenType.TYPEOF),
            Map.entry("break", TokenType.BREAK),
            Map.entry("continue", TokenType.CONTINUE),
            Map.entry("true", TokenType.BOOL),
            Map.entry("false", TokenType.BOOL),
            Map.entry("null", TokenType.NIL),
            Map.entry("nil", TokenType.NIL),
            Map.entry("int", TokenType.TYPE),
            Map.entry("string", TokenType.TYPE),
            Map.entry("void", TokenType.TYPE),
            Map.entry("float", TokenType.TYPE)
    );

    private final String source;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Scans and returns the next token. Whitespace between tokens is skipped.
     * @return The next token, or an EOF token if the input is exhausted.
     */
    public Token nextToken() {
        skipWhitespace();
        start = current;
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char c = advance();
        switch (c) {
            case '(': return makeToken(TokenType.LPAREN);
            case ')': return makeToken(TokenType.RPAREN);
            case '{': return makeToken(TokenType.LBRACE);
            case '}': return makeToken(TokenType.RBRACE);
            case ',': return makeToken(TokenType.COMMA);
            case ';': return makeToken(TokenType.SEMICOLON);
            case '+': return makeToken(TokenType.ADD);
            case '-': return makeToken(TokenType.SUB);
            case '*': return makeToken(TokenType.MUL);
            case '/': return makeToken(TokenType.DIV);
            case '%': return makeToken(TokenType.MOD);
            case '=': return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
            case '!': return makeToken(match('=') ? TokenType.NOT_EQ : TokenType.NOT);
            case '<': return makeToken(match('=') ? TokenType.LE : TokenType.LT);
            case '>': return makeToken(match('=') ? TokenType.GE : TokenType.GT);
            case '&': return match('&') ? makeToken(TokenType.AND) : illegal();
            case '|': return match('|') ? makeToken(TokenType.OR) : illegal();
            case '"': return string();
            default:
                if (isLetter(c)) {
                    return identifier();
                }
                if (isDigit(c)) {
                    return number();
                }
                return illegal();
        }
    }

    /**
     * Drains the lexer into a list. The last element is always the EOF token.
     * @return A list of the recognized tokens.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token identifier() {
        while (isLetter(peek())) advance();
        String text = source.substring(start, current);
        return new Token(KEYWORDS.getOrDefault(text, TokenType.IDENT), text, startLine, startColumn);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        if (peek() == '.') {
            advance(); // consume the '.'
            while (isDigit(peek())) advance();
            return makeToken(TokenType.FLOAT);
        }
        return makeToken(TokenType.INT);
    }

    private Token string() {
        while (peek() != '"' && !isAtEnd()) {
            advance();
        }

        if (isAtEnd()) {
            // Unterminated: report the whole remainder, opening quote included.
            return illegal();
        }

        // The closing "
        advance();
        String value = source.substring(start + 1, current - 1);
        return new Token(TokenType.STRING, value, startLine, startColumn);
    }

    private Token illegal() {
        Token token = makeToken(TokenType.ILLEGAL);
        CompilerLogger.debug("Lexer: illegal input '" + token.text() + "' at " + startLine + ":" + startColumn);
        return token;
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), startLine, startColumn);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\n' || c == '\r') {
                advance();
            } else {
                return;
            }
        }
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetter(char c) {
        return Character.isLetter(c) || c == '_';
    }
}
