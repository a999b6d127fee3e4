package org.kestrel.compiler.frontend.statement;

import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.features.conditional.IfStatementHandler;
import org.kestrel.compiler.frontend.parser.features.declaration.TypedStatementHandler;
import org.kestrel.compiler.frontend.parser.features.function.FunctionStatementHandler;
import org.kestrel.compiler.frontend.parser.features.jump.BreakStatementHandler;
import org.kestrel.compiler.frontend.parser.features.jump.ContinueStatementHandler;
import org.kestrel.compiler.frontend.parser.features.jump.ReturnStatementHandler;
import org.kestrel.compiler.frontend.parser.features.loop.ForStatementHandler;
import org.kestrel.compiler.frontend.parser.features.loop.LoopStatementHandler;
import org.kestrel.compiler.frontend.parser.features.loop.WhileStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of the token types
 * that introduce a statement to their corresponding handlers. Tokens without a
 * handler start an expression statement.
 */
public class StatementHandlerRegistry {
    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new statement handler.
     * @param keyword The token type that introduces the statement.
     * @param handler The handler for the statement.
     */
    public void register(TokenType keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given token type.
     * @param keyword The token type.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Checks whether a token type introduces a keyword statement.
     * @param keyword The token type.
     * @return true if a handler is registered for it.
     */
    public boolean handles(TokenType keyword) {
        return handlers.containsKey(keyword);
    }

    /**
     * Initializes the statement handler registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.IF, new IfStatementHandler());
        registry.register(TokenType.RETURN, new ReturnStatementHandler());
        registry.register(TokenType.BREAK, new BreakStatementHandler());
        registry.register(TokenType.CONTINUE, new ContinueStatementHandler());
        registry.register(TokenType.WHILE, new WhileStatementHandler());
        registry.register(TokenType.LOOP, new LoopStatementHandler());
        registry.register(TokenType.FOR, new ForStatementHandler());

        FunctionStatementHandler functionHandler = new FunctionStatementHandler();
        registry.register(TokenType.FUNC, functionHandler);

        // Both a declaration and a function may start with a type.
        TypedStatementHandler typedHandler = new TypedStatementHandler(functionHandler);
        registry.register(TokenType.TYPE, typedHandler);
        registry.register(TokenType.VOID, typedHandler);

        return registry;
    }
}
