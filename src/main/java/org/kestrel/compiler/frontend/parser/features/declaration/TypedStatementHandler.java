package org.kestrel.compiler.frontend.parser.features.declaration;

import org.kestrel.compiler.frontend.lexer.Token;
import org.kestrel.compiler.frontend.lexer.TokenType;
import org.kestrel.compiler.frontend.parser.ParsingContext;
import org.kestrel.compiler.frontend.parser.ast.StatementNode;
import org.kestrel.compiler.frontend.parser.features.function.FunctionStatementHandler;
import org.kestrel.compiler.frontend.statement.IStatementHandler;

import java.util.Optional;

/**
 * Handles statements that start with a type name, which are either function or variable
 * declarations. The two tokens after the type decide:
 * <ul>
 *     <li>{@code int name (} starts a function,</li>
 *     <li>{@code int fn name (} starts a function returning {@code int},</li>
 *     <li>anything else is parsed as a declaration, which reports what is missing.</li>
 * </ul>
 */
public class TypedStatementHandler implements IStatementHandler {

    private final FunctionStatementHandler functions;
    private final VariableDeclarationHandler declarations = new VariableDeclarationHandler();

    /**
     * @param functions The handler that parses function signatures and bodies.
     */
    public TypedStatementHandler(FunctionStatementHandler functions) {
        this.functions = functions;
    }

    @Override
    public Optional<StatementNode> parse(ParsingContext context) {
        Token type = context.current();
        if (context.peekIs(TokenType.IDENT) && context.peekNextIs(TokenType.LPAREN)) {
            return functions.parseNamedFunction(context, type, type);
        }
        if (context.peekIs(TokenType.FUNC)) {
            context.nextToken();
            return functions.parseNamedFunction(context, type, type);
        }
        return declarations.parse(context);
    }
}
