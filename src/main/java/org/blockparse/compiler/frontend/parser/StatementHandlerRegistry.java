package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.frontend.parser.features.assign.AssignmentHandler;
import org.blockparse.compiler.frontend.parser.features.loop.ForLoopHandler;
import org.blockparse.compiler.frontend.parser.features.print.PrintStatementHandler;
import org.blockparse.compiler.frontend.parser.features.var.VarDeclarationHandler;
import org.blockparse.compiler.model.TokenType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for statement handlers.
 * Maps the leading token type of a statement to its handler.
 */
public class StatementHandlerRegistry {

    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a handler for a leading token type.
     * @param leadingToken The token type that starts the statement.
     * @param handler      The handler for this statement.
     */
    public void register(TokenType leadingToken, IStatementHandler handler) {
        handlers.put(leadingToken, handler);
    }

    /**
     * Looks up the handler for a leading token type.
     * @param leadingToken The type of the current token.
     * @return The handler, or empty if no statement starts with this token type.
     */
    public Optional<IStatementHandler> get(TokenType leadingToken) {
        return Optional.ofNullable(handlers.get(leadingToken));
    }

    /**
     * @return The token types a registered statement can start with.
     */
    public Set<TokenType> startTokens() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    /**
     * Creates a registry with all built-in statement handlers.
     * @return A new registry instance.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        VarDeclarationHandler declarations = new VarDeclarationHandler();
        registry.register(TokenType.PRINT, new PrintStatementHandler());
        registry.register(TokenType.INTEGER, declarations);
        registry.register(TokenType.REAL, declarations);
        registry.register(TokenType.STRING, declarations);
        registry.register(TokenType.IDENTIFIER, new AssignmentHandler());
        registry.register(TokenType.FOR, new ForLoopHandler());
        return registry;
    }
}
