package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;

import java.util.Set;

/**
 * Gives statement handlers access to the token stream, the recovery state and the shared
 * productions. This interface decouples handlers from the concrete {@link Parser} implementation.
 */
public interface ParsingContext {

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise (also at end of input).
     */
    boolean check(TokenType type);

    /**
     * Returns the current token without consuming it.
     * @return The current token, or null at the end of input.
     */
    Token peek();

    /**
     * Consumes a token of the expected type.
     * <p>
     * In normal mode a matching token is consumed and returned. A mismatch reports an error,
     * discards the offending token and switches to panic mode. In panic mode tokens are
     * discarded until one of the expected type is found, which is consumed and ends panic mode;
     * reaching the end of input also ends panic mode.
     *
     * @param type The expected token type.
     * @return The consumed token, or null if no token of that type was consumed.
     * @throws ParseException if the lexer fails fatally while advancing.
     */
    Token consume(TokenType type) throws ParseException;

    /**
     * Discards tokens until the current one is in {@code sync} or the input ends.
     * Every discarded token is recorded as a note.
     *
     * @param sync The synchronization set.
     * @return The number of discarded tokens.
     * @throws ParseException if the lexer fails fatally while advancing.
     */
    int skipUntil(Set<TokenType> sync) throws ParseException;

    /**
     * Switches to panic mode without consuming anything.
     * @param reason A short description for the log.
     */
    void enterPanic(String reason);

    /**
     * Returns to normal mode after a synchronization point was reached.
     * @param reason A short description recorded as a note.
     */
    void leavePanic(String reason);

    boolean isPanic();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if there is no current token.
     */
    boolean isAtEnd();

    /**
     * Parses {@code Term (Operator Term)*}.
     * @return The expression leaf, or an {@code ErrorRecoveryExpression} placeholder.
     * @throws ParseException if a term position holds no identifier or literal.
     */
    AstNode expression() throws ParseException;

    /**
     * Parses a statement list.
     * @return The {@code Statements} node.
     * @throws ParseException if a nested production fails fatally.
     */
    AstNode statementList() throws ParseException;

    /**
     * @return The arena new nodes must be created in.
     */
    NodeArena arena();

    /**
     * Reports an error at the current token, or at the last token when the input is exhausted.
     * @param message The error message.
     */
    void reportErrorAtCurrent(String message);

    /**
     * Reports a warning at the current token, or at the last token when the input is exhausted.
     * @param message The warning message.
     */
    void reportWarningAtCurrent(String message);
}
