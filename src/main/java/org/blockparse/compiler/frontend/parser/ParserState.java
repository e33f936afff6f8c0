package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.model.Token;

/**
 * The mutable state of one parse: the single token of lookahead and the recovery mode.
 * One instance exists per {@link Parser} and only the parser changes it.
 */
public final class ParserState {

    private Token current;
    private Token previous;
    private ParserMode mode = ParserMode.NORMAL;
    private int panicCount = 0;
    private int skippedTokens = 0;

    ParserState() {
    }

    /**
     * @return The lookahead token, or null at the end of input.
     */
    public Token current() {
        return current;
    }

    /**
     * @return The token that was the lookahead before the current one, or null.
     */
    public Token previous() {
        return previous;
    }

    public ParserMode mode() {
        return mode;
    }

    public boolean isPanic() {
        return mode == ParserMode.PANIC;
    }

    /**
     * @return How many times the parse entered panic mode.
     */
    public int panicCount() {
        return panicCount;
    }

    /**
     * @return How many tokens were discarded by error recovery.
     */
    public int skippedTokens() {
        return skippedTokens;
    }

    void shift(Token next) {
        if (current != null) {
            previous = current;
        }
        current = next;
    }

    void enterPanic() {
        mode = ParserMode.PANIC;
        panicCount++;
    }

    void leavePanic() {
        mode = ParserMode.NORMAL;
    }

    void countSkipped() {
        skippedTokens++;
    }
}
