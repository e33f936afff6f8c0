package org.blockparse.compiler.api;

import org.blockparse.compiler.model.TokenType;

/**
 * Thrown when parsing cannot continue. Recoverable mismatches never surface as this
 * exception; they are absorbed by panic-mode recovery and reported as diagnostics.
 * <p>
 * This is a checked exception; callers decide whether a failed parse aborts their work.
 */
public class ParseException extends Exception {

    /**
     * The category of a fatal error.
     */
    public enum Kind {
        /** A term position held a token that cannot start a term. */
        MALFORMED_TERM,
        /** A term position was reached at the end of input. */
        UNEXPECTED_END_OF_INPUT,
        /** Tokens remained after the closing {@code END} of the program. */
        TRAILING_INPUT,
        /** The lexer met a character no token pattern accepts and was told to fail. */
        UNRECOGNIZED_CHARACTER
    }

    private final Kind kind;
    private final TokenType tokenType;
    private final String fileName;
    private final int line;
    private final int column;

    /**
     * @param kind      The category of the error.
     * @param message   The detail message.
     * @param tokenType The offending token kind, or null if there is none (end of input, raw character).
     * @param fileName  The source name.
     * @param line      The line of the offending token, or 0 if unknown.
     * @param column    The column of the offending token, or 0 if unknown.
     */
    public ParseException(Kind kind, String message, TokenType tokenType, String fileName, int line, int column) {
        super(message);
        this.kind = kind;
        this.tokenType = tokenType;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public ParseException(Kind kind, String message, String fileName, int line, int column, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.tokenType = null;
        this.fileName = fileName;
        this.line = line;
        this.column = column;
    }

    public Kind getKind() {
        return kind;
    }

    public TokenType getTokenType() {
        return tokenType;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    /**
     * Formats the error as {@code file:line:column: message}.
     */
    public String format() {
        return (fileName != null ? fileName : "<input>") + ":" + line + ":" + column + ": " + getMessage();
    }
}
