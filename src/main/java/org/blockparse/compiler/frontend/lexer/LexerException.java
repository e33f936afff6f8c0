package org.blockparse.compiler.frontend.lexer;

/**
 * Thrown by the lexer for a character no token pattern accepts, when the
 * {@link LexerOptions.UnrecognizedCharacterPolicy#FAIL} policy is active.
 * Unchecked because it escapes from {@link java.util.Iterator#next()}.
 */
public class LexerException extends RuntimeException {

    private final String fileName;
    private final int line;
    private final int column;

    public LexerException(String message, String fileName, int line, int column) {
        super(message);
        this.fileName = fileName;
        this.line = line;
        this.column = column;
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
}
