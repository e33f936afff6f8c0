package org.blockparse.compiler.model;

/**
 * A classified, positioned unit of source text.
 *
 * @param type     The kind of token.
 * @param text     The matched text. For string literals the surrounding quotes are excluded.
 * @param line     The line the token starts on (1-based).
 * @param column   The column the token starts at (1-based).
 * @param fileName The logical name of the source the token was read from.
 */
public record Token(TokenType type, String text, int line, int column, String fileName) {

    @Override
    public String toString() {
        return type + " '" + text + "' @" + line + ":" + column;
    }
}
