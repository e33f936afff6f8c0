package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.model.TokenType;

/**
 * Recognizes one kind of token at a given position of the source.
 * The lexer tries its matchers in a fixed order and takes the first that matches.
 */
public interface TokenMatcher {

    /**
     * @return The kind of token this matcher produces.
     */
    TokenType type();

    /**
     * Attempts a match starting exactly at {@code position}.
     *
     * @param source   The complete source text.
     * @param position The index to match at.
     * @return The length of the matched lexeme, or 0 if there is no match.
     */
    int match(String source, int position);

    /**
     * Derives the token text from the matched lexeme.
     *
     * @param lexeme The raw matched characters.
     * @return The text stored in the token.
     */
    default String textOf(String lexeme) {
        return lexeme;
    }
}
