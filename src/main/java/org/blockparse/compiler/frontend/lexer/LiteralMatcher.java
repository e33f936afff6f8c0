package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.model.TokenType;

/**
 * Matches a fixed string such as a keyword or a punctuation mark.
 */
public final class LiteralMatcher implements TokenMatcher {

    private final TokenType type;
    private final String literal;
    private final boolean wholeWord;

    /**
     * @param type      The token type produced.
     * @param literal   The exact text to match.
     * @param wholeWord If true the literal must not be followed by an ASCII letter or digit.
     */
    public LiteralMatcher(TokenType type, String literal, boolean wholeWord) {
        this.type = type;
        this.literal = literal;
        this.wholeWord = wholeWord;
    }

    @Override
    public TokenType type() {
        return type;
    }

    @Override
    public int match(String source, int position) {
        if (!source.startsWith(literal, position)) {
            return 0;
        }
        int end = position + literal.length();
        if (wholeWord && end < source.length() && isIdentifierPart(source.charAt(end))) {
            return 0;
        }
        return literal.length();
    }

    // Identifiers are ASCII only.
    private static boolean isIdentifierPart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9');
    }

    @Override
    public String toString() {
        return type + "(" + literal + ")";
    }
}
