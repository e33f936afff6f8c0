package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.model.TokenType;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a regular expression anchored at the current position.
 * Only this one pattern is tried; ordering between token kinds is decided by the lexer's
 * matcher list, not by regex alternation.
 */
public final class PatternMatcher implements TokenMatcher {

    private final TokenType type;
    private final Pattern pattern;
    private final int textGroup;

    public PatternMatcher(TokenType type, String regex) {
        this(type, regex, 0);
    }

    /**
     * @param type      The token type produced.
     * @param regex     The pattern to match.
     * @param textGroup The capturing group that becomes the token text (0 for the whole lexeme).
     */
    public PatternMatcher(TokenType type, String regex, int textGroup) {
        this.type = type;
        this.pattern = Pattern.compile(regex);
        this.textGroup = textGroup;
    }

    @Override
    public TokenType type() {
        return type;
    }

    @Override
    public int match(String source, int position) {
        Matcher m = pattern.matcher(source);
        m.region(position, source.length());
        if (!m.lookingAt()) {
            return 0;
        }
        return m.end() - position;
    }

    @Override
    public String textOf(String lexeme) {
        if (textGroup == 0) {
            return lexeme;
        }
        Matcher m = pattern.matcher(lexeme);
        if (!m.matches()) {
            throw new IllegalStateException("Lexeme '" + lexeme + "' no longer matches " + pattern);
        }
        return m.group(textGroup);
    }

    @Override
    public String toString() {
        return type + "(" + pattern.pattern() + ")";
    }
}
