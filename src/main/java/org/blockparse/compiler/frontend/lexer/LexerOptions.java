package org.blockparse.compiler.frontend.lexer;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * Tunable lexer behavior.
 *
 * @param positionTracking      How token line and column numbers are computed.
 * @param unrecognizedCharacter What happens to a character that matches no token pattern.
 * @param wholeWordKeywords     If true a keyword only matches when it is not followed by a letter
 *                              or digit; if false a keyword also wins over a longer identifier
 *                              that starts with it.
 */
public record LexerOptions(
        PositionTracking positionTracking,
        UnrecognizedCharacterPolicy unrecognizedCharacter,
        boolean wholeWordKeywords
) {

    /** Configuration path of the lexer settings. */
    public static final String CONFIG_PATH = "blockparse.lexer";

    public enum PositionTracking {
        /** Real line and column of the first character of each token. */
        SOURCE,
        /**
         * Legacy counting: the line advances once per scanned lexeme (whitespace runs included)
         * and the column is always 1.
         */
        PER_TOKEN
    }

    public enum UnrecognizedCharacterPolicy {
        /** Record an error diagnostic and continue after the character. */
        REPORT,
        /** Drop the character silently. */
        SKIP,
        /** Throw a {@link LexerException}. */
        FAIL
    }

    public LexerOptions {
        if (positionTracking == null) {
            throw new IllegalArgumentException("positionTracking must not be null");
        }
        if (unrecognizedCharacter == null) {
            throw new IllegalArgumentException("unrecognizedCharacter must not be null");
        }
    }

    public static LexerOptions defaults() {
        return new LexerOptions(PositionTracking.SOURCE, UnrecognizedCharacterPolicy.REPORT, false);
    }

    /**
     * Reads lexer options from {@code blockparse.lexer}. Missing keys keep their default.
     *
     * @param config The application configuration.
     * @return The resolved options.
     * @throws IllegalArgumentException if a value names no known policy.
     */
    public static LexerOptions fromConfig(Config config) {
        LexerOptions defaults = defaults();
        if (!config.hasPath(CONFIG_PATH)) {
            return defaults;
        }
        Config lexer = config.getConfig(CONFIG_PATH);

        PositionTracking tracking = lexer.hasPath("position-tracking")
                ? parseEnum(PositionTracking.class, lexer.getString("position-tracking"), "position-tracking")
                : defaults.positionTracking();
        UnrecognizedCharacterPolicy policy = lexer.hasPath("unrecognized-character")
                ? parseEnum(UnrecognizedCharacterPolicy.class, lexer.getString("unrecognized-character"), "unrecognized-character")
                : defaults.unrecognizedCharacter();
        boolean wholeWord = lexer.hasPath("whole-word-keywords")
                ? lexer.getBoolean("whole-word-keywords")
                : defaults.wholeWordKeywords();

        return new LexerOptions(tracking, policy, wholeWord);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid value '" + value + "' for " + CONFIG_PATH + "." + key, e);
        }
    }
}
