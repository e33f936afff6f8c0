package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Converts source text into tokens on demand.
 * <p>
 * The lexer is a single-pass iterator: each {@link #next()} scans just far enough to produce
 * one token, and once exhausted it cannot be restarted. Scan the source again with a new
 * instance to enumerate the tokens a second time. Whitespace is consumed but never emitted.
 * <p>
 * At every position the matchers from {@link TokenMatchers#standard(LexerOptions)} are tried in
 * order and the first one that matches wins.
 */
public class Lexer implements Iterator<Token> {

    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final LexerOptions options;
    private final List<TokenMatcher> matchers;

    private int current = 0;
    private int line = 1;
    private int column = 1;

    private Token buffered;
    private boolean exhausted = false;

    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<input>");
    }

    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName) {
        this(source, diagnostics, fileName, LexerOptions.defaults());
    }

    /**
     * @param source      The program text.
     * @param diagnostics Receives lexical errors.
     * @param fileName    The logical source name stored in every token.
     * @param options     Position tracking and error policies.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String fileName, LexerOptions options) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.options = options;
        this.matchers = TokenMatchers.standard(options);
    }

    /**
     * @throws LexerException if an unrecognized character is met under the FAIL policy.
     */
    @Override
    public boolean hasNext() {
        if (buffered == null && !exhausted) {
            buffered = scanToken();
            if (buffered == null) {
                exhausted = true;
            }
        }
        return buffered != null;
    }

    /**
     * @throws LexerException if an unrecognized character is met under the FAIL policy.
     */
    @Override
    public Token next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens in " + fileName);
        }
        Token token = buffered;
        buffered = null;
        return token;
    }

    /**
     * Drains the remaining tokens into a list.
     *
     * @return The tokens not yet returned by {@link #next()}, in source order.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    public String getFileName() {
        return fileName;
    }

    private Token scanToken() {
        while (current < source.length()) {
            char c = source.charAt(current);
            if (Character.isWhitespace(c)) {
                skipWhitespace();
                continue;
            }

            for (TokenMatcher matcher : matchers) {
                int length = matcher.match(source, current);
                if (length > 0) {
                    String lexeme = source.substring(current, current + length);
                    Token token = new Token(matcher.type(), matcher.textOf(lexeme), line, tokenColumn(), fileName);
                    advance(lexeme);
                    log.debug("Scanned {}", token);
                    return token;
                }
            }

            unrecognizedCharacter();
        }
        return null;
    }

    private void skipWhitespace() {
        int start = current;
        while (current < source.length() && Character.isWhitespace(source.charAt(current))) {
            current++;
        }
        advancePosition(source.substring(start, current));
    }

    private void unrecognizedCharacter() {
        int codePoint = source.codePointAt(current);
        String character = new String(Character.toChars(codePoint));
        String message = "Unrecognized character '" + character + "'";
        int errorLine = line;
        int errorColumn = tokenColumn();

        switch (options.unrecognizedCharacter()) {
            case FAIL -> throw new LexerException(message, fileName, errorLine, errorColumn);
            case REPORT -> diagnostics.reportError(message, fileName, errorLine, errorColumn);
            case SKIP -> log.debug("Skipping {} at {}:{}", message, errorLine, errorColumn);
        }

        current += Character.charCount(codePoint);
        // Skipped characters never counted as a lexeme in per-token mode.
        if (options.positionTracking() == LexerOptions.PositionTracking.SOURCE) {
            column++;
        }
    }

    private void advance(String lexeme) {
        current += lexeme.length();
        advancePosition(lexeme);
    }

    private void advancePosition(String lexeme) {
        if (options.positionTracking() == LexerOptions.PositionTracking.PER_TOKEN) {
            line++;
            return;
        }
        for (int i = 0; i < lexeme.length(); i++) {
            if (lexeme.charAt(i) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
    }

    private int tokenColumn() {
        return options.positionTracking() == LexerOptions.PositionTracking.PER_TOKEN ? 1 : column;
    }
}
