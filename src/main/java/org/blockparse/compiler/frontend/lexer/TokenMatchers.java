package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.model.TokenType;

import java.util.List;

/**
 * Builds the ordered matcher list of the language.
 * <p>
 * Priority, highest first:
 * <ol>
 *   <li>Keywords {@code BEGIN END PRINT FOR TO INTEGER REAL STRING}. They precede the identifier
 *       pattern, which would otherwise accept every keyword as well.</li>
 *   <li>{@code :=} and {@code ,}</li>
 *   <li>Identifiers: a letter followed by letters or digits.</li>
 *   <li>Float literals ({@code [+-]?digits.digits} with optional signed exponent), before integer
 *       literals so the integer part is not split off.</li>
 *   <li>Integer literals ({@code [+-]?digits}).</li>
 *   <li>String literals in double quotes, no escapes; the quotes are not part of the text.</li>
 *   <li>Operators {@code + - * /}. A sign directly followed by a digit was already taken by a
 *       numeric literal.</li>
 * </ol>
 */
public final class TokenMatchers {

    private TokenMatchers() {}

    public static List<TokenMatcher> standard(LexerOptions options) {
        boolean wholeWord = options.wholeWordKeywords();
        return List.of(
                new LiteralMatcher(TokenType.BEGIN, "BEGIN", wholeWord),
                new LiteralMatcher(TokenType.END, "END", wholeWord),
                new LiteralMatcher(TokenType.PRINT, "PRINT", wholeWord),
                new LiteralMatcher(TokenType.FOR, "FOR", wholeWord),
                new LiteralMatcher(TokenType.TO, "TO", wholeWord),
                new LiteralMatcher(TokenType.INTEGER, "INTEGER", wholeWord),
                new LiteralMatcher(TokenType.REAL, "REAL", wholeWord),
                new LiteralMatcher(TokenType.STRING, "STRING", wholeWord),
                new LiteralMatcher(TokenType.ASSIGN, ":=", false),
                new LiteralMatcher(TokenType.COMMA, ",", false),
                new PatternMatcher(TokenType.IDENTIFIER, "[A-Za-z][A-Za-z0-9]*"),
                new PatternMatcher(TokenType.FLOAT_LITERAL, "[+-]?[0-9]+\\.[0-9]+(?:[eE][+-]?[0-9]+)?"),
                new PatternMatcher(TokenType.INT_LITERAL, "[+-]?[0-9]+"),
                new PatternMatcher(TokenType.STRING_LITERAL, "\"([^\"]*)\"", 1),
                new PatternMatcher(TokenType.OPERATOR, "[+\\-*/]")
        );
    }
}
