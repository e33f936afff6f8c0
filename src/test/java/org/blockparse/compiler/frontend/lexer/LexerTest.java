package org.blockparse.compiler.frontend.lexer;

import org.blockparse.compiler.diagnostics.Diagnostic;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.blockparse.compiler.model.TokenType.*;

/**
 * Tests the token priorities, literal forms, position tracking and error policies of the lexer.
 */
@Tag("unit")
class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String source) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private List<Token> scan(String source, LexerOptions options) {
        return new Lexer(source, diagnostics, "test.blk", options).scanTokens();
    }

    private static List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).toList();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::text).toList();
    }

    @Test
    void scansSimpleProgram() {
        List<Token> tokens = scan("BEGIN PRINT \"HI\" END");

        assertThat(types(tokens)).containsExactly(BEGIN, PRINT, STRING_LITERAL, END);
        assertThat(tokens.get(2).text()).isEqualTo("HI");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void scansEveryKeywordAndPunctuation() {
        List<Token> tokens = scan("BEGIN END PRINT FOR TO INTEGER REAL STRING := ,");

        assertThat(types(tokens)).containsExactly(
                BEGIN, END, PRINT, FOR, TO, INTEGER, REAL, STRING, ASSIGN, COMMA);
    }

    @Test
    void keywordWinsOverIdentifierThatStartsWithIt() {
        List<Token> tokens = scan("TOTAL BEGINX");

        assertThat(types(tokens)).containsExactly(TO, IDENTIFIER, BEGIN, IDENTIFIER);
        assertThat(texts(tokens)).containsExactly("TO", "TAL", "BEGIN", "X");
    }

    @Test
    void wholeWordKeywordsKeepLongerIdentifiers() {
        LexerOptions options = new LexerOptions(
                LexerOptions.PositionTracking.SOURCE, LexerOptions.UnrecognizedCharacterPolicy.REPORT, true);

        List<Token> tokens = scan("TOTAL TO BEGINX BEGIN", options);

        assertThat(types(tokens)).containsExactly(IDENTIFIER, TO, IDENTIFIER, BEGIN);
        assertThat(texts(tokens)).containsExactly("TOTAL", "TO", "BEGINX", "BEGIN");
    }

    @Test
    void wholeWordKeywordEndsBeforeNonAsciiLetter() {
        LexerOptions options = new LexerOptions(
                LexerOptions.PositionTracking.SOURCE, LexerOptions.UnrecognizedCharacterPolicy.REPORT, true);

        List<Token> tokens = scan("TO\u00e9 TO1", options);

        assertThat(types(tokens)).containsExactly(TO, IDENTIFIER);
        assertThat(texts(tokens)).containsExactly("TO", "TO1");
        assertThat(diagnostics.getDiagnostics(Diagnostic.Type.ERROR)).singleElement()
                .extracting(Diagnostic::message).asString().contains("Unrecognized character '\u00e9'");
    }

    @Test
    void keywordsAreCaseSensitive() {
        List<Token> tokens = scan("begin End x1");

        assertThat(types(tokens)).containsExactly(IDENTIFIER, IDENTIFIER, IDENTIFIER);
    }

    @Test
    void scansNumericLiterals() {
        List<Token> tokens = scan("12 4.567 -3.56E-8 +7 2.0e10");

        assertThat(types(tokens)).containsExactly(
                INT_LITERAL, FLOAT_LITERAL, FLOAT_LITERAL, INT_LITERAL, FLOAT_LITERAL);
        assertThat(texts(tokens)).containsExactly("12", "4.567", "-3.56E-8", "+7", "2.0e10");
    }

    @Test
    void floatWithoutFractionDigitsIsIntegerFollowedByUnrecognizedDot() {
        List<Token> tokens = scan("5.");

        assertThat(types(tokens)).containsExactly(INT_LITERAL);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    void operatorFollowedBySpaceIsNotASign() {
        List<Token> tokens = scan("1 + 2 - 3 * A / B");

        assertThat(types(tokens)).containsExactly(
                INT_LITERAL, OPERATOR, INT_LITERAL, OPERATOR, INT_LITERAL, OPERATOR, IDENTIFIER, OPERATOR, IDENTIFIER);
    }

    @Test
    void signDirectlyBeforeDigitBelongsToTheNumber() {
        List<Token> tokens = scan("1 -2");

        assertThat(types(tokens)).containsExactly(INT_LITERAL, INT_LITERAL);
        assertThat(texts(tokens)).containsExactly("1", "-2");
    }

    @Test
    void assignmentWithoutSpaces() {
        List<Token> tokens = scan("I:=1");

        assertThat(types(tokens)).containsExactly(IDENTIFIER, ASSIGN, INT_LITERAL);
    }

    @Test
    void stringLiteralKeepsKeywordsAndSpacesAndDropsQuotes() {
        List<Token> tokens = scan("\"BEGIN x, 1 + 2\" \"\"");

        assertThat(types(tokens)).containsExactly(STRING_LITERAL, STRING_LITERAL);
        assertThat(texts(tokens)).containsExactly("BEGIN x, 1 + 2", "");
    }

    @Test
    void whitespaceOnlyProducesNoTokens() {
        assertThat(scan(" \t\n\r\n ")).isEmpty();
        assertThat(scan("")).isEmpty();
    }

    @Test
    void tracksSourcePositions() {
        List<Token> tokens = scan("BEGIN\n  PRINT \"X\"\nEND");

        assertThat(tokens).extracting(Token::line).containsExactly(1, 2, 2, 3);
        assertThat(tokens).extracting(Token::column).containsExactly(1, 3, 9, 1);
    }

    @Test
    void perTokenTrackingAdvancesLinePerLexeme() {
        LexerOptions options = new LexerOptions(
                LexerOptions.PositionTracking.PER_TOKEN, LexerOptions.UnrecognizedCharacterPolicy.REPORT, false);

        List<Token> tokens = scan("BEGIN\n  PRINT \"X\"", options);

        // BEGIN, whitespace, PRINT, whitespace, "X"
        assertThat(tokens).extracting(Token::line).containsExactly(1, 3, 5);
        assertThat(tokens).extracting(Token::column).containsOnly(1);
    }

    @Test
    void tokensCarryTheFileName() {
        List<Token> tokens = scan("BEGIN", LexerOptions.defaults());

        assertThat(tokens.get(0).fileName()).isEqualTo("test.blk");
    }

    @Test
    void reportsUnrecognizedCharacterAndContinues() {
        List<Token> tokens = scan("BEGIN # END");

        assertThat(types(tokens)).containsExactly(BEGIN, END);
        assertThat(diagnostics.getDiagnostics(Diagnostic.Type.ERROR)).singleElement().satisfies(d -> {
            assertThat(d.message()).contains("Unrecognized character '#'");
            assertThat(d.line()).isEqualTo(1);
            assertThat(d.column()).isEqualTo(7);
        });
        assertThat(tokens.get(1).column()).isEqualTo(9);
    }

    @Test
    void unterminatedStringReportsTheQuote() {
        List<Token> tokens = scan("PRINT \"abc");

        assertThat(types(tokens)).containsExactly(PRINT, IDENTIFIER);
        assertThat(diagnostics.getDiagnostics(Diagnostic.Type.ERROR)).singleElement()
                .extracting(Diagnostic::message).asString().contains("'\"'");
    }

    @Test
    void skipPolicyDropsCharactersSilently() {
        LexerOptions options = new LexerOptions(
                LexerOptions.PositionTracking.SOURCE, LexerOptions.UnrecognizedCharacterPolicy.SKIP, false);

        List<Token> tokens = scan("BEGIN ;# END", options);

        assertThat(types(tokens)).containsExactly(BEGIN, END);
        assertThat(diagnostics.getDiagnostics()).isEmpty();
    }

    @Test
    void failPolicyThrowsOnlyWhenTheCharacterIsReached() {
        LexerOptions options = new LexerOptions(
                LexerOptions.PositionTracking.SOURCE, LexerOptions.UnrecognizedCharacterPolicy.FAIL, false);
        Lexer lexer = new Lexer("BEGIN # END", diagnostics, "test.blk", options);

        assertThat(lexer.next().type()).isEqualTo(BEGIN);
        assertThatThrownBy(lexer::next)
                .isInstanceOf(LexerException.class)
                .hasMessageContaining("'#'")
                .satisfies(e -> {
                    LexerException le = (LexerException) e;
                    assertThat(le.getLine()).isEqualTo(1);
                    assertThat(le.getColumn()).isEqualTo(7);
                    assertThat(le.getFileName()).isEqualTo("test.blk");
                });
    }

    @Test
    void sequenceIsNotRestartable() {
        Lexer lexer = new Lexer("BEGIN END", diagnostics);

        assertThat(lexer.scanTokens()).hasSize(2);
        assertThat(lexer.hasNext()).isFalse();
        assertThat(lexer.scanTokens()).isEmpty();
        assertThatThrownBy(lexer::next).isInstanceOf(NoSuchElementException.class);
    }

    @Test
    void hasNextDoesNotConsume() {
        Lexer lexer = new Lexer("BEGIN END", diagnostics);

        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.hasNext()).isTrue();
        assertThat(lexer.next().type()).isEqualTo(BEGIN);
        assertThat(lexer.next().type()).isEqualTo(END);
        assertThat(lexer.hasNext()).isFalse();
    }
}
