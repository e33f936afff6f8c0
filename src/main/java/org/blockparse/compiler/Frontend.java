package org.blockparse.compiler;

import com.typesafe.config.Config;
import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.api.ParseResult;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.frontend.lexer.Lexer;
import org.blockparse.compiler.frontend.lexer.LexerOptions;
import org.blockparse.compiler.frontend.parser.Parser;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.model.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the front end: scans and parses source text into a syntax tree.
 * <p>
 * Every call owns its own lexer, parser state and diagnostics; a {@code Frontend} holds only
 * immutable options and can be shared.
 */
public final class Frontend {

    private static final Logger log = LoggerFactory.getLogger(Frontend.class);

    private final LexerOptions lexerOptions;

    public Frontend() {
        this(LexerOptions.defaults());
    }

    public Frontend(LexerOptions lexerOptions) {
        this.lexerOptions = lexerOptions;
    }

    /**
     * Creates a front end with the lexer settings found under {@code blockparse.lexer}.
     */
    public static Frontend fromConfig(Config config) {
        return new Frontend(LexerOptions.fromConfig(config));
    }

    public LexerOptions getLexerOptions() {
        return lexerOptions;
    }

    /**
     * Parses a program.
     *
     * @param source   The program text.
     * @param fileName The name used in diagnostics.
     * @return The tree, the recovery flag and all diagnostics.
     * @throws ParseException if the parse fails fatally.
     */
    public ParseResult parse(String source, String fileName) throws ParseException {
        return parse(source, fileName, new DiagnosticsEngine());
    }

    /**
     * Parses a program, reporting into the given engine. The engine keeps the diagnostics
     * collected before a fatal error, which the exception alone does not carry.
     *
     * @param source      The program text.
     * @param fileName    The name used in diagnostics.
     * @param diagnostics The engine to report into.
     * @return The tree, the recovery flag and all diagnostics.
     * @throws ParseException if the parse fails fatally.
     */
    public ParseResult parse(String source, String fileName, DiagnosticsEngine diagnostics) throws ParseException {
        Lexer lexer = new Lexer(source, diagnostics, fileName, lexerOptions);
        Parser parser = new Parser(lexer, diagnostics);
        AstNode root;
        try {
            root = parser.parse();
        } catch (ParseException e) {
            log.debug("Parse of {} failed: {}", fileName, e.format());
            throw e;
        }
        ParseResult result = new ParseResult(root, parser.isRecovered(), parser.arena().size(), diagnostics);
        log.debug("Parsed {}: {} nodes, recovered={}, errors={}",
                fileName, result.nodeCount(), result.recovered(), result.errors().size());
        return result;
    }

    /**
     * Scans a program into its complete token list.
     *
     * @param source      The program text.
     * @param fileName    The name stored in the tokens.
     * @param diagnostics Receives lexical errors.
     * @return All tokens in source order.
     * @throws org.blockparse.compiler.frontend.lexer.LexerException under the FAIL policy for unrecognized characters.
     */
    public List<Token> tokenize(String source, String fileName, DiagnosticsEngine diagnostics) {
        return new Lexer(source, diagnostics, fileName, lexerOptions).scanTokens();
    }
}
