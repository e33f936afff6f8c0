package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.frontend.lexer.Lexer;
import org.blockparse.compiler.frontend.lexer.LexerException;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.frontend.parser.ast.NodeKind;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.Set;

/**
 * Recursive-descent parser with panic-mode error recovery.
 * <p>
 * Tokens are pulled from the lexer one at a time; the parser holds exactly one token of lookahead.
 * Grammar:
 * <pre>
 * Program    := BEGIN Statements END
 * Statements := Statement*
 * Statement  := PrintStmt | VarDecl | Assignment | ForLoop
 * Expression := Term (Operator Term)*
 * Term       := Identifier | IntLiteral | FloatLiteral | StringLiteral
 * </pre>
 * The statement productions live in {@link IStatementHandler}s registered in a
 * {@link StatementHandlerRegistry}.
 * <p>
 * Mismatches in {@link #consume(TokenType)} are recovered from and reported to the
 * {@link DiagnosticsEngine}. A term position without an identifier or literal cannot be
 * recovered from and ends the parse with a {@link ParseException}.
 */
public class Parser implements ParsingContext {

    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    private final Iterator<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final String fileName;
    private final StatementHandlerRegistry registry;
    private final NodeArena arena = new NodeArena();
    private final ParserState state = new ParserState();
    private boolean started = false;

    public Parser(Lexer lexer, DiagnosticsEngine diagnostics) {
        this(lexer, diagnostics, lexer.getFileName(), StatementHandlerRegistry.initialize());
    }

    /**
     * @param tokens      The token source. It is read at most once and never rewound.
     * @param diagnostics Receives recoverable errors, warnings and the recovery trail.
     * @param fileName    The source name used for diagnostics at the end of input.
     * @param registry    The statement productions.
     */
    public Parser(Iterator<Token> tokens, DiagnosticsEngine diagnostics, String fileName,
                  StatementHandlerRegistry registry) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.fileName = fileName;
        this.registry = registry;
    }

    /**
     * Parses a whole program. A parser instance can parse only once.
     *
     * @return The {@code Program} node. It may contain recovery placeholders if errors were reported.
     * @throws ParseException on a malformed term, on input after the closing {@code END}, or when
     *                        the lexer is configured to fail on unrecognized characters.
     */
    public AstNode parse() throws ParseException {
        if (started) {
            throw new IllegalStateException("A parser instance can only parse once");
        }
        started = true;
        advance();
        AstNode program = program();
        arena.freeze();
        log.debug("Parsed {} nodes, {} panic episodes, {} tokens skipped",
                arena.size(), state.panicCount(), state.skippedTokens());
        return program;
    }

    /**
     * @return True if panic mode was entered at least once.
     */
    public boolean isRecovered() {
        return state.panicCount() > 0;
    }

    public ParserState getState() {
        return state;
    }

    // --- Grammar productions ---

    private AstNode program() throws ParseException {
        AstNode program = arena.create(NodeKind.PROGRAM);
        consume(TokenType.BEGIN);
        program.addChild(statementList());

        if (!isAtEnd() && !SyncSets.PROGRAM.contains(peek().type())) {
            reportErrorAtCurrent("Unexpected " + describe(peek()) + ", expected a statement or END");
            enterPanic("leftover tokens in program");
            skipUntil(SyncSets.PROGRAM);
        }

        if (check(TokenType.BEGIN)) {
            reportErrorAtCurrent("Nested BEGIN is not supported. Error recovery may not be complete.");
            enterPanic("nested BEGIN");
        }

        if (check(TokenType.END)) {
            consume(TokenType.END);
            if (!isAtEnd()) {
                Token extra = peek();
                throw new ParseException(ParseException.Kind.TRAILING_INPUT,
                        "Unexpected input after END: " + describe(extra),
                        extra.type(), extra.fileName(), extra.line(), extra.column());
            }
        } else if (isAtEnd()) {
            reportErrorAtCurrent("Missing END. Error recovery may not be complete.");
        } else {
            reportWarningAtCurrent("Input from " + describe(peek()) + " onwards was not parsed");
        }
        return program;
    }

    @Override
    public AstNode statementList() throws ParseException {
        AstNode statements = arena.create(NodeKind.STATEMENTS);
        while (!isAtEnd()) {
            if (state.isPanic()) {
                // END and end of input are left to the enclosing production.
                if (check(TokenType.END)) {
                    break;
                }
                AstNode placeholder = recoverStatement();
                if (placeholder != null) {
                    statements.addChild(placeholder);
                }
                continue;
            }
            if (!SyncSets.STATEMENT_START.contains(peek().type())) {
                break;
            }
            statements.addChild(statement());
        }
        return statements;
    }

    private AstNode statement() throws ParseException {
        Token leading = peek();
        IStatementHandler handler = registry.get(leading.type())
                .orElseThrow(() -> new IllegalStateException("No statement handler for " + leading.type()));
        return handler.parse(this);
    }

    /**
     * The statement production entered in panic mode: skips to the next statement start or END.
     *
     * @return An {@code ErrorRecoveryStatement} placeholder if tokens were discarded, otherwise null.
     */
    private AstNode recoverStatement() throws ParseException {
        int skipped = skipUntil(SyncSets.STATEMENT);
        leavePanic(isAtEnd() ? "end of input" : "statement boundary " + peek().type());
        if (skipped == 0) {
            return null;
        }
        return arena.create(NodeKind.ERROR_RECOVERY_STATEMENT);
    }

    @Override
    public AstNode expression() throws ParseException {
        Token first = term();
        StringBuilder folded = null;
        while (!state.isPanic() && check(TokenType.OPERATOR)) {
            Token operator = consume(TokenType.OPERATOR);
            if (isAtEnd() || !peek().type().isTermStart()) {
                reportErrorAtCurrent("Expected an identifier or literal after operator '" + operator.text() + "'");
                enterPanic("incomplete expression");
                return arena.create(NodeKind.ERROR_RECOVERY_EXPRESSION);
            }
            Token right = term();
            if (folded == null) {
                folded = new StringBuilder(first.text());
            }
            folded.append(' ').append(operator.text()).append(' ').append(right.text());
        }
        if (folded == null) {
            return arena.create(NodeKind.VALUE, first.text(), first);
        }
        return arena.create(NodeKind.EXPRESSION, folded.toString(), first);
    }

    private Token term() throws ParseException {
        Token token = peek();
        if (token == null) {
            Token last = state.previous();
            throw new ParseException(ParseException.Kind.UNEXPECTED_END_OF_INPUT,
                    "Unexpected end of input, expected an identifier or literal",
                    null, fileName, last != null ? last.line() : 0, last != null ? last.column() : 0);
        }
        if (!token.type().isTermStart()) {
            throw new ParseException(ParseException.Kind.MALFORMED_TERM,
                    "Unexpected " + describe(token) + ", expected an identifier or literal",
                    token.type(), token.fileName(), token.line(), token.column());
        }
        log.debug("Consuming {}", token);
        advance();
        return token;
    }

    // --- Token stream and recovery ---

    @Override
    public Token consume(TokenType type) throws ParseException {
        if (state.isPanic()) {
            return resynchronize(type);
        }

        Token token = peek();
        if (token == null) {
            if (type == TokenType.END) {
                log.debug("End of input accepted as END");
                return null;
            }
            reportErrorAtCurrent("Unexpected end of input, expected " + type);
            enterPanic("end of input");
            return null;
        }

        if (token.type() == type) {
            log.debug("Consuming {}", token);
            advance();
            return token;
        }

        reportErrorAtCurrent("Unexpected " + describe(token) + ", expected " + type);
        enterPanic("expected " + type);
        skipCurrent();
        return null;
    }

    private Token resynchronize(TokenType type) throws ParseException {
        skipUntil(Set.of(type));
        if (isAtEnd()) {
            leavePanic("end of input");
            return null;
        }
        Token token = peek();
        log.debug("Consuming {}", token);
        advance();
        leavePanic("resynchronized at " + type);
        return token;
    }

    @Override
    public int skipUntil(Set<TokenType> sync) throws ParseException {
        int skipped = 0;
        while (!isAtEnd() && !sync.contains(peek().type())) {
            skipCurrent();
            skipped++;
        }
        return skipped;
    }

    private void skipCurrent() throws ParseException {
        Token token = peek();
        log.debug("Skipping {}", token);
        diagnostics.reportNote("Skipping " + describe(token), token.fileName(), token.line(), token.column());
        state.countSkipped();
        advance();
    }

    @Override
    public void enterPanic(String reason) {
        log.debug("Entering panic mode: {}", reason);
        state.enterPanic();
    }

    @Override
    public void leavePanic(String reason) {
        if (!state.isPanic()) {
            return;
        }
        log.debug("Leaving panic mode: {}", reason);
        Token at = peek() != null ? peek() : state.previous();
        diagnostics.reportNote("Recovered: " + reason, fileName,
                at != null ? at.line() : 0, at != null ? at.column() : 0);
        state.leavePanic();
    }

    private void advance() throws ParseException {
        try {
            state.shift(tokens.hasNext() ? tokens.next() : null);
        } catch (LexerException e) {
            throw new ParseException(ParseException.Kind.UNRECOGNIZED_CHARACTER, e.getMessage(),
                    e.getFileName(), e.getLine(), e.getColumn(), e);
        }
    }

    @Override
    public boolean check(TokenType type) {
        return !isAtEnd() && peek().type() == type;
    }

    @Override
    public Token peek() {
        return state.current();
    }

    @Override
    public boolean isPanic() {
        return state.isPanic();
    }

    @Override
    public boolean isAtEnd() {
        return state.current() == null;
    }

    @Override
    public NodeArena arena() {
        return arena;
    }

    @Override
    public void reportErrorAtCurrent(String message) {
        Token at = peek() != null ? peek() : state.previous();
        if (at == null) {
            diagnostics.reportError(message, fileName, 0, 0);
        } else {
            diagnostics.reportError(message, at.fileName(), at.line(), at.column());
        }
    }

    @Override
    public void reportWarningAtCurrent(String message) {
        Token at = peek() != null ? peek() : state.previous();
        if (at == null) {
            diagnostics.reportWarning(message, fileName, 0, 0);
        } else {
            diagnostics.reportWarning(message, at.fileName(), at.line(), at.column());
        }
    }

    private static String describe(Token token) {
        return "token " + token.type() + " '" + token.text() + "'";
    }
}
