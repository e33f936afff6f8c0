package org.blockparse.compiler.frontend.parser.features.loop;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.IStatementHandler;
import org.blockparse.compiler.frontend.parser.ParsingContext;
import org.blockparse.compiler.frontend.parser.SyncSets;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.frontend.parser.ast.NodeKind;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;

/**
 * Parses {@code FOR Identifier ASSIGN Expression TO Expression Statements END}.
 * <p>
 * The node is labeled {@code START : <start> END : <end>} from the raw text of the first token of
 * each bound. Its children are the loop variable, the start and end expressions and the body.
 * A bound that could not be parsed because of an earlier mismatch is left out.
 * <p>
 * Without a loop variable after {@code FOR} the loop is abandoned: tokens are skipped up to the
 * next identifier or {@code END} and an {@code ErrorRecoveryForLoop} placeholder is returned.
 */
public class ForLoopHandler implements IStatementHandler {

    private static final String UNKNOWN_BOUND = "?";

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        NodeArena arena = context.arena();
        Token forToken = context.consume(TokenType.FOR);

        if (!context.check(TokenType.IDENTIFIER)) {
            context.reportErrorAtCurrent("Expected a loop variable after FOR");
            context.enterPanic("FOR without loop variable");
            context.skipUntil(SyncSets.FOR_LOOP);
            context.leavePanic(context.isAtEnd() ? "end of input" : "FOR recovery at " + context.peek().type());
            return arena.create(NodeKind.ERROR_RECOVERY_FOR_LOOP, null, forToken);
        }

        Token variable = context.consume(TokenType.IDENTIFIER);
        AstNode variableNode = arena.create(NodeKind.VARIABLE, variable.text(), variable);

        // consume returns null, in normal mode, when resynchronization ran into the end of input.
        Token assign = context.consume(TokenType.ASSIGN);
        String startText = UNKNOWN_BOUND;
        AstNode start = null;
        if (assign != null && !context.isPanic()) {
            startText = boundText(context);
            start = context.expression();
        }

        Token to = context.consume(TokenType.TO);
        String endText = UNKNOWN_BOUND;
        AstNode end = null;
        if (to != null && !context.isPanic()) {
            endText = boundText(context);
            end = context.expression();
        }

        AstNode body = context.statementList();

        if (!context.isPanic()) {
            if (context.isAtEnd()) {
                context.reportWarningAtCurrent("FOR loop is closed by the end of input");
            } else if (!context.check(TokenType.END)) {
                context.reportErrorAtCurrent("Expected END to close the FOR loop");
                context.enterPanic("leftover tokens in FOR body");
            }
        }
        // In panic mode this skips to the loop's END.
        context.consume(TokenType.END);

        AstNode loop = arena.createLabeled(NodeKind.FOR_LOOP, "START : " + startText + " END : " + endText, forToken);
        loop.addChild(variableNode);
        if (start != null) {
            loop.addChild(start);
        }
        if (end != null) {
            loop.addChild(end);
        }
        loop.addChild(body);
        return loop;
    }

    private static String boundText(ParsingContext context) {
        Token first = context.peek();
        return first != null ? first.text() : UNKNOWN_BOUND;
    }
}
