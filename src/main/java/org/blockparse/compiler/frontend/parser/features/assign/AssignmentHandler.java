package org.blockparse.compiler.frontend.parser.features.assign;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.IStatementHandler;
import org.blockparse.compiler.frontend.parser.ParsingContext;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.frontend.parser.ast.NodeKind;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;

/**
 * Parses {@code Identifier ASSIGN Expression} into {@code Assignment -> [Variable, expression]}.
 * <p>
 * Consecutive assignments are taken one after another by the statement list, each becoming
 * its own {@code Assignment} sibling.
 */
public class AssignmentHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        NodeArena arena = context.arena();
        Token name = context.consume(TokenType.IDENTIFIER);
        AstNode assignment = arena.create(NodeKind.ASSIGNMENT, null, name);
        assignment.addChild(arena.create(NodeKind.VARIABLE, name.text(), name));

        Token assign = context.consume(TokenType.ASSIGN);
        if (assign == null || context.isPanic()) {
            return assignment;
        }
        assignment.addChild(context.expression());
        return assignment;
    }
}
