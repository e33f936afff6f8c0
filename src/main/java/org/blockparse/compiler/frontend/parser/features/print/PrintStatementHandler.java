package org.blockparse.compiler.frontend.parser.features.print;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.IStatementHandler;
import org.blockparse.compiler.frontend.parser.ParsingContext;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.frontend.parser.ast.NodeKind;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;

/**
 * Parses {@code PRINT StringLiteral} into
 * {@code PrintStatement -> StringLiteral -> Value("text")}.
 */
public class PrintStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        NodeArena arena = context.arena();
        Token print = context.consume(TokenType.PRINT);
        AstNode statement = arena.create(NodeKind.PRINT_STATEMENT, null, print);

        Token literal = context.consume(TokenType.STRING_LITERAL);
        if (literal != null) {
            AstNode stringLiteral = arena.create(NodeKind.STRING_LITERAL, null, literal);
            stringLiteral.addChild(arena.create(NodeKind.VALUE, literal.text(), literal));
            statement.addChild(stringLiteral);
        }
        return statement;
    }
}
