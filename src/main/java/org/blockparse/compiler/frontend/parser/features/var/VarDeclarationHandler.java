package org.blockparse.compiler.frontend.parser.features.var;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.IStatementHandler;
import org.blockparse.compiler.frontend.parser.ParsingContext;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.NodeArena;
import org.blockparse.compiler.frontend.parser.ast.NodeKind;
import org.blockparse.compiler.model.Token;
import org.blockparse.compiler.model.TokenType;

/**
 * Parses {@code (INTEGER|REAL|STRING) Identifier (COMMA Identifier)*}.
 * <p>
 * One {@code VarDeclaration} node is produced per statement, with one leaf per declared name,
 * all of the declared type's kind. A name that fails to match adds no leaf.
 */
public class VarDeclarationHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) throws ParseException {
        NodeArena arena = context.arena();
        TokenType type = context.peek().type();
        if (!type.isDeclarationType()) {
            throw new IllegalStateException("VarDeclarationHandler cannot start at " + type);
        }
        Token typeToken = context.consume(type);
        NodeKind leafKind = NodeKind.declaredType(typeToken.type());
        AstNode declaration = arena.create(NodeKind.VAR_DECLARATION, null, typeToken);

        declareName(context, declaration, leafKind);
        while (context.check(TokenType.COMMA)) {
            // In panic mode this consume is the resynchronization point.
            context.consume(TokenType.COMMA);
            declareName(context, declaration, leafKind);
        }
        return declaration;
    }

    private void declareName(ParsingContext context, AstNode declaration, NodeKind leafKind) throws ParseException {
        Token name = context.consume(TokenType.IDENTIFIER);
        if (name != null) {
            declaration.addChild(context.arena().create(leafKind, name.text(), name));
        }
    }
}
