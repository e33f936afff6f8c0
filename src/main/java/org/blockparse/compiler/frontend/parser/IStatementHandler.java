package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.api.ParseException;
import org.blockparse.compiler.frontend.parser.ast.AstNode;

/**
 * Handler interface for one statement production.
 * The handler is invoked with the statement's leading token as the current token.
 */
public interface IStatementHandler {

    /**
     * Parses the statement from the token stream.
     *
     * @param context The parsing context providing access to the token stream.
     * @return The statement node. Never null; partial statements are returned as far as they were matched.
     * @throws ParseException if a term position holds no identifier or literal.
     */
    AstNode parse(ParsingContext context) throws ParseException;
}
