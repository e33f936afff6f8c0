package org.blockparse.compiler.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * The closed set of token kinds produced by the lexer.
 */
public enum TokenType {
    BEGIN,
    END,
    PRINT,
    FOR,
    TO,
    INTEGER,
    REAL,
    STRING,
    ASSIGN,
    COMMA,
    IDENTIFIER,
    FLOAT_LITERAL,
    INT_LITERAL,
    STRING_LITERAL,
    OPERATOR;

    private static final Set<TokenType> TERM_START =
            EnumSet.of(IDENTIFIER, INT_LITERAL, FLOAT_LITERAL, STRING_LITERAL);

    private static final Set<TokenType> DECLARATION_TYPES = EnumSet.of(INTEGER, REAL, STRING);

    /**
     * Returns true if a token of this type can begin a term (identifier or literal).
     */
    public boolean isTermStart() {
        return TERM_START.contains(this);
    }

    /**
     * Returns true if this is one of the declaration type keywords.
     */
    public boolean isDeclarationType() {
        return DECLARATION_TYPES.contains(this);
    }
}
