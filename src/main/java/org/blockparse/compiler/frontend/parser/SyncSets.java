package org.blockparse.compiler.frontend.parser;

import org.blockparse.compiler.model.TokenType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Token kinds at which panic-mode skipping stops, per grammar context.
 */
public final class SyncSets {

    /** Tokens that begin a statement. */
    public static final Set<TokenType> STATEMENT_START = Collections.unmodifiableSet(EnumSet.of(
            TokenType.PRINT, TokenType.INTEGER, TokenType.REAL, TokenType.STRING,
            TokenType.IDENTIFIER, TokenType.FOR));

    /** A statement entered in panic mode skips to the next statement or block end. */
    public static final Set<TokenType> STATEMENT = Collections.unmodifiableSet(EnumSet.of(
            TokenType.PRINT, TokenType.INTEGER, TokenType.REAL, TokenType.STRING,
            TokenType.IDENTIFIER, TokenType.FOR, TokenType.END));

    /** A FOR without a loop variable skips to the next identifier or block end. */
    public static final Set<TokenType> FOR_LOOP = Collections.unmodifiableSet(EnumSet.of(
            TokenType.IDENTIFIER, TokenType.END));

    /** The program skips leftovers after its statements up to its END (or a nested BEGIN). */
    public static final Set<TokenType> PROGRAM = Collections.unmodifiableSet(EnumSet.of(
            TokenType.END, TokenType.BEGIN));

    private SyncSets() {}
}
