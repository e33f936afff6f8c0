package org.blockparse.compiler.frontend.parser;

/**
 * The recovery state of a parse.
 */
public enum ParserMode {
    /** Grammar rules match tokens as usual. */
    NORMAL,
    /** A mismatch occurred; tokens are being discarded until a synchronization point. */
    PANIC
}
