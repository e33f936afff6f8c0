package org.blockparse.compiler.frontend.parser.ast;

import org.blockparse.compiler.model.TokenType;

/**
 * Labels for every syntactic construct in the tree.
 */
public enum NodeKind {
    PROGRAM("Program"),
    STATEMENTS("Statements"),
    PRINT_STATEMENT("PrintStatement"),
    STRING_LITERAL("StringLiteral"),
    VALUE("Value"),
    VAR_DECLARATION("VarDeclaration"),
    DECLARED_INTEGER("INTEGER"),
    DECLARED_REAL("REAL"),
    DECLARED_STRING("STRING"),
    ASSIGNMENT("Assignment"),
    VARIABLE("Variable"),
    /** A folded operator chain; its value is the space-joined text of terms and operators. */
    EXPRESSION("Expression"),
    FOR_LOOP("ForLoop"),
    ERROR_RECOVERY_STATEMENT("ErrorRecoveryStatement"),
    ERROR_RECOVERY_FOR_LOOP("ErrorRecoveryForLoop"),
    ERROR_RECOVERY_EXPRESSION("ErrorRecoveryExpression");

    private final String displayName;

    NodeKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns true for the placeholders that stand in for constructs lost to error recovery.
     */
    public boolean isRecoveryPlaceholder() {
        return this == ERROR_RECOVERY_STATEMENT
                || this == ERROR_RECOVERY_FOR_LOOP
                || this == ERROR_RECOVERY_EXPRESSION;
    }

    /**
     * Maps a declaration keyword to the kind of the leaves it declares.
     *
     * @param type One of {@code INTEGER}, {@code REAL}, {@code STRING}.
     * @return The matching declared-name kind.
     * @throws IllegalArgumentException for any other token type.
     */
    public static NodeKind declaredType(TokenType type) {
        return switch (type) {
            case INTEGER -> DECLARED_INTEGER;
            case REAL -> DECLARED_REAL;
            case STRING -> DECLARED_STRING;
            default -> throw new IllegalArgumentException("Not a declaration type: " + type);
        };
    }
}
