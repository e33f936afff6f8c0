package org.blockparse.compiler.api;

import org.blockparse.compiler.diagnostics.Diagnostic;
import org.blockparse.compiler.diagnostics.DiagnosticsEngine;
import org.blockparse.compiler.frontend.parser.ast.AstNode;
import org.blockparse.compiler.frontend.parser.ast.AstWalker;

import java.util.ArrayList;
import java.util.List;

/**
 * The outcome of a parse that did not fail fatally.
 *
 * @param root        The {@code Program} node.
 * @param recovered   True if panic-mode recovery ran at least once, i.e. the tree may
 *                    contain {@code ErrorRecovery*} placeholders or be missing parts.
 * @param nodeCount   The number of nodes in the tree.
 * @param diagnostics All diagnostics reported while scanning and parsing.
 */
public record ParseResult(AstNode root, boolean recovered, int nodeCount, DiagnosticsEngine diagnostics) {

    /**
     * A clean parse: no recovery ran and no error was reported.
     */
    public boolean isClean() {
        return !recovered && !diagnostics.hasErrors();
    }

    public List<Diagnostic> errors() {
        return diagnostics.getDiagnostics(Diagnostic.Type.ERROR);
    }

    /**
     * @return The {@code ErrorRecovery*} placeholders in the tree, in pre-order.
     */
    public List<AstNode> recoveryPlaceholders() {
        List<AstNode> placeholders = new ArrayList<>();
        AstWalker.walk(root, (node, parent, depth) -> {
            if (node.kind().isRecoveryPlaceholder()) {
                placeholders.add(node);
            }
        });
        return placeholders;
    }
}
