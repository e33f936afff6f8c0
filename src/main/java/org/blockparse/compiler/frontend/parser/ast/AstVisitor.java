package org.blockparse.compiler.frontend.parser.ast;

/**
 * Callback for {@link AstWalker}. Renderers and other consumers of the tree implement this.
 */
public interface AstVisitor {

    /**
     * Called before the children of {@code node} are visited.
     *
     * @param node   The node being entered.
     * @param parent The parent of the node, or null for the root of the walk.
     * @param depth  0 for the root of the walk.
     */
    void enter(AstNode node, AstNode parent, int depth);

    /**
     * Called after all children of {@code node} were visited.
     */
    default void exit(AstNode node, int depth) {
    }
}
