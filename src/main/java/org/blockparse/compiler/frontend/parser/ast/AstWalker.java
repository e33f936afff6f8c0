package org.blockparse.compiler.frontend.parser.ast;

/**
 * Depth-first, pre-order traversal that visits children in their stored order.
 */
public final class AstWalker {

    private AstWalker() {}

    public static void walk(AstNode root, AstVisitor visitor) {
        walk(root, null, 0, visitor);
    }

    private static void walk(AstNode node, AstNode parent, int depth, AstVisitor visitor) {
        visitor.enter(node, parent, depth);
        for (AstNode child : node.getChildren()) {
            walk(child, node, depth + 1, visitor);
        }
        visitor.exit(node, depth);
    }
}
