package org.blockparse.compiler.frontend.parser.ast;

/**
 * Renders a tree as indented text, one node per line:
 * <pre>
 * Program [#0]
 *   Statements [#1]
 *     PrintStatement [#2]
 *       StringLiteral [#3]
 *         Value [#4] "HI"
 * </pre>
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {}

    public static String print(AstNode root) {
        StringBuilder sb = new StringBuilder();
        AstWalker.walk(root, (node, parent, depth) -> {
            sb.append(INDENT.repeat(depth))
                    .append(node.label().replace("\n", " "))
                    .append(" [#").append(node.id()).append(']');
            if (node.value() != null) {
                sb.append(" \"").append(node.value()).append('"');
            }
            sb.append('\n');
        });
        return sb.toString();
    }
}
