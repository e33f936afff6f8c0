package org.blockparse.compiler.frontend.parser.ast;

import org.blockparse.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the syntax tree.
 * <p>
 * Nodes are created by a {@link NodeArena}, which assigns each one a distinct integer id.
 * A node is attached to at most one parent, once; the tree can only grow through
 * {@link #addChild(AstNode)} and only until the arena is frozen.
 */
public final class AstNode {

    private final NodeArena arena;
    private final int id;
    private final NodeKind kind;
    private final String label;
    private final String value;
    private final Token token;
    private final List<AstNode> children = new ArrayList<>();
    private AstNode parent;

    AstNode(NodeArena arena, int id, NodeKind kind, String label, String value, Token token) {
        this.arena = arena;
        this.id = id;
        this.kind = kind;
        this.label = label;
        this.value = value;
        this.token = token;
    }

    /**
     * Appends a child.
     *
     * @param child A node of the same arena that has no parent yet and is not an ancestor of this node.
     * @throws IllegalStateException if the arena is frozen or the child is already attached.
     * @throws IllegalArgumentException if the child belongs to another arena or would create a cycle.
     */
    public void addChild(AstNode child) {
        arena.checkMutable();
        if (child.arena != arena) {
            throw new IllegalArgumentException("Node #" + child.id + " belongs to a different arena");
        }
        if (child.parent != null) {
            throw new IllegalStateException(
                    "Node #" + child.id + " is already attached to node #" + child.parent.id);
        }
        for (AstNode n = this; n != null; n = n.parent) {
            if (n == child) {
                throw new IllegalArgumentException("Attaching node #" + child.id + " would create a cycle");
            }
        }
        child.parent = this;
        children.add(child);
    }

    public int id() {
        return id;
    }

    public NodeKind kind() {
        return kind;
    }

    /**
     * @return The diagnostic label, which defaults to the kind's display name.
     */
    public String label() {
        return label != null ? label : kind.displayName();
    }

    /**
     * @return The literal payload of a leaf, or null.
     */
    public String value() {
        return value;
    }

    /**
     * @return The token this node was built from, or null for structural and placeholder nodes.
     */
    public Token token() {
        return token;
    }

    public AstNode parent() {
        return parent;
    }

    /**
     * @return The children in insertion order (unmodifiable view).
     */
    public List<AstNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public AstNode child(int index) {
        return children.get(index);
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    @Override
    public String toString() {
        return value != null ? label() + "#" + id + "(" + value + ")" : label() + "#" + id;
    }
}
