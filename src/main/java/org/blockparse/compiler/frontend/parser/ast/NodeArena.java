package org.blockparse.compiler.frontend.parser.ast;

import org.blockparse.compiler.model.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Owns all nodes of one tree and hands out their ids.
 * <p>
 * Ids are dense, start at 0 and follow creation order, so two distinct nodes never share an id
 * even when their content is equal. After {@link #freeze()} no node of the arena accepts children.
 */
public final class NodeArena {

    private final List<AstNode> nodes = new ArrayList<>();
    private boolean frozen = false;

    public AstNode create(NodeKind kind) {
        return register(kind, null, null, null);
    }

    /**
     * Creates a leaf that mirrors a token's payload.
     */
    public AstNode create(NodeKind kind, String value, Token token) {
        return register(kind, null, value, token);
    }

    /**
     * Creates an internal node and attaches the given children in order.
     */
    public AstNode create(NodeKind kind, List<AstNode> children) {
        AstNode node = register(kind, null, null, null);
        for (AstNode child : children) {
            node.addChild(child);
        }
        return node;
    }

    /**
     * Creates a node whose display label differs from its kind's name.
     */
    public AstNode createLabeled(NodeKind kind, String label, Token token) {
        return register(kind, label, null, token);
    }

    /**
     * @param id A handle previously assigned by this arena.
     * @return The node with that id.
     * @throws IndexOutOfBoundsException if the id was never assigned.
     */
    public AstNode get(int id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<AstNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    public void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("The tree is frozen and can no longer be modified");
        }
    }

    private AstNode register(NodeKind kind, String label, String value, Token token) {
        checkMutable();
        AstNode node = new AstNode(this, nodes.size(), kind, label, value, token);
        nodes.add(node);
        return node;
    }
}
