package org.smpels.mcs.frontend;

import org.smpels.mcs.frontend.parser.ast.AstNode;

import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A generic class for traversing the MCS syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between analysis phases and the tree structure.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its children recursively, parents before children.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.getClass(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Visits every node below the given roots together with its parent, parents before children.
     * Roots are visited with a {@code null} parent.
     * @param roots  The top-level nodes.
     * @param action Receives each node and its parent.
     */
    public static void walkWithParent(List<? extends AstNode> roots, BiConsumer<AstNode, AstNode> action) {
        for (AstNode root : roots) {
            walkWithParent(root, null, action);
        }
    }

    private static void walkWithParent(AstNode node, AstNode parent, BiConsumer<AstNode, AstNode> action) {
        if (node == null) {
            return;
        }
        action.accept(node, parent);
        for (AstNode child : node.getChildren()) {
            walkWithParent(child, node, action);
        }
    }
}
