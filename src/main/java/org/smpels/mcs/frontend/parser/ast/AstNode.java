package org.smpels.mcs.frontend.parser.ast;

import org.smpels.mcs.api.SourceInfo;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the MCS syntax tree.
 * The set of node kinds is closed, so every consumer can handle all of them.
 */
public sealed interface AstNode permits StatementNode, OperandNode, ParameterNode, CommentNode {

    /**
     * @return The position of the node's leading token.
     */
    SourceInfo position();

    /**
     * Returns a list of the direct child nodes.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
