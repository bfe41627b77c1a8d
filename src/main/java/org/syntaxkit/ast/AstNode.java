package org.syntaxkit.ast;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 *
 * <p>Besides the {@link ASTKind} tag and the source location, every node renders itself in two
 * independent ways: {@link #toString()} returns a single-line text rendering, and
 * {@link #getStruct()} returns a nested mapping meant for serializers and inspection tools.
 * Both are pure functions of the node's state.
 */
public interface AstNode extends SourceLocatable {

    /**
     * Returns the tag of the concrete node type. The tag never changes for a given node.
     *
     * @return The node kind.
     */
    ASTKind kind();

    /**
     * Returns the structured representation of this node.
     *
     * <p>The outer map has exactly one entry. Its key is a label describing the node's role
     * (e.g. {@code "WITH-STMT"}); its value is either a rendered string, a list, or a nested
     * map produced by the children's own {@code getStruct()}. Iteration order is insertion order.
     *
     * @return A new, single-entry map.
     */
    Map<String, Object> getStruct();

    /**
     * Returns a list of the direct child nodes in source order.
     * This allows a generic walker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }
}
