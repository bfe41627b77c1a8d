package org.syntaxkit.walk;

import org.syntaxkit.ast.AstNode;

/**
 * Callback invoked by {@link AstWalker} for nodes of the kind it is registered for.
 */
public interface INodeHandler {
    /**
     * Handles a single AST node before its children are traversed.
     * @param node The node being visited.
     */
    void visit(AstNode node);

    /**
     * Called after all children of the node have been traversed.
     * Override to perform post-traversal actions such as leaving a scope.
     * @param node The node whose children have been traversed.
     */
    default void afterChildren(AstNode node) {}
}
