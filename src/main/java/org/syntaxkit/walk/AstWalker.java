package org.syntaxkit.walk;

import org.syntaxkit.ast.ASTKind;
import org.syntaxkit.ast.AstNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Depth-first, source-order traversal of an AST.
 *
 * <p>The walker descends through {@link AstNode#getChildren()}, so it works for every node type
 * without knowing its structure. Each node is dispatched by its {@link ASTKind} to the handler in
 * the {@link NodeHandlerRegistry}; nodes without a handler are still descended into.
 */
public class AstWalker {

    private static final Logger LOG = LoggerFactory.getLogger(AstWalker.class);

    private final NodeHandlerRegistry registry;

    public AstWalker(NodeHandlerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Walks the tree rooted at the given node.
     * @param root The root node. Null is ignored.
     */
    public void walk(AstNode root) {
        if (root == null) {
            return;
        }
        traverse(List.of(root), 0);
    }

    private void traverse(List<AstNode> nodes, int depth) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            LOG.trace("Visiting {} at depth {} ({})", node.kind(), depth, node.getSourceLocation());
            Optional<INodeHandler> handler = registry.resolve(node.kind());
            handler.ifPresent(h -> h.visit(node));
            traverse(node.getChildren(), depth + 1);
            handler.ifPresent(h -> h.afterChildren(node));
        }
    }

    /**
     * Collects every node of the given kind in pre-order.
     *
     * @param root The root node.
     * @param kind The kind to collect.
     * @return The matching nodes, root first if it matches.
     */
    public static List<AstNode> collect(AstNode root, ASTKind kind) {
        List<AstNode> found = new ArrayList<>();
        new AstWalker(new NodeHandlerRegistry().register(kind, found::add)).walk(root);
        return found;
    }
}
