package org.syntaxkit.walk;

import org.syntaxkit.ast.ASTKind;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry mapping {@link ASTKind} tags to the handler {@link AstWalker} dispatches to.
 * At most one handler is registered per kind; registering again replaces it.
 */
public final class NodeHandlerRegistry {

    private final Map<ASTKind, INodeHandler> handlers = new EnumMap<>(ASTKind.class);

    /**
     * Registers a handler for the given node kind.
     *
     * @param kind    The node kind.
     * @param handler The handler instance.
     * @return This registry, for chaining.
     */
    public NodeHandlerRegistry register(ASTKind kind, INodeHandler handler) {
        handlers.put(kind, handler);
        return this;
    }

    /**
     * Resolves the handler for the given node kind.
     *
     * @param kind The node kind to look up.
     * @return Optional handler if registered.
     */
    public Optional<INodeHandler> resolve(ASTKind kind) {
        return Optional.ofNullable(handlers.get(kind));
    }
}
