package org.syntaxkit.ast;

/**
 * Tags every concrete node type. Consumers switch on {@link AstNode#kind()} instead of
 * inspecting the runtime class.
 */
public enum ASTKind {
    IDENTIFIER,
    LITERAL,
    BLOCK,
    WITH_ITEM,
    WITH_STMT
}
