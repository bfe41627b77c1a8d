package org.syntaxkit.ast;

/**
 * A node that produces a value, such as a {@link Literal} or an {@link Identifier}.
 */
public interface Expr extends AstNode {
}
