package org.syntaxkit.ast;

/**
 * A node that produces an effect. Statements are the only nodes a {@link Block} accepts.
 */
public interface Statement extends AstNode {
}
