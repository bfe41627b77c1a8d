package org.syntaxkit.ast;

/**
 * Thrown when a node cannot be constructed from the given children.
 * <p>
 * Construction failures are raised by the constructor itself, never deferred to rendering
 * or export. Possible causes include:
 * <ul>
 *   <li>A required child is missing</li>
 *   <li>A child has the wrong capability (e.g. an expression where a statement is required)</li>
 *   <li>A composite was given an empty clause list</li>
 * </ul>
 * <p>
 * This is a RuntimeException because every such failure is a programming error in the caller
 * that assembles the tree, not a condition that can be recovered from.
 */
public class AstConstructionException extends RuntimeException {

    /**
     * Creates an AstConstructionException with the specified message.
     *
     * @param message Description of the construction failure
     */
    public AstConstructionException(String message) {
        super(message);
    }

    /**
     * Creates an AstConstructionException with the specified message and cause.
     *
     * @param message Description of the construction failure
     * @param cause The underlying exception that caused the failure
     */
    public AstConstructionException(String message, Throwable cause) {
        super(message, cause);
    }
}
