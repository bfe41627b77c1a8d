package org.syntaxkit.ast;

/**
 * Thrown when a child node lacks the capability its parent requires,
 * or when a required child is null.
 */
public class InvalidNodeTypeException extends AstConstructionException {

    public InvalidNodeTypeException(String message) {
        super(message);
    }

    /**
     * Builds the standard message for a child that does not implement the expected type.
     *
     * @param parent   The node type being constructed, e.g. {@code "Block"}.
     * @param field    The field the child was passed for.
     * @param expected The required capability.
     * @param actual   The offending child, may be null.
     * @return A new exception.
     */
    public static InvalidNodeTypeException of(String parent, String field, Class<?> expected, Object actual) {
        String found = actual == null ? "null" : actual.getClass().getSimpleName();
        return new InvalidNodeTypeException(
                parent + "." + field + " requires " + expected.getSimpleName() + " but got " + found);
    }
}
