package org.syntaxkit.ast;

import java.util.Optional;

/**
 * The primitive value kinds a {@link Literal} can hold.
 */
public enum LiteralType {
    /** Whole numbers, stored as {@link Long}. */
    INTEGER,
    /** Floating point numbers, stored as {@link Double}. */
    FLOAT,
    BOOLEAN,
    STRING;

    /**
     * Determines the literal type of a Java value.
     * @param value The candidate value.
     * @return The matching type, or empty for null and unsupported classes.
     */
    public static Optional<LiteralType> of(Object value) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return Optional.of(INTEGER);
        }
        if (value instanceof Double || value instanceof Float) {
            return Optional.of(FLOAT);
        }
        if (value instanceof Boolean) {
            return Optional.of(BOOLEAN);
        }
        if (value instanceof String) {
            return Optional.of(STRING);
        }
        return Optional.empty();
    }
}
