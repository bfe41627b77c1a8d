package org.syntaxkit.ast;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An AST node that represents a constant value such as {@code 42}, {@code 1.5},
 * {@code true} or {@code "text"}.
 *
 * <p>Integral values are widened to {@link Long} and floating point values to {@link Double},
 * so {@code new Literal(42)} and {@code Literal.of(42L)} are equal. A {@link Float} is widened
 * through its decimal text, so {@code new Literal(0.1f)} renders as {@code 0.1}.
 */
public final class Literal implements Expr {

    private final LiteralType type;
    private final Object value;
    private final SourceLocation location;

    /**
     * Creates a literal from a boxed primitive or string.
     *
     * @param value    The constant value.
     * @param location Where the literal appeared, or {@link SourceLocation#NO_SOURCE_LOCATION}.
     * @throws UnsupportedLiteralTypeException if the value is null or of an unsupported class.
     */
    public Literal(Object value, SourceLocation location) {
        this.type = LiteralType.of(value).orElseThrow(() -> new UnsupportedLiteralTypeException(
                "Literal.value must be an integer, float, boolean or string but got "
                        + (value == null ? "null" : value.getClass().getSimpleName())));
        this.value = normalize(type, value);
        this.location = location != null ? location : SourceLocation.NO_SOURCE_LOCATION;
    }

    public Literal(Object value) {
        this(value, SourceLocation.NO_SOURCE_LOCATION);
    }

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    private static Object normalize(LiteralType type, Object value) {
        return switch (type) {
            case INTEGER -> ((Number) value).longValue();
            // Widen floats through their shortest decimal form so 0.1f stays 0.1.
            case FLOAT -> value instanceof Float f
                    ? Double.parseDouble(Float.toString(f))
                    : ((Number) value).doubleValue();
            case BOOLEAN, STRING -> value;
        };
    }

    public LiteralType type() {
        return type;
    }

    /**
     * @return The value as {@link Long}, {@link Double}, {@link Boolean} or {@link String}.
     */
    public Object value() {
        return value;
    }

    @Override
    public ASTKind kind() {
        return ASTKind.LITERAL;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return location;
    }

    @Override
    public Map<String, Object> getStruct() {
        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("LITERAL[" + type.name() + "]", toString());
        return struct;
    }

    @Override
    public String toString() {
        if (type == LiteralType.STRING) {
            String escaped = ((String) value).replace("\\", "\\\\").replace("\"", "\\\"");
            return "\"" + escaped + "\"";
        }
        return String.valueOf(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Literal other)) return false;
        // Location is informational and does not take part in equality.
        return type == other.type && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value);
    }
}
