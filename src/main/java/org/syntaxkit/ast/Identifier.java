package org.syntaxkit.ast;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An AST node that represents a name reference, e.g. the {@code x} in {@code with f() as x}.
 * Two identifiers are equal when their names are, wherever they appeared.
 *
 * @param name     The referenced name. May be empty but never null.
 * @param location Where the name appeared in the source.
 */
public record Identifier(
        String name,
        SourceLocation location
) implements Expr {

    public Identifier {
        if (name == null) {
            throw new AstConstructionException("Identifier.name must not be null");
        }
        if (location == null) {
            location = SourceLocation.NO_SOURCE_LOCATION;
        }
    }

    /**
     * Creates an identifier without a source location.
     * @param name The referenced name.
     */
    public Identifier(String name) {
        this(name, SourceLocation.NO_SOURCE_LOCATION);
    }

    @Override
    public ASTKind kind() {
        return ASTKind.IDENTIFIER;
    }

    @Override
    public SourceLocation getSourceLocation() {
        return location;
    }

    @Override
    public Map<String, Object> getStruct() {
        Map<String, Object> struct = new LinkedHashMap<>();
        struct.put("IDENTIFIER[" + name + "]", name);
        return struct;
    }

    @Override
    public String toString() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Identifier other)) return false;
        // Location is informational and does not take part in equality.
        return name.equals(other.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }
}
