package org.syntaxkit.ast;

/**
 * A position in the source text, identified by line and column.
 *
 * <p>Nodes without a known origin carry {@link #NO_SOURCE_LOCATION}. The location is
 * informational only; it never takes part in rendering or structured export.
 *
 * @param line   The line number, or -1 for {@link #NO_SOURCE_LOCATION}.
 * @param column The column number, or -1 for {@link #NO_SOURCE_LOCATION}.
 */
public record SourceLocation(int line, int column) {

    /** The location of nodes that were not produced from source text. */
    public static final SourceLocation NO_SOURCE_LOCATION = new SourceLocation(-1, -1);

    public SourceLocation {
        boolean sentinel = line == -1 && column == -1;
        if (!sentinel && (line < 0 || column < 0)) {
            throw new IllegalArgumentException(
                    "Source location must not be negative: line=" + line + ", column=" + column);
        }
    }

    /**
     * Checks whether this is a real location rather than {@link #NO_SOURCE_LOCATION}.
     * @return true if line and column point into the source text.
     */
    public boolean isKnown() {
        return line >= 0;
    }

    @Override
    public String toString() {
        return isKnown() ? line + ":" + column : "<no location>";
    }
}
