package org.syntaxkit.ast;

/**
 * Capability interface for elements that know where in the source text they originated.
 *
 * <p>Every {@link AstNode} implements it. Nodes built programmatically, without a parser
 * behind them, report {@link SourceLocation#NO_SOURCE_LOCATION} instead of null.
 */
public interface SourceLocatable {

    /**
     * Returns the location this element originated from.
     *
     * @return The source location, never null. May be {@link SourceLocation#NO_SOURCE_LOCATION}.
     */
    SourceLocation getSourceLocation();
}
