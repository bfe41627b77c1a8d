package org.syntaxkit.ast;

/**
 * Thrown when a with-statement is constructed with no clauses.
 */
public class EmptyClauseListException extends AstConstructionException {

    public EmptyClauseListException(String message) {
        super(message);
    }
}
