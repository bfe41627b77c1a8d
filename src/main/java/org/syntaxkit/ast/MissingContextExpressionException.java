package org.syntaxkit.ast;

/**
 * Thrown when a with-clause is constructed without its context expression.
 */
public class MissingContextExpressionException extends AstConstructionException {

    public MissingContextExpressionException(String message) {
        super(message);
    }
}
