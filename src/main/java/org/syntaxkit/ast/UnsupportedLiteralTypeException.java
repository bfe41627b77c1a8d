package org.syntaxkit.ast;

/**
 * Thrown when a {@link Literal} is given a value that is not one of the {@link LiteralType}s.
 */
public class UnsupportedLiteralTypeException extends AstConstructionException {

    public UnsupportedLiteralTypeException(String message) {
        super(message);
    }
}
