package com.exprtree.json;

/**
 * Exception thrown when an expression tree cannot be written as JSON.
 */
public class ExprJsonException extends RuntimeException {

    public ExprJsonException(String message) {
        super(message);
    }

    public ExprJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExprJsonException(Throwable cause) {
        super(cause);
    }
}
