package com.arbor.json;

/**
 * Thrown when a tree cannot be written to or read from JSON.
 */
public class AstJsonException extends RuntimeException {

    public AstJsonException(String message) {
        super(message);
    }

    public AstJsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
