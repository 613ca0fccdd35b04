package com.ama.nipreset.exception;

/**
 * Exception thrown when a reset token could not be persisted.
 */
public class TokenIssuanceException extends RuntimeException {

    public TokenIssuanceException(String message) {
        super(message);
    }

    public TokenIssuanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
