package com.ama.nipreset.exception;

/**
 * Exception thrown when a reset token is missing, already used or expired.
 * The three causes are reported identically.
 */
public class InvalidResetTokenException extends RuntimeException {

    public InvalidResetTokenException() {
        super("Reset token is invalid or expired");
    }
}
