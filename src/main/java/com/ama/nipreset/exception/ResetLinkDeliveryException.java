package com.ama.nipreset.exception;

/**
 * Exception thrown when the reset email could not be handed to the mail relay.
 */
public class ResetLinkDeliveryException extends RuntimeException {

    public ResetLinkDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
