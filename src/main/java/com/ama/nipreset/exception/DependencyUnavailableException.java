package com.ama.nipreset.exception;

/**
 * Exception thrown when an external dependency cannot be reached or keeps failing.
 */
public class DependencyUnavailableException extends RuntimeException {

    public DependencyUnavailableException(String message) {
        super(message);
    }

    public DependencyUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
