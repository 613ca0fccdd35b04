package com.ama.nipreset.exception;

/**
 * Exception thrown when email, phone, customer and vehicle do not match the directory.
 */
public class DirectoryMismatchException extends RuntimeException {

    public DirectoryMismatchException(String message) {
        super(message);
    }
}
