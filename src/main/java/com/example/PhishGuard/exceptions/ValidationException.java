package com.example.PhishGuard.exceptions;

/**
 * Submission rejected before any classification work, e.g. a blank subject or body.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
