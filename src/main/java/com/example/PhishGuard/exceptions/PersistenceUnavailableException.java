package com.example.PhishGuard.exceptions;

/**
 * The prediction store could not be reached, or no pooled connection freed up in time.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
