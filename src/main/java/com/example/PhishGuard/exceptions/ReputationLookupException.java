package com.example.PhishGuard.exceptions;

/**
 * Raised by a reputation lookup that timed out or got an unusable answer.
 * Callers degrade the attachment score instead of failing the submission.
 */
public class ReputationLookupException extends Exception {

    public ReputationLookupException(String message) {
        super(message);
    }

    public ReputationLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
