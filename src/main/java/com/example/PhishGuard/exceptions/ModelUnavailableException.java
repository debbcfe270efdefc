package com.example.PhishGuard.exceptions;

/**
 * The classifier artifacts failed to load at startup, so no verdict can be produced.
 */
public class ModelUnavailableException extends RuntimeException {

    public ModelUnavailableException(String message) {
        super(message);
    }
}
