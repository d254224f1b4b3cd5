package com.csveditor.app.exceptions;

/**
 * Thrown when attempting to access an editor session ID
 * that is not open in the in-memory session store.
 */
public class SessionNotFoundException extends RuntimeException {
    public SessionNotFoundException(String message) {
        super(message);
    }
}
