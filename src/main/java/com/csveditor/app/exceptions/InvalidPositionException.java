package com.csveditor.app.exceptions;

/**
 * Thrown when a row or column insert position is not one of the known names.
 */
public class InvalidPositionException extends RuntimeException {
    public InvalidPositionException(String message) {
        super(message);
    }
}
