package com.csveditor.app.exceptions;

/**
 * Thrown when a replacement grid breaks the shape rule
 * (every row must have one cell per header).
 */
public class InvalidGridException extends RuntimeException {
    public InvalidGridException(String message) {
        super(message);
    }
}
