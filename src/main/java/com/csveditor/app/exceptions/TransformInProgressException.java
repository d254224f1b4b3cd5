package com.csveditor.app.exceptions;

/**
 * Thrown when a sort or reorder is requested while a previous one
 * on the same editor has not finished yet.
 */
public class TransformInProgressException extends RuntimeException {
    public TransformInProgressException(String message) {
        super(message);
    }
}
