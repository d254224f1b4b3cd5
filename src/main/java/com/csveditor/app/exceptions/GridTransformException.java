package com.csveditor.app.exceptions;

/**
 * Thrown when the sort/reorder service fails to produce a result.
 * The grid and history are left as they were.
 */
public class GridTransformException extends RuntimeException {
    public GridTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
