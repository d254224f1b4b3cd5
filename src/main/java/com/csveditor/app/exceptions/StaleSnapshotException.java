package com.csveditor.app.exceptions;

/**
 * Thrown when an external transform finishes but the grid it was computed
 * from is no longer the live grid (it was edited in the meantime).
 * The result is discarded.
 */
public class StaleSnapshotException extends RuntimeException {
    public StaleSnapshotException(String message) {
        super(message);
    }
}
