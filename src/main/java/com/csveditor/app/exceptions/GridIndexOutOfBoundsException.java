package com.csveditor.app.exceptions;

/**
 * Thrown when an edit names a row or column that doesn't exist
 * in the current grid.
 * For example, "Row 12 out of bounds (grid has 10 rows)".
 */
public class GridIndexOutOfBoundsException extends RuntimeException {
    public GridIndexOutOfBoundsException(String message) {
        super(message);
    }
}
