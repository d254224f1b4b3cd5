package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A cell address plus the value that was at that address when the Cell was
 * built. The value is a snapshot: it is never re-read from the grid, so a
 * Cell kept across an edit must be rebuilt before its value is trusted again.
 */
public final class Cell {
    private final int row;
    private final int column;
    private final String value;

    @JsonCreator
    public Cell(@JsonProperty("row") int row,
                @JsonProperty("column") int column,
                @JsonProperty("value") String value) {
        this.row = row;
        this.column = column;
        this.value = value == null ? "" : value;
    }

    /**
     * Reads the current value at (row, column) from the grid.
     */
    public static Cell of(Grid grid, int row, int column) {
        return new Cell(row, column, grid.getValue(row, column));
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Cell)) {
            return false;
        }
        Cell cell = (Cell) o;
        return row == cell.row && column == cell.column && value.equals(cell.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(row, column, value);
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")=" + value;
    }
}
