package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The authoritative in-memory table:
 * - headers (column names, possibly empty strings)
 * - rows, each an ordered list of cell values
 * - metadata, for display only
 *
 * A Grid never changes after construction. Every edit produces a new Grid;
 * rows that an edit did not touch are shared between the old and new value,
 * which is safe because each row list is itself unmodifiable.
 */
public final class Grid {

    private final List<String> headers;
    private final List<List<String>> rows;
    private final GridMetadata metadata;

    @JsonCreator
    public Grid(@JsonProperty("headers") List<String> headers,
                @JsonProperty("rows") List<List<String>> rows,
                @JsonProperty("metadata") GridMetadata metadata) {
        this.headers = freeze(headers);
        List<List<String>> frozenRows = new ArrayList<>(rows == null ? 0 : rows.size());
        if (rows != null) {
            for (List<String> row : rows) {
                frozenRows.add(freeze(row));
            }
        }
        this.rows = List.copyOf(frozenRows);
        this.metadata = metadata == null
                ? GridMetadata.untitled(this.rows.size(), this.headers.size())
                : metadata;
    }

    public Grid(List<String> headers, List<List<String>> rows) {
        this(headers, rows, null);
    }

    /**
     * An empty grid with the given column names and no rows.
     */
    public static Grid empty(List<String> headers) {
        return new Grid(headers, List.of(), null);
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public GridMetadata getMetadata() {
        return metadata;
    }

    @JsonIgnore
    public int getRowCount() {
        return rows.size();
    }

    @JsonIgnore
    public int getColumnCount() {
        return headers.size();
    }

    /**
     * Value at (row, column), or "" when the address lies outside the grid
     * or the row is shorter than the header list.
     */
    public String getValue(int row, int column) {
        if (row < 0 || row >= rows.size() || column < 0) {
            return "";
        }
        List<String> cells = rows.get(row);
        return column < cells.size() ? cells.get(column) : "";
    }

    public boolean containsCell(int row, int column) {
        return row >= 0 && row < rows.size() && column >= 0 && column < headers.size();
    }

    /**
     * True when every row has exactly one cell per header.
     */
    @JsonIgnore
    public boolean isRectangular() {
        int width = headers.size();
        for (List<String> row : rows) {
            if (row.size() != width) {
                return false;
            }
        }
        return true;
    }

    /**
     * This grid with short rows padded with "" and long rows cut to the
     * header count. Returns this when already rectangular.
     */
    public Grid normalized() {
        if (isRectangular()) {
            return this;
        }
        int width = headers.size();
        List<List<String>> fixed = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() == width) {
                fixed.add(row);
            } else if (row.size() > width) {
                fixed.add(row.subList(0, width));
            } else {
                List<String> padded = new ArrayList<>(row);
                while (padded.size() < width) {
                    padded.add("");
                }
                fixed.add(padded);
            }
        }
        return new Grid(headers, fixed, metadata);
    }

    public Grid withRows(List<List<String>> newRows) {
        return new Grid(headers, newRows, metadata);
    }

    public Grid withHeadersAndRows(List<String> newHeaders, List<List<String>> newRows) {
        return new Grid(newHeaders, newRows, metadata);
    }

    public Grid withHeaders(List<String> newHeaders) {
        return new Grid(newHeaders, rows, metadata);
    }

    // Already-frozen lists come back from List.copyOf as the same instance.
    private static List<String> freeze(List<String> values) {
        if (values == null) {
            return List.of();
        }
        for (String value : values) {
            if (value == null) {
                List<String> cleaned = new ArrayList<>(values.size());
                for (String v : values) {
                    cleaned.add(v == null ? "" : v);
                }
                return List.copyOf(cleaned);
            }
        }
        return List.copyOf(values);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Grid)) {
            return false;
        }
        Grid grid = (Grid) o;
        return headers.equals(grid.headers)
                && rows.equals(grid.rows)
                && metadata.equals(grid.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headers, rows, metadata);
    }

    @Override
    public String toString() {
        return "Grid{headers=" + headers + ", rows=" + rows.size() + "}";
    }
}
