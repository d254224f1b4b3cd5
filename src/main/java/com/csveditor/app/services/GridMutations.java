package com.csveditor.app.services;

import com.csveditor.app.exceptions.GridIndexOutOfBoundsException;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.Selection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Pure grid transforms: (grid, params) -> new grid.
 * None of these touch the input; rows an operation does not change are
 * passed through to the result as-is.
 */
public final class GridMutations {

    static final String NEW_COLUMN_PREFIX = "Column ";

    private GridMutations() {
    }

    public static Grid updateCell(Grid grid, int row, int column, String value) {
        checkCell(grid, row, column);
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        List<String> changed = new ArrayList<>(rows.get(row));
        changed.set(column, value == null ? "" : value);
        rows.set(row, changed);
        return grid.withRows(rows);
    }

    /**
     * Copies the selected rectangle into a row-major block.
     * Addresses outside the grid read as "".
     */
    public static List<List<String>> readBlock(Grid grid, Selection selection) {
        List<List<String>> block = new ArrayList<>();
        for (int r = selection.getStartRow(); r <= selection.getEndRow(); r++) {
            List<String> line = new ArrayList<>();
            for (int c = selection.getStartColumn(); c <= selection.getEndColumn(); c++) {
                line.add(grid.getValue(r, c));
            }
            block.add(line);
        }
        return block;
    }

    /**
     * Writes the block with its top-left at (startRow, startColumn).
     * Adds empty rows when the block runs past the last row; cells that
     * would land beyond the last column are dropped.
     */
    public static Grid paste(Grid grid, List<List<String>> block, int startRow, int startColumn) {
        int width = grid.getColumnCount();
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        for (int i = 0; i < block.size(); i++) {
            int targetRow = startRow + i;
            if (targetRow < 0) {
                continue;
            }
            while (targetRow >= rows.size()) {
                rows.add(emptyRow(width));
            }
            List<String> changed = null;
            List<String> source = block.get(i);
            for (int j = 0; j < source.size(); j++) {
                int targetColumn = startColumn + j;
                if (targetColumn < 0 || targetColumn >= width) {
                    continue;
                }
                if (changed == null) {
                    changed = new ArrayList<>(rows.get(targetRow));
                }
                changed.set(targetColumn, source.get(j));
            }
            if (changed != null) {
                rows.set(targetRow, changed);
            }
        }
        return grid.withRows(rows);
    }

    /**
     * Sets every cell inside the selection to "". Parts of the selection
     * that fall outside the grid are ignored.
     */
    public static Grid blank(Grid grid, Selection selection) {
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        int lastRow = Math.min(selection.getEndRow(), rows.size() - 1);
        int firstColumn = Math.max(selection.getStartColumn(), 0);
        int lastColumn = Math.min(selection.getEndColumn(), grid.getColumnCount() - 1);
        for (int r = Math.max(selection.getStartRow(), 0); r <= lastRow; r++) {
            if (firstColumn > lastColumn) {
                break;
            }
            List<String> changed = new ArrayList<>(rows.get(r));
            for (int c = firstColumn; c <= lastColumn; c++) {
                changed.set(c, "");
            }
            rows.set(r, changed);
        }
        return grid.withRows(rows);
    }

    /**
     * Inserts one empty row so that it ends up at insertIndex (0..rowCount).
     */
    public static Grid insertRow(Grid grid, int insertIndex) {
        if (insertIndex < 0 || insertIndex > grid.getRowCount()) {
            throw new GridIndexOutOfBoundsException("Cannot insert row at " + insertIndex
                    + " (grid has " + grid.getRowCount() + " rows)");
        }
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        rows.add(insertIndex, emptyRow(grid.getColumnCount()));
        return grid.withRows(rows);
    }

    public static Grid deleteRow(Grid grid, int rowIndex) {
        checkRow(grid, rowIndex);
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        rows.remove(rowIndex);
        return grid.withRows(rows);
    }

    /**
     * Inserts a copy of the row directly below it.
     */
    public static Grid duplicateRow(Grid grid, int rowIndex) {
        checkRow(grid, rowIndex);
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        rows.add(rowIndex + 1, new ArrayList<>(rows.get(rowIndex)));
        return grid.withRows(rows);
    }

    /**
     * Inserts a header and an empty cell in every row at insertIndex
     * (0..columnCount).
     */
    public static Grid insertColumn(Grid grid, int insertIndex, String header) {
        if (insertIndex < 0 || insertIndex > grid.getColumnCount()) {
            throw new GridIndexOutOfBoundsException("Cannot insert column at " + insertIndex
                    + " (grid has " + grid.getColumnCount() + " columns)");
        }
        List<String> headers = new ArrayList<>(grid.getHeaders());
        headers.add(insertIndex, header);
        List<List<String>> rows = new ArrayList<>(grid.getRowCount());
        for (List<String> row : grid.getRows()) {
            List<String> changed = new ArrayList<>(row);
            changed.add(insertIndex, "");
            rows.add(changed);
        }
        return grid.withHeadersAndRows(headers, rows);
    }

    public static Grid deleteColumn(Grid grid, int columnIndex) {
        checkColumn(grid, columnIndex);
        List<String> headers = new ArrayList<>(grid.getHeaders());
        headers.remove(columnIndex);
        List<List<String>> rows = new ArrayList<>(grid.getRowCount());
        for (List<String> row : grid.getRows()) {
            List<String> changed = new ArrayList<>(row);
            changed.remove(columnIndex);
            rows.add(changed);
        }
        return grid.withHeadersAndRows(headers, rows);
    }

    public static Grid renameColumn(Grid grid, int columnIndex, String newName) {
        checkColumn(grid, columnIndex);
        List<String> headers = new ArrayList<>(grid.getHeaders());
        headers.set(columnIndex, newName == null ? "" : newName);
        return grid.withHeaders(headers);
    }

    /**
     * Moves one row so that it ends up at toIndex; other rows keep their order.
     */
    public static Grid moveRow(Grid grid, int fromIndex, int toIndex) {
        checkRow(grid, fromIndex);
        checkRow(grid, toIndex);
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        List<String> moved = rows.remove(fromIndex);
        rows.add(toIndex, moved);
        return grid.withRows(rows);
    }

    /**
     * Moves one column (header and every cell) so that it ends up at toIndex.
     */
    public static Grid moveColumn(Grid grid, int fromIndex, int toIndex) {
        checkColumn(grid, fromIndex);
        checkColumn(grid, toIndex);
        List<String> headers = new ArrayList<>(grid.getHeaders());
        headers.add(toIndex, headers.remove(fromIndex));
        List<List<String>> rows = new ArrayList<>(grid.getRowCount());
        for (List<String> row : grid.getRows()) {
            List<String> changed = new ArrayList<>(row);
            changed.add(toIndex, changed.remove(fromIndex));
            rows.add(changed);
        }
        return grid.withHeadersAndRows(headers, rows);
    }

    /**
     * "Column N" where N starts at columnCount + 1 and is bumped until the
     * name is not already taken.
     */
    public static String nextColumnName(List<String> headers) {
        Set<String> taken = new HashSet<>(headers);
        int n = headers.size() + 1;
        while (taken.contains(NEW_COLUMN_PREFIX + n)) {
            n++;
        }
        return NEW_COLUMN_PREFIX + n;
    }

    public static List<String> defaultHeaders(int count) {
        List<String> headers = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            headers.add(NEW_COLUMN_PREFIX + i);
        }
        return headers;
    }

    static List<String> emptyRow(int width) {
        return new ArrayList<>(Collections.nCopies(width, ""));
    }

    // ----------------------------------------------------------------
    // Bounds checks
    // ----------------------------------------------------------------

    static void checkRow(Grid grid, int rowIndex) {
        if (rowIndex < 0 || rowIndex >= grid.getRowCount()) {
            throw new GridIndexOutOfBoundsException("Row " + rowIndex
                    + " out of bounds (grid has " + grid.getRowCount() + " rows)");
        }
    }

    static void checkColumn(Grid grid, int columnIndex) {
        if (columnIndex < 0 || columnIndex >= grid.getColumnCount()) {
            throw new GridIndexOutOfBoundsException("Column " + columnIndex
                    + " out of bounds (grid has " + grid.getColumnCount() + " columns)");
        }
    }

    static void checkCell(Grid grid, int row, int column) {
        checkRow(grid, row);
        checkColumn(grid, column);
    }
}
