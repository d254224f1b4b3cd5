package com.csveditor.app.services;

import com.csveditor.app.models.Cell;
import com.csveditor.app.models.RangeKind;
import com.csveditor.app.models.RangeSelection;
import com.csveditor.app.models.Selection;
import com.csveditor.app.models.SingleCellSelection;

/**
 * Tracks which part of the grid is active.
 * Holds at most one Selection; selecting anything replaces what was there.
 * Indices are not validated or clamped; callers pass addresses inside the grid.
 */
public class SelectionModel {

    private Selection current;

    public Selection getSelection() {
        return current;
    }

    /**
     * The selected cell, or null when nothing or a range is selected.
     */
    public Cell getSelectedCell() {
        return current instanceof SingleCellSelection ? ((SingleCellSelection) current).getCell() : null;
    }

    /**
     * The selected range, or null when nothing or a single cell is selected.
     */
    public RangeSelection getSelectedRange() {
        return current instanceof RangeSelection ? (RangeSelection) current : null;
    }

    public boolean isEmpty() {
        return current == null;
    }

    public void selectCell(Cell cell) {
        current = cell == null ? null : new SingleCellSelection(cell);
    }

    public void selectRange(RangeSelection range) {
        current = range;
    }

    /**
     * Whole row: anchor at column 0, focus at the last column.
     */
    public void selectRow(int rowIndex, int columnCount) {
        current = new RangeSelection(rowIndex, 0, rowIndex, columnCount - 1, RangeKind.ROW);
    }

    /**
     * Whole column: anchor at row 0, focus at the last row.
     */
    public void selectColumn(int columnIndex, int rowCount) {
        current = new RangeSelection(0, columnIndex, rowCount - 1, columnIndex, RangeKind.COLUMN);
    }

    public void selectAll(int rowCount, int columnCount) {
        current = new RangeSelection(0, 0, rowCount - 1, columnCount - 1, RangeKind.RANGE);
    }

    /**
     * Shift-click / shift-arrow.
     * - single cell selected: range from that cell (anchor) to the target (focus)
     * - range selected: same anchor, target becomes the new focus
     * - nothing selected: selects the target cell
     */
    public void extendSelection(Cell toCell) {
        if (current instanceof SingleCellSelection) {
            Cell origin = ((SingleCellSelection) current).getCell();
            current = new RangeSelection(origin.getRow(), origin.getColumn(),
                    toCell.getRow(), toCell.getColumn(), RangeKind.RANGE);
        } else if (current instanceof RangeSelection) {
            current = ((RangeSelection) current).withFocus(toCell.getRow(), toCell.getColumn());
        } else {
            selectCell(toCell);
        }
    }

    public void clear() {
        current = null;
    }
}
