package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A rectangular selection with anchor/focus semantics.
 * - anchor: where the drag or shift-extend gesture started; never moves
 * - focus: the current endpoint of the gesture
 * - start/end: the min/max bounding box of anchor and focus
 */
public final class RangeSelection extends Selection {

    private final int anchorRow;
    private final int anchorColumn;
    private final int focusRow;
    private final int focusColumn;
    private final RangeKind kind;

    public RangeSelection(int anchorRow, int anchorColumn, int focusRow, int focusColumn, RangeKind kind) {
        this.anchorRow = anchorRow;
        this.anchorColumn = anchorColumn;
        this.focusRow = focusRow;
        this.focusColumn = focusColumn;
        this.kind = kind == null ? RangeKind.RANGE : kind;
    }

    /**
     * JSON entry point. Anchor/focus default to start/end when a client only
     * sends the bounding box.
     */
    @JsonCreator
    public static RangeSelection fromJson(@JsonProperty("startRow") Integer startRow,
                                          @JsonProperty("startColumn") Integer startColumn,
                                          @JsonProperty("endRow") Integer endRow,
                                          @JsonProperty("endColumn") Integer endColumn,
                                          @JsonProperty("anchorRow") Integer anchorRow,
                                          @JsonProperty("anchorColumn") Integer anchorColumn,
                                          @JsonProperty("focusRow") Integer focusRow,
                                          @JsonProperty("focusColumn") Integer focusColumn,
                                          @JsonProperty("kind") RangeKind kind) {
        int aRow = firstNonNull(anchorRow, startRow);
        int aCol = firstNonNull(anchorColumn, startColumn);
        int fRow = firstNonNull(focusRow, endRow);
        int fCol = firstNonNull(focusColumn, endColumn);
        return new RangeSelection(aRow, aCol, fRow, fCol, kind);
    }

    private static int firstNonNull(Integer preferred, Integer fallback) {
        if (preferred != null) {
            return preferred;
        }
        return fallback == null ? 0 : fallback;
    }

    /**
     * Same anchor, new focus. The bounding box is recomputed from the anchor,
     * so repeated extends always measure from where the gesture began.
     */
    public RangeSelection withFocus(int row, int column) {
        return new RangeSelection(anchorRow, anchorColumn, row, column, RangeKind.RANGE);
    }

    @Override
    public int getStartRow() {
        return Math.min(anchorRow, focusRow);
    }

    @Override
    public int getStartColumn() {
        return Math.min(anchorColumn, focusColumn);
    }

    @Override
    public int getEndRow() {
        return Math.max(anchorRow, focusRow);
    }

    @Override
    public int getEndColumn() {
        return Math.max(anchorColumn, focusColumn);
    }

    public int getAnchorRow() {
        return anchorRow;
    }

    public int getAnchorColumn() {
        return anchorColumn;
    }

    public int getFocusRow() {
        return focusRow;
    }

    public int getFocusColumn() {
        return focusColumn;
    }

    public RangeKind getKind() {
        return kind;
    }

    public int getRowSpan() {
        return getEndRow() - getStartRow() + 1;
    }

    public int getColumnSpan() {
        return getEndColumn() - getStartColumn() + 1;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangeSelection)) {
            return false;
        }
        RangeSelection that = (RangeSelection) o;
        return anchorRow == that.anchorRow
                && anchorColumn == that.anchorColumn
                && focusRow == that.focusRow
                && focusColumn == that.focusColumn
                && kind == that.kind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(anchorRow, anchorColumn, focusRow, focusColumn, kind);
    }

    @Override
    public String toString() {
        return "Range[" + kind.toValue() + " (" + getStartRow() + "," + getStartColumn() + ")-("
                + getEndRow() + "," + getEndColumn() + ") anchor=(" + anchorRow + "," + anchorColumn + ")]";
    }
}
