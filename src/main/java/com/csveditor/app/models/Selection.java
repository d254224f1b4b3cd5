package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * The active part of a grid: either a single cell or a rectangular range.
 * Holding one Selection value (instead of a cell field and a range field)
 * means the two can never be set at once.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = SingleCellSelection.class, name = "cell"),
        @JsonSubTypes.Type(value = RangeSelection.class, name = "range")
})
public abstract class Selection {

    Selection() {
    }

    public abstract int getStartRow();

    public abstract int getStartColumn();

    public abstract int getEndRow();

    public abstract int getEndColumn();

    public boolean contains(int row, int column) {
        return row >= getStartRow() && row <= getEndRow()
                && column >= getStartColumn() && column <= getEndColumn();
    }
}
