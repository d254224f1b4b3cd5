package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One key of a multi-column sort: which column and which direction.
 */
public final class SortColumn {
    private final int columnIndex;
    private final SortDirection direction;

    @JsonCreator
    public SortColumn(@JsonProperty("columnIndex") int columnIndex,
                      @JsonProperty("direction") SortDirection direction) {
        this.columnIndex = columnIndex;
        this.direction = direction == null ? SortDirection.ASCENDING : direction;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public SortDirection getDirection() {
        return direction;
    }
}
