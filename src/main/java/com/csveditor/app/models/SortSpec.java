package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Ordered sort keys; earlier columns take precedence.
 */
public final class SortSpec {
    private static final SortSpec NONE = new SortSpec(List.of());

    private final List<SortColumn> columns;

    @JsonCreator
    public SortSpec(@JsonProperty("columns") List<SortColumn> columns) {
        this.columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public static SortSpec none() {
        return NONE;
    }

    public List<SortColumn> getColumns() {
        return columns;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return columns.isEmpty();
    }

    public String describe() {
        int n = columns.size();
        return "Sort by " + n + " column" + (n > 1 ? "s" : "");
    }
}
