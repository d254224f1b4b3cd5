package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum SortDirection {
    ASCENDING,
    DESCENDING;

    /**
     * Accepts "asc"/"desc" as well as the full names, any case.
     */
    @JsonCreator
    public static SortDirection fromValue(String value) {
        String upper = value.toUpperCase(Locale.ROOT);
        if (upper.equals("ASC")) {
            return ASCENDING;
        }
        if (upper.equals("DESC")) {
            return DESCENDING;
        }
        return SortDirection.valueOf(upper);
    }
}
