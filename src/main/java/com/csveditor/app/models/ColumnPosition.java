package com.csveditor.app.models;

import com.csveditor.app.exceptions.InvalidPositionException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum ColumnPosition {
    BEFORE,
    AFTER;

    @JsonCreator
    public static ColumnPosition fromValue(String value) {
        for (ColumnPosition position : values()) {
            if (value != null && position.name().equalsIgnoreCase(value.trim())) {
                return position;
            }
        }
        throw new InvalidPositionException("Unknown column position '" + value + "', expected \"before\" or \"after\"");
    }
}
