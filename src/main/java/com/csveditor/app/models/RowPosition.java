package com.csveditor.app.models;

import com.csveditor.app.exceptions.InvalidPositionException;
import com.fasterxml.jackson.annotation.JsonCreator;

public enum RowPosition {
    ABOVE,
    BELOW;

    @JsonCreator
    public static RowPosition fromValue(String value) {
        for (RowPosition position : values()) {
            if (value != null && position.name().equalsIgnoreCase(value.trim())) {
                return position;
            }
        }
        throw new InvalidPositionException("Unknown row position '" + value + "', expected \"above\" or \"below\"");
    }
}
