package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a range selection was created from. Only affects display;
 * every kind is the same rectangle underneath.
 */
public enum RangeKind {
    ROW,
    COLUMN,
    RANGE;

    /**
     * Allows case-insensitive JSON input, e.g. "row" -> ROW.
     */
    @JsonCreator
    public static RangeKind fromValue(String value) {
        return value == null ? RANGE : RangeKind.valueOf(value.toUpperCase(Locale.ROOT));
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
