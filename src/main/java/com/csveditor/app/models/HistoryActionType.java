package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Enumerates the kinds of undoable edits.
 * REPLACE_ALL covers every bulk replacement: sort and reorder results
 * and both search replacements (current match and all matches).
 */
public enum HistoryActionType {
    CELL_UPDATE,
    PASTE,
    DELETE,
    CUT,
    ADD_ROW,
    DELETE_ROW,
    DUPLICATE_ROW,
    ADD_COLUMN,
    DELETE_COLUMN,
    RENAME_COLUMN,
    REPLACE_ALL;

    @JsonValue
    public String toValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
