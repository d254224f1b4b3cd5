package com.csveditor.app.models;

import java.util.Objects;

/**
 * One undoable unit: the grid before and after an edit, plus the selection
 * it applied to and an optional description. Immutable once built.
 */
public final class HistoryAction {
    private final HistoryActionType type;
    private final Grid before;
    private final Grid after;
    private final Object selectionContext; // Cell or Selection, may be null
    private final String description;
    private final long timestamp;

    public HistoryAction(HistoryActionType type, Grid before, Grid after,
                         Object selectionContext, String description, long timestamp) {
        this.type = Objects.requireNonNull(type, "type");
        this.before = Objects.requireNonNull(before, "before");
        this.after = Objects.requireNonNull(after, "after");
        this.selectionContext = selectionContext;
        this.description = description;
        this.timestamp = timestamp;
    }

    public static HistoryAction of(HistoryActionType type, Grid before, Grid after, Object selectionContext) {
        return new HistoryAction(type, before, after, selectionContext, null, System.currentTimeMillis());
    }

    public HistoryActionType getType() {
        return type;
    }

    public Grid getBefore() {
        return before;
    }

    public Grid getAfter() {
        return after;
    }

    public Object getSelectionContext() {
        return selectionContext;
    }

    public String getDescription() {
        return description;
    }

    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return type.toValue() + (description == null ? "" : " (" + description + ")");
    }
}
