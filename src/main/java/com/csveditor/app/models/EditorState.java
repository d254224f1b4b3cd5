package com.csveditor.app.models;

/**
 * Snapshot of an editor's non-grid state, returned to clients after
 * each call so they can refresh toolbars and highlights.
 */
public final class EditorState {
    private final long sessionId;
    private final Selection selection;
    private final boolean canUndo;
    private final boolean canRedo;
    private final boolean unsavedChanges;
    private final int historySize;
    private final int historyCursor;
    private final boolean clipboardFilled;
    private final SortSpec currentSort;
    private final SearchResult search;

    public EditorState(long sessionId, Selection selection, boolean canUndo, boolean canRedo,
                       boolean unsavedChanges, int historySize, int historyCursor,
                       boolean clipboardFilled, SortSpec currentSort, SearchResult search) {
        this.sessionId = sessionId;
        this.selection = selection;
        this.canUndo = canUndo;
        this.canRedo = canRedo;
        this.unsavedChanges = unsavedChanges;
        this.historySize = historySize;
        this.historyCursor = historyCursor;
        this.clipboardFilled = clipboardFilled;
        this.currentSort = currentSort;
        this.search = search;
    }

    public long getSessionId() {
        return sessionId;
    }

    public Selection getSelection() {
        return selection;
    }

    public boolean isCanUndo() {
        return canUndo;
    }

    public boolean isCanRedo() {
        return canRedo;
    }

    public boolean isUnsavedChanges() {
        return unsavedChanges;
    }

    public int getHistorySize() {
        return historySize;
    }

    public int getHistoryCursor() {
        return historyCursor;
    }

    public boolean isClipboardFilled() {
        return clipboardFilled;
    }

    public SortSpec getCurrentSort() {
        return currentSort;
    }

    public SearchResult getSearch() {
        return search;
    }
}
