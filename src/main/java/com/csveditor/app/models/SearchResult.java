package com.csveditor.app.models;

import java.util.List;

/**
 * Read-only view of the search state after a scan or navigation step.
 * error is non-null only when the last scan could not run (bad pattern).
 */
public final class SearchResult {
    private final String query;
    private final SearchOptions options;
    private final List<Cell> matches;
    private final int currentIndex;
    private final String error;

    public SearchResult(String query, SearchOptions options, List<Cell> matches, int currentIndex, String error) {
        this.query = query;
        this.options = options;
        this.matches = List.copyOf(matches);
        this.currentIndex = currentIndex;
        this.error = error;
    }

    public String getQuery() {
        return query;
    }

    public SearchOptions getOptions() {
        return options;
    }

    public List<Cell> getMatches() {
        return matches;
    }

    public int getCurrentIndex() {
        return currentIndex;
    }

    public Cell getCurrentMatch() {
        return currentIndex >= 0 && currentIndex < matches.size() ? matches.get(currentIndex) : null;
    }

    public int getMatchCount() {
        return matches.size();
    }

    public String getError() {
        return error;
    }
}
