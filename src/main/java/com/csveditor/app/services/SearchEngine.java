package com.csveditor.app.services;

import com.csveditor.app.models.Cell;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.SearchOptions;
import com.csveditor.app.models.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;

/**
 * Query, options and the result of the last scan.
 *
 * matches is a point-in-time list: edits to the grid do not update it.
 * The owning editor rescans after undo/redo; every other edit leaves it
 * as it was until the next explicit search.
 */
public class SearchEngine {

    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    private String query = "";
    private SearchOptions options = SearchOptions.defaults();
    private List<Cell> matches = new ArrayList<>();
    private int cursor = -1;
    private String error;

    /**
     * Stores the query and options without scanning.
     */
    public void setQuery(String text, SearchOptions newOptions) {
        this.query = text == null ? "" : text;
        this.options = newOptions == null ? SearchOptions.defaults() : newOptions;
    }

    public String getQuery() {
        return query;
    }

    public SearchOptions getOptions() {
        return options;
    }

    /**
     * A query is active once non-empty text has been set.
     */
    public boolean isActive() {
        return !query.isEmpty();
    }

    /**
     * Scans every row, then every targeted column within the row.
     * An invalid pattern ends the scan with zero matches and sets error.
     */
    public SearchResult performSearch(Grid grid) {
        matches = new ArrayList<>();
        cursor = -1;
        error = null;
        if (!isActive()) {
            return snapshot();
        }

        CellMatcher matcher;
        try {
            matcher = new CellMatcher(query, options);
        } catch (PatternSyntaxException ex) {
            log.warn("Invalid search pattern '{}': {}", query, ex.getDescription());
            error = "Invalid regular expression: " + ex.getDescription();
            return snapshot();
        }

        Integer only = options.getColumnIndex();
        for (int r = 0; r < grid.getRowCount(); r++) {
            List<String> row = grid.getRows().get(r);
            int from = only == null ? 0 : Math.max(only, 0);
            int to = only == null ? row.size() - 1 : Math.min(only, row.size() - 1);
            for (int c = from; c <= to; c++) {
                String value = row.get(c);
                if (matcher.matches(value)) {
                    matches.add(new Cell(r, c, value));
                }
            }
        }
        cursor = matches.isEmpty() ? -1 : 0;
        log.debug("Search '{}' found {} matches", query, matches.size());
        return snapshot();
    }

    /**
     * Moves to the following match, wrapping to the first.
     * Returns the new current match, or null when there are none.
     */
    public Cell nextMatch() {
        if (matches.isEmpty()) {
            return null;
        }
        cursor = (cursor + 1) % matches.size();
        return matches.get(cursor);
    }

    /**
     * Moves to the preceding match, wrapping to the last.
     */
    public Cell previousMatch() {
        if (matches.isEmpty()) {
            return null;
        }
        cursor = cursor <= 0 ? matches.size() - 1 : cursor - 1;
        return matches.get(cursor);
    }

    public Cell currentMatch() {
        return cursor >= 0 && cursor < matches.size() ? matches.get(cursor) : null;
    }

    public List<Cell> getMatches() {
        return List.copyOf(matches);
    }

    public int getCursor() {
        return cursor;
    }

    public String getError() {
        return error;
    }

    /**
     * The value with the active query replaced the way the current mode
     * replaces it. Unchanged when the value does not match.
     */
    public String replacementFor(String value, String replacement) {
        return new CellMatcher(query, options).replace(value, replacement == null ? "" : replacement);
    }

    /**
     * Forgets query, options, matches and cursor.
     */
    public void clear() {
        query = "";
        options = SearchOptions.defaults();
        matches = new ArrayList<>();
        cursor = -1;
        error = null;
    }

    public SearchResult snapshot() {
        return new SearchResult(query, options, matches, cursor, error);
    }
}
