package com.csveditor.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * How a query is matched against cell values:
 * - caseSensitive: compare without case folding
 * - wholeWord: a whitespace-delimited token must equal the query
 * - regex: the query is a pattern, matched anywhere in the value
 * - columnIndex: restrict the scan to one column (null means all)
 *
 * When both regex and wholeWord are set, regex wins.
 */
public final class SearchOptions {
    private static final SearchOptions DEFAULTS = new SearchOptions(false, false, false, null);

    private final boolean caseSensitive;
    private final boolean wholeWord;
    private final boolean regex;
    private final Integer columnIndex;

    @JsonCreator
    public SearchOptions(@JsonProperty("caseSensitive") boolean caseSensitive,
                         @JsonProperty("wholeWord") boolean wholeWord,
                         @JsonProperty("regex") boolean regex,
                         @JsonProperty("columnIndex") Integer columnIndex) {
        this.caseSensitive = caseSensitive;
        this.wholeWord = wholeWord;
        this.regex = regex;
        this.columnIndex = columnIndex;
    }

    public static SearchOptions defaults() {
        return DEFAULTS;
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    public boolean isWholeWord() {
        return wholeWord;
    }

    public boolean isRegex() {
        return regex;
    }

    public Integer getColumnIndex() {
        return columnIndex;
    }
}
