package com.csveditor.app.controllers;

import com.csveditor.app.models.SearchOptions;

/**
 * Body of POST /grid/{id}/search: the query text plus match options.
 */
public class SearchRequest {
    private String query;
    private SearchOptions options;

    // Default constructor needed for JSON deserialization
    public SearchRequest() {
    }

    public SearchRequest(String query, SearchOptions options) {
        this.query = query;
        this.options = options;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    public SearchOptions getOptions() {
        return options;
    }

    public void setOptions(SearchOptions options) {
        this.options = options;
    }
}
