package com.csveditor.app.services;

import com.csveditor.app.models.SearchOptions;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Match predicate and replacement rule for one query under one set of options.
 *
 * Modes:
 * - plain: substring containment; replacement touches the first occurrence only
 * - whole word: some whitespace-delimited token equals the query; replacement
 *   touches the first such token only
 * - regex: pattern found anywhere; replacement touches every occurrence
 */
final class CellMatcher {

    // Unicode whitespace (ideographic and no-break spaces included) separates tokens
    private static final Pattern TOKEN = Pattern.compile("\\S+", Pattern.UNICODE_CHARACTER_CLASS);

    private final String query;
    private final SearchOptions options;
    private final Pattern pattern;

    /**
     * @throws java.util.regex.PatternSyntaxException in regex mode when the query does not compile
     */
    CellMatcher(String query, SearchOptions options) {
        this.query = query;
        this.options = options;
        if (options.isRegex()) {
            int flags = options.isCaseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
            this.pattern = Pattern.compile(query, flags);
        } else {
            this.pattern = null;
        }
    }

    boolean matches(String value) {
        if (pattern != null) {
            return pattern.matcher(value).find();
        }
        if (options.isWholeWord()) {
            return findToken(value) != null;
        }
        return indexOf(value, 0) >= 0;
    }

    /**
     * The value with the query's match(es) substituted, or the value
     * unchanged when it no longer matches.
     */
    String replace(String value, String replacement) {
        if (pattern != null) {
            return pattern.matcher(value).replaceAll(Matcher.quoteReplacement(replacement));
        }
        if (options.isWholeWord()) {
            Matcher token = findToken(value);
            if (token == null) {
                return value;
            }
            return value.substring(0, token.start()) + replacement + value.substring(token.end());
        }
        int at = indexOf(value, 0);
        if (at < 0) {
            return value;
        }
        return value.substring(0, at) + replacement + value.substring(at + query.length());
    }

    // Positioned on the first token equal to the query, or null
    private Matcher findToken(String value) {
        Matcher token = TOKEN.matcher(value);
        while (token.find()) {
            String word = token.group();
            boolean equal = options.isCaseSensitive() ? word.equals(query) : word.equalsIgnoreCase(query);
            if (equal) {
                return token;
            }
        }
        return null;
    }

    private int indexOf(String value, int from) {
        boolean ignoreCase = !options.isCaseSensitive();
        int last = value.length() - query.length();
        for (int i = from; i <= last; i++) {
            if (value.regionMatches(ignoreCase, i, query, 0, query.length())) {
                return i;
            }
        }
        return -1;
    }
}
