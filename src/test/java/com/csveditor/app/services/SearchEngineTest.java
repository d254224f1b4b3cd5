package com.csveditor.app.services;

import com.csveditor.app.models.Cell;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.SearchOptions;
import com.csveditor.app.models.SearchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SearchEngineTest {

    private static final SearchOptions PLAIN = SearchOptions.defaults();
    private static final SearchOptions WHOLE_WORD = new SearchOptions(false, true, false, null);
    private static final SearchOptions REGEX = new SearchOptions(false, false, true, null);

    private SearchEngine search;
    private Grid grid;

    @BeforeEach
    void setUp() {
        search = new SearchEngine();
        grid = new Grid(
                List.of("name", "note"),
                List.of(List.of("foobar", "foo bar"),
                        List.of("Foo", "nothing"),
                        List.of("bar", "FOO")));
    }

    @Test
    void testPlainMatchesSubstringCaseInsensitively() {
        search.setQuery("foo", PLAIN);
        SearchResult result = search.performSearch(grid);
        assertEquals(4, result.getMatchCount());
        assertEquals(0, result.getCurrentIndex());
    }

    @Test
    void testMatchesAreRowMajor() {
        search.setQuery("foo", PLAIN);
        List<Cell> matches = search.performSearch(grid).getMatches();
        assertEquals(new Cell(0, 0, "foobar"), matches.get(0));
        assertEquals(new Cell(0, 1, "foo bar"), matches.get(1));
        assertEquals(new Cell(1, 0, "Foo"), matches.get(2));
        assertEquals(new Cell(2, 1, "FOO"), matches.get(3));
    }

    @Test
    void testCaseSensitive() {
        search.setQuery("Foo", new SearchOptions(true, false, false, null));
        assertEquals(1, search.performSearch(grid).getMatchCount());
    }

    @Test
    void testWholeWordRequiresEqualToken() {
        search.setQuery("foo", WHOLE_WORD);
        List<Cell> matches = search.performSearch(grid).getMatches();
        assertFalse(matches.contains(new Cell(0, 0, "foobar")));
        assertTrue(matches.contains(new Cell(0, 1, "foo bar")));
        assertEquals(3, matches.size());
    }

    @Test
    void testWholeWordSplitsOnUnicodeSpaces() {
        Grid spaced = new Grid(List.of("text"), List.of(
                List.of("foo\u3000bar"),
                List.of("foo\u00A0bar"),
                List.of("foobar")));
        search.setQuery("foo", WHOLE_WORD);
        List<Cell> matches = search.performSearch(spaced).getMatches();
        assertEquals(2, matches.size());
        assertEquals(0, matches.get(0).getRow());
        assertEquals(1, matches.get(1).getRow());
    }

    @Test
    void testWholeWordReplacementAcrossIdeographicSpace() {
        search.setQuery("foo", WHOLE_WORD);
        assertEquals("baz\u3000bar", search.replacementFor("foo\u3000bar", "baz"));
        assertEquals("bar\u00A0baz", search.replacementFor("bar\u00A0foo", "baz"));
    }

    @Test
    void testWholeWordQueryWithSpaceNeverMatches() {
        search.setQuery("foo bar", WHOLE_WORD);
        assertEquals(0, search.performSearch(grid).getMatchCount());
    }

    @Test
    void testInvalidRegexYieldsNoMatchesAndError() {
        search.setQuery("(unclosed", REGEX);
        SearchResult result = search.performSearch(grid);
        assertEquals(0, result.getMatchCount());
        assertEquals(-1, result.getCurrentIndex());
        assertNotNull(result.getError());
        assertTrue(result.getError().startsWith("Invalid regular expression"));
    }

    @Test
    void testEmptyQueryMatchesNothing() {
        search.setQuery("", PLAIN);
        SearchResult result = search.performSearch(grid);
        assertEquals(0, result.getMatchCount());
        assertNull(result.getError());
        assertFalse(search.isActive());
    }

    @Test
    void testColumnRestriction() {
        search.setQuery("foo", new SearchOptions(false, false, false, 1));
        List<Cell> matches = search.performSearch(grid).getMatches();
        assertEquals(2, matches.size());
        assertTrue(matches.stream().allMatch(c -> c.getColumn() == 1));
    }

    @Test
    void testColumnRestrictionOutsideGrid() {
        search.setQuery("foo", new SearchOptions(false, false, false, 7));
        assertEquals(0, search.performSearch(grid).getMatchCount());
    }

    @Test
    void testNavigationWrapsAround() {
        search.setQuery("foo", PLAIN);
        search.performSearch(grid);

        assertEquals(new Cell(2, 1, "FOO"), search.previousMatch());
        assertEquals(3, search.getCursor());
        assertEquals(new Cell(0, 0, "foobar"), search.nextMatch());
        assertEquals(0, search.getCursor());
        search.nextMatch();
        search.nextMatch();
        search.nextMatch();
        assertEquals(new Cell(0, 0, "foobar"), search.nextMatch());
    }

    @Test
    void testNavigationWithoutMatches() {
        search.setQuery("zzz", PLAIN);
        search.performSearch(grid);
        assertNull(search.nextMatch());
        assertNull(search.previousMatch());
        assertEquals(-1, search.getCursor());
    }

    @Test
    void testPlainReplacementTouchesFirstOccurrence() {
        search.setQuery("ab", PLAIN);
        assertEquals("xy-ab", search.replacementFor("AB-ab", "xy"));
    }

    @Test
    void testWholeWordReplacementTouchesFirstToken() {
        search.setQuery("cat", WHOLE_WORD);
        assertEquals("concat dog cat", search.replacementFor("concat cat cat", "dog"));
    }

    @Test
    void testRegexReplacementIsLiteralAndGlobal() {
        search.setQuery("\\d+", REGEX);
        assertEquals("a$1b$1", search.replacementFor("a12b345", "$1"));
    }

    @Test
    void testReplacementOfNonMatchingValueIsUnchanged() {
        search.setQuery("zzz", PLAIN);
        assertEquals("abc", search.replacementFor("abc", "q"));
    }

    @Test
    void testClearResetsEverything() {
        search.setQuery("foo", PLAIN);
        search.performSearch(grid);
        search.clear();
        assertEquals("", search.getQuery());
        assertTrue(search.getMatches().isEmpty());
        assertEquals(-1, search.getCursor());
    }
}
