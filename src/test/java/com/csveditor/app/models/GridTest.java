package com.csveditor.app.models;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridTest {

    @Test
    void testConstructorCopiesInput() {
        List<String> row = new ArrayList<>(Arrays.asList("1", "2"));
        List<List<String>> rows = new ArrayList<>();
        rows.add(row);
        Grid grid = new Grid(Arrays.asList("a", "b"), rows);

        row.set(0, "changed");
        rows.clear();

        assertEquals(1, grid.getRowCount());
        assertEquals("1", grid.getValue(0, 0));
    }

    @Test
    void testRowsAreUnmodifiable() {
        Grid grid = new Grid(List.of("a"), List.of(List.of("1")));
        assertThrows(UnsupportedOperationException.class, () -> grid.getRows().get(0).set(0, "x"));
        assertThrows(UnsupportedOperationException.class, () -> grid.getRows().add(List.of("2")));
    }

    /**
     * withRows keeps untouched row instances shared with the original grid.
     */
    @Test
    void testWithRowsSharesUnchangedRows() {
        Grid grid = new Grid(List.of("a"), List.of(List.of("1"), List.of("2")));
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        rows.set(1, List.of("9"));

        Grid changed = grid.withRows(rows);

        assertSame(grid.getRows().get(0), changed.getRows().get(0));
        assertEquals("2", grid.getValue(1, 0));
        assertEquals("9", changed.getValue(1, 0));
    }

    @Test
    void testNullValuesBecomeEmptyStrings() {
        Grid grid = new Grid(Arrays.asList("a", null), List.of(Arrays.asList(null, "x")));
        assertEquals("", grid.getHeaders().get(1));
        assertEquals("", grid.getValue(0, 0));
    }

    @Test
    void testGetValueOutsideGridIsEmpty() {
        Grid grid = new Grid(List.of("a"), List.of(List.of("1")));
        assertEquals("", grid.getValue(5, 0));
        assertEquals("", grid.getValue(0, 3));
        assertEquals("", grid.getValue(-1, 0));
        assertFalse(grid.containsCell(1, 0));
        assertTrue(grid.containsCell(0, 0));
    }

    @Test
    void testNormalizedPadsAndCutsRows() {
        Grid ragged = new Grid(List.of("a", "b"), List.of(List.of("1"), List.of("1", "2", "3")));
        assertFalse(ragged.isRectangular());

        Grid fixed = ragged.normalized();

        assertTrue(fixed.isRectangular());
        assertEquals(List.of("1", ""), fixed.getRows().get(0));
        assertEquals(List.of("1", "2"), fixed.getRows().get(1));
    }

    @Test
    void testCountsComeFromDataNotMetadata() {
        GridMetadata stale = new GridMetadata("f.csv", "/tmp/f.csv", 99, 42, true, ",", "UTF-8", 10L, "");
        Grid grid = new Grid(List.of("a", "b"), List.of(List.of("1", "2")), stale);
        assertEquals(1, grid.getRowCount());
        assertEquals(2, grid.getColumnCount());
    }
}
