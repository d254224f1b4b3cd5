package com.csveditor.app.services;

import com.csveditor.app.exceptions.GridIndexOutOfBoundsException;
import com.csveditor.app.models.Cell;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.RangeKind;
import com.csveditor.app.models.RangeSelection;
import com.csveditor.app.models.SingleCellSelection;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GridMutationsTest {

    private final Grid grid = new Grid(
            List.of("a", "b", "c"),
            List.of(List.of("1", "2", "3"),
                    List.of("4", "5", "6")));

    @Test
    void testUpdateCellLeavesInputUntouched() {
        Grid after = GridMutations.updateCell(grid, 1, 2, "x");
        assertEquals("x", after.getValue(1, 2));
        assertEquals("6", grid.getValue(1, 2));
        assertSame(grid.getRows().get(0), after.getRows().get(0));
    }

    @Test
    void testUpdateCellOutOfBounds() {
        assertThrows(GridIndexOutOfBoundsException.class, () -> GridMutations.updateCell(grid, 2, 0, "x"));
        assertThrows(GridIndexOutOfBoundsException.class, () -> GridMutations.updateCell(grid, 0, 3, "x"));
    }

    @Test
    void testReadBlockFillsMissingCellsWithEmpty() {
        List<List<String>> block = GridMutations.readBlock(grid, new RangeSelection(1, 1, 2, 3, RangeKind.RANGE));
        assertEquals(List.of(List.of("5", "6", ""), List.of("", "", "")), block);
    }

    /**
     * Paste past the last row adds empty rows; columns past the last header are dropped.
     */
    @Test
    void testPasteGrowsRowsButNotColumns() {
        List<List<String>> block = List.of(List.of("p", "q"), List.of("r", "s"));
        Grid after = GridMutations.paste(grid, block, 1, 2);

        assertEquals(3, after.getRowCount());
        assertEquals(3, after.getColumnCount());
        assertEquals(List.of("4", "5", "p"), after.getRows().get(1));
        assertEquals(List.of("", "", "r"), after.getRows().get(2));
        assertTrue(after.isRectangular());
    }

    @Test
    void testBlankRangeIgnoresCellsOutsideGrid() {
        Grid after = GridMutations.blank(grid, new RangeSelection(1, 1, 5, 7, RangeKind.RANGE));
        assertEquals(List.of("1", "2", "3"), after.getRows().get(0));
        assertEquals(List.of("4", "", ""), after.getRows().get(1));
        assertEquals(2, after.getRowCount());
    }

    @Test
    void testBlankSingleCell() {
        Grid after = GridMutations.blank(grid, new SingleCellSelection(new Cell(0, 1, "2")));
        assertEquals(List.of("1", "", "3"), after.getRows().get(0));
    }

    @Test
    void testInsertRowOnlyTouchesRows() {
        Grid after = GridMutations.insertRow(grid, 1);
        assertEquals(3, after.getRowCount());
        assertEquals(List.of("", "", ""), after.getRows().get(1));
        assertEquals(grid.getHeaders(), after.getHeaders());
        assertThrows(GridIndexOutOfBoundsException.class, () -> GridMutations.insertRow(grid, 3));
    }

    @Test
    void testDuplicateRowInsertsCopyBelow() {
        Grid after = GridMutations.duplicateRow(grid, 0);
        assertEquals(3, after.getRowCount());
        assertEquals(after.getRows().get(0), after.getRows().get(1));
        assertEquals(List.of("4", "5", "6"), after.getRows().get(2));
    }

    @Test
    void testDeleteRow() {
        Grid after = GridMutations.deleteRow(grid, 0);
        assertEquals(1, after.getRowCount());
        assertEquals(List.of("4", "5", "6"), after.getRows().get(0));
        assertThrows(GridIndexOutOfBoundsException.class, () -> GridMutations.deleteRow(grid, 2));
    }

    @Test
    void testInsertAndDeleteColumnRewriteEveryRow() {
        Grid inserted = GridMutations.insertColumn(grid, 3, "d");
        assertEquals(List.of("a", "b", "c", "d"), inserted.getHeaders());
        assertTrue(inserted.isRectangular());

        Grid deleted = GridMutations.deleteColumn(grid, 0);
        assertEquals(List.of("b", "c"), deleted.getHeaders());
        assertEquals(List.of("5", "6"), deleted.getRows().get(1));
    }

    @Test
    void testRenameColumnKeepsRows() {
        Grid after = GridMutations.renameColumn(grid, 1, "renamed");
        assertEquals(List.of("a", "renamed", "c"), after.getHeaders());
        assertEquals(grid.getRows(), after.getRows());
        assertSame(grid.getRows().get(1), after.getRows().get(1));
    }

    @Test
    void testMoveRowAndColumn() {
        Grid rowMoved = GridMutations.moveRow(grid, 0, 1);
        assertEquals(List.of("4", "5", "6"), rowMoved.getRows().get(0));

        Grid columnMoved = GridMutations.moveColumn(grid, 0, 2);
        assertEquals(List.of("b", "c", "a"), columnMoved.getHeaders());
        assertEquals(List.of("2", "3", "1"), columnMoved.getRows().get(0));
    }

    @Test
    void testNextColumnNameSkipsTakenNames() {
        assertEquals("Column 3", GridMutations.nextColumnName(List.of("a", "b")));
        assertEquals("Column 4", GridMutations.nextColumnName(List.of("x", "Column 3")));
    }
}
