package com.csveditor.app.services;

import com.csveditor.app.models.Cell;
import com.csveditor.app.models.RangeKind;
import com.csveditor.app.models.RangeSelection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SelectionModelTest {

    private SelectionModel model;

    @BeforeEach
    void setUp() {
        model = new SelectionModel();
    }

    private void assertExactlyOneVariant() {
        boolean cell = model.getSelectedCell() != null;
        boolean range = model.getSelectedRange() != null;
        assertTrue(cell ^ range, "exactly one of cell/range must be set");
    }

    @Test
    void testSelectCellThenRangeClearsCell() {
        model.selectCell(new Cell(1, 1, "x"));
        assertExactlyOneVariant();
        assertNotNull(model.getSelectedCell());

        model.selectRange(new RangeSelection(0, 0, 2, 2, RangeKind.RANGE));
        assertExactlyOneVariant();
        assertNull(model.getSelectedCell());
    }

    @Test
    void testEveryOperationLeavesOneVariant() {
        model.selectRow(0, 3);
        assertExactlyOneVariant();
        model.selectColumn(1, 4);
        assertExactlyOneVariant();
        model.selectAll(4, 3);
        assertExactlyOneVariant();
        model.selectCell(new Cell(0, 0, ""));
        assertExactlyOneVariant();
        model.extendSelection(new Cell(2, 2, ""));
        assertExactlyOneVariant();
    }

    @Test
    void testSelectRowSpansAllColumns() {
        model.selectRow(2, 5);
        RangeSelection range = model.getSelectedRange();
        assertEquals(RangeKind.ROW, range.getKind());
        assertEquals(2, range.getStartRow());
        assertEquals(2, range.getEndRow());
        assertEquals(0, range.getStartColumn());
        assertEquals(4, range.getEndColumn());
        assertEquals(0, range.getAnchorColumn());
        assertEquals(4, range.getFocusColumn());
    }

    @Test
    void testSelectColumnSpansAllRows() {
        model.selectColumn(1, 10);
        RangeSelection range = model.getSelectedRange();
        assertEquals(RangeKind.COLUMN, range.getKind());
        assertEquals(0, range.getAnchorRow());
        assertEquals(9, range.getFocusRow());
        assertEquals(1, range.getStartColumn());
        assertEquals(1, range.getEndColumn());
    }

    /**
     * select A, extend to B, extend to C: the anchor stays at A throughout.
     */
    @Test
    void testExtendKeepsOriginalAnchor() {
        model.selectCell(new Cell(2, 2, "A"));

        model.extendSelection(new Cell(4, 5, "B"));
        RangeSelection first = model.getSelectedRange();
        assertEquals(2, first.getAnchorRow());
        assertEquals(2, first.getAnchorColumn());
        assertEquals(4, first.getEndRow());
        assertEquals(5, first.getEndColumn());

        model.extendSelection(new Cell(0, 1, "C"));
        RangeSelection second = model.getSelectedRange();
        assertEquals(2, second.getAnchorRow());
        assertEquals(2, second.getAnchorColumn());
        assertEquals(0, second.getFocusRow());
        assertEquals(1, second.getFocusColumn());
        // Bounding box measured from A, not from B
        assertEquals(0, second.getStartRow());
        assertEquals(1, second.getStartColumn());
        assertEquals(2, second.getEndRow());
        assertEquals(2, second.getEndColumn());
    }

    @Test
    void testExtendFromRowSelectionUsesRowAnchor() {
        model.selectRow(3, 4);
        model.extendSelection(new Cell(5, 1, ""));
        RangeSelection range = model.getSelectedRange();
        assertEquals(3, range.getAnchorRow());
        assertEquals(0, range.getAnchorColumn());
        assertEquals(RangeKind.RANGE, range.getKind());
        assertEquals(3, range.getStartRow());
        assertEquals(5, range.getEndRow());
        assertEquals(0, range.getStartColumn());
        assertEquals(1, range.getEndColumn());
    }

    @Test
    void testExtendWithNothingSelectedSelectsCell() {
        Cell target = new Cell(1, 2, "v");
        model.extendSelection(target);
        assertEquals(target, model.getSelectedCell());
        assertNull(model.getSelectedRange());
    }

    @Test
    void testClear() {
        model.selectAll(2, 2);
        model.clear();
        assertTrue(model.isEmpty());
        assertNull(model.getSelectedCell());
        assertNull(model.getSelectedRange());
    }
}
