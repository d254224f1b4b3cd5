package com.csveditor.app.controllers;

import com.csveditor.app.models.Cell;
import com.csveditor.app.models.ColumnPosition;
import com.csveditor.app.models.EditorState;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.RangeSelection;
import com.csveditor.app.models.RowPosition;
import com.csveditor.app.models.SearchResult;
import com.csveditor.app.models.SortSpec;
import com.csveditor.app.services.EditorSessionService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for editing open grids.
 * "/grid" is the base path; every call after creation names the session id.
 * Editing calls answer with the editor state (selection, undo/redo
 * availability, unsaved flag); GET /grid/{id} returns the data itself.
 */
@RestController
@RequestMapping("/grid")
public class GridController {

    @Autowired
    private EditorSessionService sessionService;

    /**
     * POST /grid
     * Body: a grid ({ "headers": [...], "rows": [[...]], "metadata": {...} }),
     * or nothing for a new empty grid. Returns the session id.
     */
    @PostMapping
    public ResponseEntity<Long> openGrid(@RequestBody(required = false) Grid grid) {
        long id = grid == null ? sessionService.newSession(null) : sessionService.openSession(grid);
        return ResponseEntity.ok(id);
    }

    @GetMapping
    public ResponseEntity<List<Long>> listGrids() {
        return ResponseEntity.ok(sessionService.listSessions());
    }

    /**
     * GET /grid/{id}
     * Returns the current grid, e.g. for saving.
     */
    @GetMapping("/{id}")
    public ResponseEntity<Grid> getGrid(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.getGrid(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> closeGrid(@PathVariable long id) {
        sessionService.closeSession(id);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{id}/state")
    public ResponseEntity<EditorState> getState(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.getState(id));
    }

    /**
     * PUT /grid/{id}/cell/{row}/{column}
     * Body: the new value as plain text (empty body clears the cell).
     */
    @PutMapping("/{id}/cell/{row}/{column}")
    public ResponseEntity<EditorState> updateCell(@PathVariable long id,
                                                  @PathVariable int row,
                                                  @PathVariable int column,
                                                  @RequestBody(required = false) String value) {
        return ResponseEntity.ok(sessionService.updateCell(id, row, column, value == null ? "" : value));
    }

    // ------------------------
    // Selection
    // ------------------------

    @PostMapping("/{id}/selection/cell/{row}/{column}")
    public ResponseEntity<EditorState> selectCell(@PathVariable long id, @PathVariable int row, @PathVariable int column) {
        return ResponseEntity.ok(sessionService.selectCell(id, row, column));
    }

    @PostMapping("/{id}/selection/range")
    public ResponseEntity<EditorState> selectRange(@PathVariable long id, @RequestBody RangeSelection range) {
        return ResponseEntity.ok(sessionService.selectRange(id, range));
    }

    @PostMapping("/{id}/selection/row/{row}")
    public ResponseEntity<EditorState> selectRow(@PathVariable long id, @PathVariable int row) {
        return ResponseEntity.ok(sessionService.selectRow(id, row));
    }

    @PostMapping("/{id}/selection/column/{column}")
    public ResponseEntity<EditorState> selectColumn(@PathVariable long id, @PathVariable int column) {
        return ResponseEntity.ok(sessionService.selectColumn(id, column));
    }

    @PostMapping("/{id}/selection/all")
    public ResponseEntity<EditorState> selectAll(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.selectAll(id));
    }

    @PostMapping("/{id}/selection/extend/{row}/{column}")
    public ResponseEntity<EditorState> extendSelection(@PathVariable long id, @PathVariable int row, @PathVariable int column) {
        return ResponseEntity.ok(sessionService.extendSelection(id, row, column));
    }

    @DeleteMapping("/{id}/selection")
    public ResponseEntity<EditorState> clearSelection(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.clearSelection(id));
    }

    // ------------------------
    // Clipboard
    // ------------------------

    @PostMapping("/{id}/clipboard/copy")
    public ResponseEntity<EditorState> copy(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.copySelection(id));
    }

    @PostMapping("/{id}/clipboard/cut")
    public ResponseEntity<EditorState> cut(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.cutSelection(id));
    }

    /**
     * POST /grid/{id}/clipboard/paste
     * Optional body: { "row": 3, "column": 1 } as the paste target;
     * without it the clipboard lands at the current selection.
     */
    @PostMapping("/{id}/clipboard/paste")
    public ResponseEntity<EditorState> paste(@PathVariable long id, @RequestBody(required = false) Cell target) {
        return ResponseEntity.ok(sessionService.paste(id, target));
    }

    @PostMapping("/{id}/delete-selection")
    public ResponseEntity<EditorState> deleteSelection(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.deleteSelection(id));
    }

    // ------------------------
    // Rows and columns
    // ------------------------

    @PostMapping("/{id}/rows/{index}")
    public ResponseEntity<EditorState> addRow(@PathVariable long id,
                                              @PathVariable int index,
                                              @RequestParam(defaultValue = "below") String position) {
        return ResponseEntity.ok(sessionService.addRow(id, RowPosition.fromValue(position), index));
    }

    @DeleteMapping("/{id}/rows/{index}")
    public ResponseEntity<EditorState> deleteRow(@PathVariable long id, @PathVariable int index) {
        return ResponseEntity.ok(sessionService.deleteRow(id, index));
    }

    @PostMapping("/{id}/rows/{index}/duplicate")
    public ResponseEntity<EditorState> duplicateRow(@PathVariable long id, @PathVariable int index) {
        return ResponseEntity.ok(sessionService.duplicateRow(id, index));
    }

    @PostMapping("/{id}/columns/{index}")
    public ResponseEntity<EditorState> addColumn(@PathVariable long id,
                                                 @PathVariable int index,
                                                 @RequestParam(defaultValue = "after") String position) {
        return ResponseEntity.ok(sessionService.addColumn(id, ColumnPosition.fromValue(position), index));
    }

    @DeleteMapping("/{id}/columns/{index}")
    public ResponseEntity<EditorState> deleteColumn(@PathVariable long id, @PathVariable int index) {
        return ResponseEntity.ok(sessionService.deleteColumn(id, index));
    }

    @PutMapping("/{id}/columns/{index}/name")
    public ResponseEntity<EditorState> renameColumn(@PathVariable long id,
                                                    @PathVariable int index,
                                                    @RequestBody(required = false) String name) {
        return ResponseEntity.ok(sessionService.renameColumn(id, index, name == null ? "" : name));
    }

    /**
     * PUT /grid/{id}/data
     * Replaces the whole grid with the body (one undoable step).
     */
    @PutMapping("/{id}/data")
    public ResponseEntity<EditorState> replaceAll(@PathVariable long id,
                                                  @RequestBody Grid grid,
                                                  @RequestParam(required = false) String description) {
        return ResponseEntity.ok(sessionService.replaceAll(id, grid, description));
    }

    // ------------------------
    // History
    // ------------------------

    @PostMapping("/{id}/undo")
    public ResponseEntity<EditorState> undo(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.undo(id));
    }

    @PostMapping("/{id}/redo")
    public ResponseEntity<EditorState> redo(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.redo(id));
    }

    @PostMapping("/{id}/saved")
    public ResponseEntity<EditorState> markSaved(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.markSaved(id));
    }

    // ------------------------
    // Search and replace
    // ------------------------

    /**
     * POST /grid/{id}/search
     * Body: { "query": "foo", "options": { "caseSensitive": false, "wholeWord": true } }.
     * A bad regex comes back as 200 with zero matches and "error" set.
     */
    @PostMapping("/{id}/search")
    public ResponseEntity<SearchResult> search(@PathVariable long id, @RequestBody SearchRequest request) {
        return ResponseEntity.ok(sessionService.search(id, request.getQuery(), request.getOptions()));
    }

    @PostMapping("/{id}/search/next")
    public ResponseEntity<SearchResult> nextMatch(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.nextMatch(id));
    }

    @PostMapping("/{id}/search/previous")
    public ResponseEntity<SearchResult> previousMatch(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.previousMatch(id));
    }

    @PostMapping("/{id}/search/replace-current")
    public ResponseEntity<EditorState> replaceCurrent(@PathVariable long id,
                                                      @RequestBody(required = false) String replacement) {
        return ResponseEntity.ok(sessionService.replaceCurrent(id, replacement == null ? "" : replacement));
    }

    @PostMapping("/{id}/search/replace-all")
    public ResponseEntity<EditorState> replaceAllMatches(@PathVariable long id,
                                                         @RequestBody(required = false) String replacement) {
        return ResponseEntity.ok(sessionService.replaceAllMatches(id, replacement == null ? "" : replacement));
    }

    // ------------------------
    // Sort and reorder
    // ------------------------

    /**
     * POST /grid/{id}/sort
     * Body: { "columns": [ { "columnIndex": 0, "direction": "asc" } ] }.
     * Waits for the sort to finish and returns the sorted grid.
     */
    @PostMapping("/{id}/sort")
    public ResponseEntity<Grid> sort(@PathVariable long id, @RequestBody SortSpec sortSpec) {
        return ResponseEntity.ok(sessionService.applySorting(id, sortSpec));
    }

    @DeleteMapping("/{id}/sort")
    public ResponseEntity<EditorState> clearSort(@PathVariable long id) {
        return ResponseEntity.ok(sessionService.clearSorting(id));
    }

    @PostMapping("/{id}/rows/move")
    public ResponseEntity<Grid> moveRow(@PathVariable long id, @RequestParam int from, @RequestParam int to) {
        return ResponseEntity.ok(sessionService.moveRow(id, from, to));
    }

    @PostMapping("/{id}/columns/move")
    public ResponseEntity<Grid> moveColumn(@PathVariable long id, @RequestParam int from, @RequestParam int to) {
        return ResponseEntity.ok(sessionService.moveColumn(id, from, to));
    }
}
