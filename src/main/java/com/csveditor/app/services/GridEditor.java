package com.csveditor.app.services;

import com.csveditor.app.exceptions.GridTransformException;
import com.csveditor.app.exceptions.InvalidGridException;
import com.csveditor.app.exceptions.StaleSnapshotException;
import com.csveditor.app.exceptions.TransformInProgressException;
import com.csveditor.app.models.Cell;
import com.csveditor.app.models.ColumnPosition;
import com.csveditor.app.models.EditorState;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.HistoryAction;
import com.csveditor.app.models.HistoryActionType;
import com.csveditor.app.models.RangeSelection;
import com.csveditor.app.models.RowPosition;
import com.csveditor.app.models.SearchOptions;
import com.csveditor.app.models.SearchResult;
import com.csveditor.app.models.Selection;
import com.csveditor.app.models.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One open grid and everything that edits it:
 * - the live Grid (replaced wholesale on every edit, undo and redo)
 * - selection, clipboard, undo/redo log and search state
 * - the unsaved-changes flag and the last applied sort
 *
 * Every content edit captures the grid before the change, swaps in the new
 * grid and records one history entry. The editor itself is not thread-safe;
 * callers hold {@link #getLock()} around each call, as EditorSessionService does.
 */
public class GridEditor {

    private static final Logger log = LoggerFactory.getLogger(GridEditor.class);

    private final long id;
    private final SelectionModel selection = new SelectionModel();
    private final Clipboard clipboard = new Clipboard();
    private final HistoryEngine history;
    private final SearchEngine search = new SearchEngine();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private Grid grid;
    private boolean unsavedChanges;
    private SortSpec currentSort = SortSpec.none();
    private boolean transformPending;

    public GridEditor(long id, Grid grid, int maxHistoryEntries) {
        this.id = id;
        this.grid = grid;
        this.history = new HistoryEngine(maxHistoryEntries);
    }

    public GridEditor(long id, Grid grid) {
        this(id, grid, HistoryEngine.DEFAULT_MAX_ENTRIES);
    }

    public long getId() {
        return id;
    }

    public Grid getGrid() {
        return grid;
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    public Selection getSelection() {
        return selection.getSelection();
    }

    public SelectionModel getSelectionModel() {
        return selection;
    }

    public Clipboard getClipboard() {
        return clipboard;
    }

    public HistoryEngine getHistory() {
        return history;
    }

    public SearchEngine getSearch() {
        return search;
    }

    public boolean hasUnsavedChanges() {
        return unsavedChanges;
    }

    public SortSpec getCurrentSort() {
        return currentSort;
    }

    /**
     * Replaces the grid with a freshly opened one (ragged rows are padded or
     * cut to the header count). History, selection and search start over;
     * the clipboard is kept.
     */
    public void load(Grid newGrid) {
        if (newGrid == null) {
            throw new InvalidGridException("Grid must not be null");
        }
        grid = newGrid.normalized();
        history.clear();
        selection.clear();
        search.clear();
        currentSort = SortSpec.none();
        unsavedChanges = false;
    }

    /**
     * Called by the persistence layer after the current grid was written out.
     */
    public void markSaved() {
        unsavedChanges = false;
    }

    // ----------------------------------------------------------------
    // Selection
    // ----------------------------------------------------------------

    public void selectCell(int row, int column) {
        selection.selectCell(Cell.of(grid, row, column));
    }

    public void selectRange(RangeSelection range) {
        selection.selectRange(range);
    }

    public void selectRow(int rowIndex) {
        selection.selectRow(rowIndex, grid.getColumnCount());
    }

    public void selectColumn(int columnIndex) {
        selection.selectColumn(columnIndex, grid.getRowCount());
    }

    public void selectAll() {
        selection.selectAll(grid.getRowCount(), grid.getColumnCount());
    }

    public void extendSelection(int row, int column) {
        selection.extendSelection(Cell.of(grid, row, column));
    }

    public void clearSelection() {
        selection.clear();
    }

    // ----------------------------------------------------------------
    // Cell edits and clipboard
    // ----------------------------------------------------------------

    /**
     * Writes one value. The edited cell stays selected, carrying its new value,
     * so keyboard navigation continues from it.
     */
    public void updateCell(int row, int column, String value) {
        Grid before = grid;
        Grid after = GridMutations.updateCell(before, row, column, value);
        Cell edited = Cell.of(after, row, column);
        commit(HistoryActionType.CELL_UPDATE, before, after, edited, null);
        selection.selectCell(edited);
    }

    /**
     * Copies the active selection into the clipboard. Returns false (and
     * leaves the clipboard alone) when nothing is selected.
     */
    public boolean copySelection() {
        Selection active = selection.getSelection();
        if (active == null) {
            return false;
        }
        clipboard.put(GridMutations.readBlock(grid, active));
        return true;
    }

    /**
     * Copy followed by blanking the copied cells, as one history entry.
     */
    public boolean cutSelection() {
        if (!copySelection()) {
            return false;
        }
        blankSelection(HistoryActionType.CUT);
        return true;
    }

    /**
     * Pastes at the selected cell (or the top-left of the selected range).
     */
    public boolean paste() {
        Selection active = selection.getSelection();
        if (active == null) {
            return false;
        }
        return paste(new Cell(active.getStartRow(), active.getStartColumn(), ""));
    }

    /**
     * Writes the clipboard with its top-left at target. Grows the grid
     * downward as needed, never sideways. Returns false without recording
     * anything when the clipboard is empty, there is no target, or the target
     * lies outside the grid (one past the last row still counts as inside).
     */
    public boolean paste(Cell target) {
        if (clipboard.isEmpty() || target == null) {
            return false;
        }
        if (target.getRow() < 0 || target.getRow() > grid.getRowCount()
                || target.getColumn() < 0 || target.getColumn() >= grid.getColumnCount()) {
            return false;
        }
        Grid before = grid;
        Grid after = GridMutations.paste(before, clipboard.getContents(), target.getRow(), target.getColumn());
        commit(HistoryActionType.PASTE, before, after, target, null);
        return true;
    }

    /**
     * Blanks every selected cell. No-op when nothing is selected.
     */
    public boolean deleteSelection() {
        return blankSelection(HistoryActionType.DELETE);
    }

    private boolean blankSelection(HistoryActionType type) {
        Selection active = selection.getSelection();
        if (active == null) {
            return false;
        }
        Grid before = grid;
        Grid after = GridMutations.blank(before, active);
        commit(type, before, after, active, null);
        return true;
    }

    // ----------------------------------------------------------------
    // Rows and columns
    // ----------------------------------------------------------------

    public void addRow(RowPosition position, int rowIndex) {
        int insertIndex = position == RowPosition.ABOVE ? rowIndex : rowIndex + 1;
        Grid before = grid;
        Grid after = GridMutations.insertRow(before, insertIndex);
        commit(HistoryActionType.ADD_ROW, before, after, new Cell(insertIndex, 0, ""), null);
    }

    public void deleteRow(int rowIndex) {
        Grid before = grid;
        Grid after = GridMutations.deleteRow(before, rowIndex);
        commit(HistoryActionType.DELETE_ROW, before, after, new Cell(rowIndex, 0, ""), null);
    }

    public void duplicateRow(int rowIndex) {
        Grid before = grid;
        Grid after = GridMutations.duplicateRow(before, rowIndex);
        commit(HistoryActionType.DUPLICATE_ROW, before, after, new Cell(rowIndex + 1, 0, ""), null);
    }

    /**
     * Inserts an auto-named column before or after columnIndex.
     * Returns the generated header.
     */
    public String addColumn(ColumnPosition position, int columnIndex) {
        int insertIndex = position == ColumnPosition.BEFORE ? columnIndex : columnIndex + 1;
        Grid before = grid;
        String header = GridMutations.nextColumnName(before.getHeaders());
        Grid after = GridMutations.insertColumn(before, insertIndex, header);
        commit(HistoryActionType.ADD_COLUMN, before, after, new Cell(0, insertIndex, ""), null);
        return header;
    }

    public void deleteColumn(int columnIndex) {
        Grid before = grid;
        Grid after = GridMutations.deleteColumn(before, columnIndex);
        commit(HistoryActionType.DELETE_COLUMN, before, after,
                new Cell(0, Math.max(0, columnIndex - 1), ""), null);
    }

    public void renameColumn(int columnIndex, String newName) {
        Grid before = grid;
        Grid after = GridMutations.renameColumn(before, columnIndex, newName);
        commit(HistoryActionType.RENAME_COLUMN, before, after, new Cell(0, columnIndex, newName), null);
    }

    /**
     * Swaps in a grid computed elsewhere (sort result, reorder result,
     * bulk replace). Only the row-width rule is checked.
     */
    public void replaceAll(Grid newGrid, String description) {
        requireRectangular(newGrid);
        Grid before = grid;
        commit(HistoryActionType.REPLACE_ALL, before, newGrid, null,
                description == null ? "Replace all" : description);
    }

    // ----------------------------------------------------------------
    // Undo / redo
    // ----------------------------------------------------------------

    public boolean undo() {
        Optional<HistoryAction> action = history.undo();
        if (action.isEmpty()) {
            return false;
        }
        restore(action.get().getBefore());
        return true;
    }

    public boolean redo() {
        Optional<HistoryAction> action = history.redo();
        if (action.isEmpty()) {
            return false;
        }
        restore(action.get().getAfter());
        return true;
    }

    public boolean canUndo() {
        return history.canUndo();
    }

    public boolean canRedo() {
        return history.canRedo();
    }

    private void restore(Grid snapshot) {
        grid = snapshot;
        unsavedChanges = true;
        refreshSelectedCell();
        if (search.isActive()) {
            performSearch();
        }
    }

    // ----------------------------------------------------------------
    // Search and replace
    // ----------------------------------------------------------------

    public void setSearchQuery(String text, SearchOptions options) {
        search.setQuery(text, options);
    }

    /**
     * Scans the live grid; the first match, if any, becomes the selection.
     */
    public SearchResult performSearch() {
        SearchResult result = search.performSearch(grid);
        Cell first = search.currentMatch();
        if (first != null) {
            selection.selectCell(first);
        }
        return result;
    }

    public Cell nextMatch() {
        return selectMatch(search.nextMatch());
    }

    public Cell previousMatch() {
        return selectMatch(search.previousMatch());
    }

    private Cell selectMatch(Cell match) {
        if (match != null) {
            selection.selectCell(Cell.of(grid, match.getRow(), match.getColumn()));
        }
        return match;
    }

    /**
     * Replaces the query inside the current match, records it, then moves on
     * to the next match. The match list is not rescanned, so the replaced
     * cell stays in it. A match that no longer lies inside the grid, or whose
     * live value no longer matches, is skipped without a history entry.
     */
    public boolean replaceCurrent(String replacement) {
        Cell match = search.currentMatch();
        if (match == null) {
            return false;
        }
        boolean replaced = false;
        if (grid.containsCell(match.getRow(), match.getColumn())) {
            String oldValue = grid.getValue(match.getRow(), match.getColumn());
            String newValue = search.replacementFor(oldValue, replacement);
            if (!newValue.equals(oldValue)) {
                Grid before = grid;
                Grid after = GridMutations.updateCell(before, match.getRow(), match.getColumn(), newValue);
                commit(HistoryActionType.REPLACE_ALL, before, after,
                        new Cell(match.getRow(), match.getColumn(), newValue), "Replace text");
                replaced = true;
            }
        }
        nextMatch();
        return replaced;
    }

    /**
     * Replaces every match in one history entry, then clears the search.
     * Returns the number of cells changed.
     */
    public int replaceAllMatches(String replacement) {
        List<Cell> matches = search.getMatches();
        if (matches.isEmpty()) {
            return 0;
        }
        Grid before = grid;
        Grid after = before;
        int changed = 0;
        for (Cell match : matches) {
            if (!after.containsCell(match.getRow(), match.getColumn())) {
                continue;
            }
            String oldValue = after.getValue(match.getRow(), match.getColumn());
            String newValue = search.replacementFor(oldValue, replacement);
            if (!newValue.equals(oldValue)) {
                after = GridMutations.updateCell(after, match.getRow(), match.getColumn(), newValue);
                changed++;
            }
        }
        if (changed > 0) {
            commit(HistoryActionType.REPLACE_ALL, before, after, null,
                    "Replace all (" + changed + " match" + (changed == 1 ? "" : "es") + ")");
        }
        search.clear();
        return changed;
    }

    // ----------------------------------------------------------------
    // External transforms (sort, reorder)
    // ----------------------------------------------------------------

    public CompletableFuture<Grid> applySorting(SortSpec sortSpec, GridTransformService transforms) {
        return runExternal(sortSpec.describe(),
                g -> sortSpec.getColumns().forEach(key -> GridMutations.checkColumn(g, key.getColumnIndex())),
                g -> transforms.sort(g, sortSpec),
                () -> currentSort = sortSpec);
    }

    public CompletableFuture<Grid> moveRow(int fromIndex, int toIndex, GridTransformService transforms) {
        return runExternal("Move row from position " + (fromIndex + 1) + " to " + (toIndex + 1),
                g -> {
                    GridMutations.checkRow(g, fromIndex);
                    GridMutations.checkRow(g, toIndex);
                },
                g -> transforms.moveRow(g, fromIndex, toIndex),
                () -> { });
    }

    public CompletableFuture<Grid> moveColumn(int fromIndex, int toIndex, GridTransformService transforms) {
        return runExternal("Move column from position " + (fromIndex + 1) + " to " + (toIndex + 1),
                g -> {
                    GridMutations.checkColumn(g, fromIndex);
                    GridMutations.checkColumn(g, toIndex);
                },
                g -> transforms.moveColumn(g, fromIndex, toIndex),
                () -> { });
    }

    /**
     * Forgets the remembered sort; data and history are untouched.
     */
    public void clearSorting() {
        currentSort = SortSpec.none();
    }

    public boolean isTransformPending() {
        return transformPending;
    }

    /**
     * Captures the live grid, hands it to the external call and, once the
     * result arrives, applies it as one REPLACE_ALL entry.
     * - a second call while one is pending is rejected
     * - indices that do not fit the live grid are rejected before the call
     * - a result computed from a grid that is no longer live is rejected
     * - a failed call leaves grid and history exactly as they were
     */
    private CompletableFuture<Grid> runExternal(String description,
                                                Consumer<Grid> validate,
                                                Function<Grid, CompletableFuture<Grid>> call,
                                                Runnable onApplied) {
        Grid before;
        lock.writeLock().lock();
        try {
            if (transformPending) {
                throw new TransformInProgressException("Another sort or move is still running on grid " + id);
            }
            validate.accept(grid);
            transformPending = true;
            before = grid;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Grid {}: {} requested", id, description);

        CompletableFuture<Grid> pending;
        try {
            pending = call.apply(before);
        } catch (RuntimeException ex) {
            pending = CompletableFuture.failedFuture(ex);
        }

        return pending.handle((result, failure) -> {
            lock.writeLock().lock();
            try {
                transformPending = false;
                if (failure != null) {
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause() : failure;
                    log.warn("Grid {}: {} failed: {}", id, description, cause.getMessage());
                    throw new GridTransformException(description + " failed: " + cause.getMessage(), cause);
                }
                if (grid != before) {
                    log.warn("Grid {}: {} discarded, grid changed while it was running", id, description);
                    throw new StaleSnapshotException(description + " was computed from an outdated grid");
                }
                requireRectangular(result);
                commit(HistoryActionType.REPLACE_ALL, before, result, null, description);
                onApplied.run();
                log.info("Grid {}: {} applied", id, description);
                return result;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    // ----------------------------------------------------------------
    // Internal helpers
    // ----------------------------------------------------------------

    private void commit(HistoryActionType type, Grid before, Grid after, Object context, String description) {
        grid = after;
        unsavedChanges = true;
        history.record(new HistoryAction(type, before, after, context, description, System.currentTimeMillis()));
        refreshSelectedCell();
    }

    // A selected Cell carries a value snapshot; re-read it after the grid changes
    private void refreshSelectedCell() {
        Cell selected = selection.getSelectedCell();
        if (selected != null && grid.containsCell(selected.getRow(), selected.getColumn())) {
            selection.selectCell(Cell.of(grid, selected.getRow(), selected.getColumn()));
        }
    }

    private static void requireRectangular(Grid candidate) {
        if (candidate == null) {
            throw new InvalidGridException("Grid must not be null");
        }
        if (!candidate.isRectangular()) {
            throw new InvalidGridException("Every row must have exactly "
                    + candidate.getColumnCount() + " cells");
        }
    }

    public EditorState state() {
        return new EditorState(id, selection.getSelection(), history.canUndo(), history.canRedo(),
                unsavedChanges, history.size(), history.getCursor(), !clipboard.isEmpty(),
                currentSort, search.snapshot());
    }
}
