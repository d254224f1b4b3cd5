package com.csveditor.app.services;

import com.csveditor.app.config.EditorProperties;
import com.csveditor.app.exceptions.SessionNotFoundException;
import com.csveditor.app.models.Cell;
import com.csveditor.app.models.ColumnPosition;
import com.csveditor.app.models.EditorState;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.RangeSelection;
import com.csveditor.app.models.RowPosition;
import com.csveditor.app.models.SearchOptions;
import com.csveditor.app.models.SearchResult;
import com.csveditor.app.models.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keeps every open grid editor in memory and runs each call against one of
 * them under that editor's lock (writes exclusive, reads shared).
 */
@Service
public class EditorSessionService {

    private static final Logger log = LoggerFactory.getLogger(EditorSessionService.class);

    private static final int DEFAULT_COLUMN_COUNT = 3;

    // All editors live here in memory; persistence is the caller's concern
    private final Map<Long, GridEditor> editors = new ConcurrentHashMap<>();
    private final AtomicLong idGenerator = new AtomicLong(1);

    private final EditorProperties properties;
    private final GridTransformService transformService;

    public EditorSessionService(EditorProperties properties, GridTransformService transformService) {
        this.properties = properties;
        this.transformService = transformService;
    }

    /**
     * Opens an editor over a grid handed over by the persistence layer.
     */
    public long openSession(Grid grid) {
        long id = idGenerator.getAndIncrement();
        GridEditor editor = new GridEditor(id, Grid.empty(List.of()), properties.getHistory().getMaxEntries());
        editor.load(grid);
        editors.put(id, editor);
        log.info("Opened grid {} ({} rows x {} columns)", id,
                editor.getGrid().getRowCount(), editor.getGrid().getColumnCount());
        return id;
    }

    /**
     * Opens an editor over an empty grid. With no header names, the grid gets
     * "Column 1".."Column 3".
     */
    public long newSession(List<String> headers) {
        List<String> names = headers == null || headers.isEmpty()
                ? GridMutations.defaultHeaders(DEFAULT_COLUMN_COUNT)
                : headers;
        return openSession(Grid.empty(names));
    }

    /**
     * Retrieves an editor by ID. Throws if not found.
     */
    public GridEditor getEditor(long id) {
        GridEditor editor = editors.get(id);
        if (editor == null) {
            throw new SessionNotFoundException("Grid session not found: " + id);
        }
        return editor;
    }

    public void closeSession(long id) {
        if (editors.remove(id) == null) {
            throw new SessionNotFoundException("Grid session not found: " + id);
        }
        log.info("Closed grid {}", id);
    }

    public List<Long> listSessions() {
        List<Long> ids = new ArrayList<>(editors.keySet());
        ids.sort(Long::compare);
        return ids;
    }

    // ----------------------------------------------------------------
    // Reads
    // ----------------------------------------------------------------

    public Grid getGrid(long id) {
        return read(id, GridEditor::getGrid);
    }

    public EditorState getState(long id) {
        return read(id, GridEditor::state);
    }

    // ----------------------------------------------------------------
    // Selection
    // ----------------------------------------------------------------

    public EditorState selectCell(long id, int row, int column) {
        return write(id, e -> e.selectCell(row, column));
    }

    public EditorState selectRange(long id, RangeSelection range) {
        return write(id, e -> e.selectRange(range));
    }

    public EditorState selectRow(long id, int rowIndex) {
        return write(id, e -> e.selectRow(rowIndex));
    }

    public EditorState selectColumn(long id, int columnIndex) {
        return write(id, e -> e.selectColumn(columnIndex));
    }

    public EditorState selectAll(long id) {
        return write(id, GridEditor::selectAll);
    }

    public EditorState extendSelection(long id, int row, int column) {
        return write(id, e -> e.extendSelection(row, column));
    }

    public EditorState clearSelection(long id) {
        return write(id, GridEditor::clearSelection);
    }

    // ----------------------------------------------------------------
    // Edits
    // ----------------------------------------------------------------

    public EditorState updateCell(long id, int row, int column, String value) {
        return write(id, e -> e.updateCell(row, column, value));
    }

    public EditorState copySelection(long id) {
        return write(id, GridEditor::copySelection);
    }

    public EditorState cutSelection(long id) {
        return write(id, GridEditor::cutSelection);
    }

    /**
     * Pastes at target, or at the current selection when target is null.
     */
    public EditorState paste(long id, Cell target) {
        return write(id, e -> {
            if (target == null) {
                e.paste();
            } else {
                e.paste(target);
            }
        });
    }

    public EditorState deleteSelection(long id) {
        return write(id, GridEditor::deleteSelection);
    }

    public EditorState addRow(long id, RowPosition position, int rowIndex) {
        return write(id, e -> e.addRow(position, rowIndex));
    }

    public EditorState deleteRow(long id, int rowIndex) {
        return write(id, e -> e.deleteRow(rowIndex));
    }

    public EditorState duplicateRow(long id, int rowIndex) {
        return write(id, e -> e.duplicateRow(rowIndex));
    }

    public EditorState addColumn(long id, ColumnPosition position, int columnIndex) {
        return write(id, e -> e.addColumn(position, columnIndex));
    }

    public EditorState deleteColumn(long id, int columnIndex) {
        return write(id, e -> e.deleteColumn(columnIndex));
    }

    public EditorState renameColumn(long id, int columnIndex, String newName) {
        return write(id, e -> e.renameColumn(columnIndex, newName));
    }

    public EditorState replaceAll(long id, Grid newGrid, String description) {
        return write(id, e -> e.replaceAll(newGrid, description));
    }

    public EditorState undo(long id) {
        return write(id, GridEditor::undo);
    }

    public EditorState redo(long id) {
        return write(id, GridEditor::redo);
    }

    public EditorState markSaved(long id) {
        return write(id, GridEditor::markSaved);
    }

    // ----------------------------------------------------------------
    // Search and replace
    // ----------------------------------------------------------------

    public SearchResult search(long id, String query, SearchOptions options) {
        return writeAndGet(id, e -> {
            e.setSearchQuery(query, options);
            return e.performSearch();
        });
    }

    public SearchResult nextMatch(long id) {
        return writeAndGet(id, e -> {
            e.nextMatch();
            return e.getSearch().snapshot();
        });
    }

    public SearchResult previousMatch(long id) {
        return writeAndGet(id, e -> {
            e.previousMatch();
            return e.getSearch().snapshot();
        });
    }

    public EditorState replaceCurrent(long id, String replacement) {
        return write(id, e -> e.replaceCurrent(replacement));
    }

    public EditorState replaceAllMatches(long id, String replacement) {
        return write(id, e -> e.replaceAllMatches(replacement));
    }

    // ----------------------------------------------------------------
    // External transforms
    // ----------------------------------------------------------------

    public Grid applySorting(long id, SortSpec sortSpec) {
        return await(getEditor(id).applySorting(sortSpec, transformService));
    }

    public Grid moveRow(long id, int fromIndex, int toIndex) {
        return await(getEditor(id).moveRow(fromIndex, toIndex, transformService));
    }

    public Grid moveColumn(long id, int fromIndex, int toIndex) {
        return await(getEditor(id).moveColumn(fromIndex, toIndex, transformService));
    }

    public EditorState clearSorting(long id) {
        return write(id, GridEditor::clearSorting);
    }

    // Rethrows the editor's own exception rather than the CompletionException wrapper
    private Grid await(CompletableFuture<Grid> pending) {
        try {
            return pending.join();
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof RuntimeException) {
                throw (RuntimeException) ex.getCause();
            }
            throw ex;
        }
    }

    // ----------------------------------------------------------------
    // Locking helpers
    // ----------------------------------------------------------------

    private <T> T read(long id, Function<GridEditor, T> action) {
        GridEditor editor = getEditor(id);
        editor.getLock().readLock().lock();
        try {
            return action.apply(editor);
        } finally {
            editor.getLock().readLock().unlock();
        }
    }

    private EditorState write(long id, Consumer<GridEditor> action) {
        return writeAndGet(id, e -> {
            action.accept(e);
            return e.state();
        });
    }

    private <T> T writeAndGet(long id, Function<GridEditor, T> action) {
        GridEditor editor = getEditor(id);
        editor.getLock().writeLock().lock();
        try {
            return action.apply(editor);
        } finally {
            editor.getLock().writeLock().unlock();
        }
    }
}
