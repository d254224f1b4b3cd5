package com.csveditor.app.services;

import com.csveditor.app.models.HistoryAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Linear undo/redo log of before/after snapshots.
 *
 * cursor points at the most recently applied entry:
 * - cursor == -1: nothing to undo
 * - cursor == size - 1: nothing to redo
 *
 * Only record/undo/redo/clear move the cursor.
 */
public class HistoryEngine {

    private static final Logger log = LoggerFactory.getLogger(HistoryEngine.class);

    public static final int DEFAULT_MAX_ENTRIES = 100;

    private final List<HistoryAction> entries = new ArrayList<>();
    private final int maxEntries;
    private int cursor = -1;

    public HistoryEngine() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public HistoryEngine(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be positive, got " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    /**
     * Drops any redo branch, appends the action and makes it current.
     * When the log grows past its cap the oldest entry is evicted.
     */
    public void record(HistoryAction action) {
        entries.subList(cursor + 1, entries.size()).clear();
        entries.add(action);
        if (entries.size() > maxEntries) {
            entries.remove(0);
        }
        cursor = entries.size() - 1;
        checkCursor();
        log.debug("Recorded {} ({} entries)", action, entries.size());
    }

    /**
     * Steps back over the current entry and returns it; the caller restores
     * its before-snapshot. Empty when there is nothing to undo.
     */
    public Optional<HistoryAction> undo() {
        if (cursor < 0) {
            return Optional.empty();
        }
        HistoryAction action = entries.get(cursor);
        cursor--;
        checkCursor();
        log.debug("Undo {} (cursor now {})", action, cursor);
        return Optional.of(action);
    }

    /**
     * Steps forward onto the next entry and returns it; the caller restores
     * its after-snapshot. Empty when there is nothing to redo.
     */
    public Optional<HistoryAction> redo() {
        if (cursor >= entries.size() - 1) {
            return Optional.empty();
        }
        cursor++;
        HistoryAction action = entries.get(cursor);
        checkCursor();
        log.debug("Redo {} (cursor now {})", action, cursor);
        return Optional.of(action);
    }

    public boolean canUndo() {
        return cursor >= 0;
    }

    public boolean canRedo() {
        return cursor < entries.size() - 1;
    }

    public int size() {
        return entries.size();
    }

    public int getCursor() {
        return cursor;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    public List<HistoryAction> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public void clear() {
        entries.clear();
        cursor = -1;
    }

    // A cursor outside [-1, size - 1] is a programming error, not a user-facing failure
    private void checkCursor() {
        if (cursor < -1 || cursor >= entries.size()) {
            throw new IllegalStateException("History cursor " + cursor
                    + " outside log of " + entries.size() + " entries");
        }
    }
}
