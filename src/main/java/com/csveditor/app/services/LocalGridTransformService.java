package com.csveditor.app.services;

import com.csveditor.app.config.EditorProperties;
import com.csveditor.app.models.Grid;
import com.csveditor.app.models.SortColumn;
import com.csveditor.app.models.SortDirection;
import com.csveditor.app.models.SortSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Computes sort and reorder results in-process on a small worker pool,
 * so the editor sees them through the same asynchronous path a remote
 * service would use.
 */
@Service
public class LocalGridTransformService implements GridTransformService, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LocalGridTransformService.class);

    private final ExecutorService executor;

    public LocalGridTransformService(EditorProperties properties) {
        int threads = Math.max(1, properties.getTransform().getThreads());
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "grid-transform-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<Grid> sort(Grid grid, SortSpec sortSpec) {
        return CompletableFuture.supplyAsync(() -> sortRows(grid, sortSpec), executor);
    }

    @Override
    public CompletableFuture<Grid> moveRow(Grid grid, int fromIndex, int toIndex) {
        return CompletableFuture.supplyAsync(() -> GridMutations.moveRow(grid, fromIndex, toIndex), executor);
    }

    @Override
    public CompletableFuture<Grid> moveColumn(Grid grid, int fromIndex, int toIndex) {
        return CompletableFuture.supplyAsync(() -> GridMutations.moveColumn(grid, fromIndex, toIndex), executor);
    }

    /**
     * Stable multi-key sort. Earlier keys win; rows equal on every key keep
     * their original order.
     */
    static Grid sortRows(Grid grid, SortSpec sortSpec) {
        Comparator<List<String>> order = (a, b) -> 0;
        for (SortColumn key : sortSpec.getColumns()) {
            GridMutations.checkColumn(grid, key.getColumnIndex());
            order = order.thenComparing(byColumn(key));
        }
        List<List<String>> rows = new ArrayList<>(grid.getRows());
        rows.sort(order);
        log.debug("Sorted {} rows by {} key(s)", rows.size(), sortSpec.getColumns().size());
        return grid.withRows(rows);
    }

    // Empty values sort last in both directions
    private static Comparator<List<String>> byColumn(SortColumn key) {
        int column = key.getColumnIndex();
        boolean descending = key.getDirection() == SortDirection.DESCENDING;
        return (a, b) -> {
            String left = a.get(column);
            String right = b.get(column);
            boolean leftEmpty = left.isBlank();
            boolean rightEmpty = right.isBlank();
            if (leftEmpty || rightEmpty) {
                return Boolean.compare(leftEmpty, rightEmpty);
            }
            int result = compareValues(left, right);
            return descending ? -result : result;
        };
    }

    /**
     * Total order over non-blank values: every number sorts before every
     * text value, numbers compare numerically and text case-insensitively.
     */
    static int compareValues(String left, String right) {
        Double l = parseNumber(left);
        Double r = parseNumber(right);
        if (l != null && r != null) {
            return Double.compare(l, r);
        }
        if (l != null || r != null) {
            return l != null ? -1 : 1;
        }
        int result = String.CASE_INSENSITIVE_ORDER.compare(left, right);
        return result != 0 ? result : left.compareTo(right);
    }

    private static Double parseNumber(String value) {
        try {
            return Double.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public void destroy() {
        executor.shutdownNow();
    }
}
