package com.csveditor.app.services;

import com.csveditor.app.models.Grid;
import com.csveditor.app.models.SortSpec;

import java.util.concurrent.CompletableFuture;

/**
 * Transforms whose computation happens outside the editor (sorting and
 * reordering). Each call receives the grid as it was when the request was
 * made and completes with the full replacement grid.
 */
public interface GridTransformService {

    CompletableFuture<Grid> sort(Grid grid, SortSpec sortSpec);

    CompletableFuture<Grid> moveRow(Grid grid, int fromIndex, int toIndex);

    CompletableFuture<Grid> moveColumn(Grid grid, int fromIndex, int toIndex);
}
