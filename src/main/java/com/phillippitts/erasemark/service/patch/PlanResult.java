package com.phillippitts.erasemark.service.patch;

import java.util.List;

/**
 * Tiles to infer for one mask, in row-major order.
 *
 * @param tiles tiles to process; empty when there is nothing to repaint
 * @param region padded working region the tiles were laid out over, null for an empty plan
 * @param multiTile true when the region exceeded the model input size in some dimension
 */
public record PlanResult(List<TileSpec> tiles, TileSpec region, boolean multiTile) {

    private static final PlanResult EMPTY = new PlanResult(List.of(), null, false);

    public PlanResult {
        tiles = List.copyOf(tiles);
    }

    public static PlanResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return tiles.isEmpty();
    }

    public int size() {
        return tiles.size();
    }
}
