package org.spelunk.runtime.worldgen;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.CaveGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Post-connectivity clean-up for traversability. Only interior wall cells are ever opened, so a
 * connected cave stays connected and a sealed border stays sealed.
 */
public final class CaveRefiner {

    private static final Logger LOG = LoggerFactory.getLogger(CaveRefiner.class);

    /**
     * Runs {@link #widenNarrowPassages(CaveGrid)} and then {@link #fixDiagonalCorridors(CaveGrid)}.
     */
    public CaveGrid refine(CaveGrid grid) {
        return fixDiagonalCorridors(widenNarrowPassages(grid));
    }

    /**
     * Opens one-cell-high and one-cell-wide passages until none is left. A floor cell walled above and
     * below gets the cell above opened (below when the cell above is on the border); a floor cell walled
     * left and right gets the cell to its left opened (right when the left one is on the border).
     */
    public CaveGrid widenNarrowPassages(CaveGrid grid) {
        CaveGrid result = grid.copy();
        int w = result.getWidth();
        int h = result.getHeight();
        int opened = 0;
        boolean changed = true;
        while (changed) {
            changed = false;
            for (int y = 1; y < h - 1; y++) {
                for (int x = 1; x < w - 1; x++) {
                    if (!result.isFloor(x, y)) continue;
                    if (result.isWall(x, y - 1) && result.isWall(x, y + 1)) {
                        if (openInterior(result, x, y - 1) || openInterior(result, x, y + 1)) {
                            opened++;
                            changed = true;
                        }
                    }
                    if (result.isWall(x - 1, y) && result.isWall(x + 1, y)) {
                        if (openInterior(result, x - 1, y) || openInterior(result, x + 1, y)) {
                            opened++;
                            changed = true;
                        }
                    }
                }
            }
        }
        LOG.debug("Widened narrow passages, opened {} cells", opened);
        return result;
    }

    /**
     * Opens both shared orthogonal neighbours of two floor cells that only touch diagonally.
     */
    public CaveGrid fixDiagonalCorridors(CaveGrid grid) {
        CaveGrid result = grid.copy();
        int fixes = 0;
        for (int y = 1; y < result.getHeight() - 1; y++) {
            for (int x = 1; x < result.getWidth() - 1; x++) {
                if (!result.isFloor(x, y)) continue;
                for (int dx = -1; dx <= 1; dx += 2) {
                    int nx = x + dx;
                    int ny = y + 1;
                    if (!result.inBounds(nx, ny) || !result.isFloor(nx, ny)) continue;
                    if (result.isWall(nx, y) && result.isWall(x, ny)) {
                        openInterior(result, nx, y);
                        openInterior(result, x, ny);
                        fixes++;
                    }
                }
            }
        }
        LOG.debug("Fixed {} diagonal-only connections", fixes);
        return result;
    }

    private static boolean openInterior(CaveGrid grid, int x, int y) {
        if (!grid.inBounds(x, y) || grid.isBorder(x, y) || grid.isFloor(x, y)) {
            return false;
        }
        grid.set(x, y, Config.FLOOR);
        return true;
    }
}
