package org.spelunk.runtime.analysis;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.model.Region;
import org.spelunk.runtime.model.RegionMap;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Joins disconnected regions to the largest one with two-cell-thick L-shaped corridors.
 */
public final class CorridorCarver {

    private static final Logger LOG = LoggerFactory.getLogger(CorridorCarver.class);

    /**
     * A pair of cells, one per region, with their Manhattan distance.
     */
    public record ClosestPair(Point from, Point to, int distance) {
    }

    /**
     * Connects every region to the largest region (the hub). Works on a copy; with fewer than two
     * regions the copy is returned unchanged.
     *
     * @param grid the grid the region map was computed from
     * @param regionMap the detected regions
     * @param random one draw per corridor decides horizontal-first versus vertical-first
     * @return the carved copy
     * @throws IllegalStateException if the region map is empty
     */
    public CaveGrid carveCorridors(CaveGrid grid, RegionMap regionMap, IRandomProvider random) {
        if (regionMap.regionCount() == 0) {
            throw new IllegalStateException("Cannot carve corridors: no floor regions were detected");
        }
        CaveGrid result = grid.copy();
        if (regionMap.regionCount() < 2) {
            return result;
        }

        Region hub = regionMap.largestRegion();
        List<Point> hubCells = regionMap.pointsOf(hub.label());
        for (Region region : regionMap.getRegions().values()) {
            if (region.label() == hub.label()) continue;
            ClosestPair pair = findClosestPair(regionMap.pointsOf(region.label()), hubCells);
            boolean horizontalFirst = random.nextDouble() < 0.5;
            carveLShapedCorridor(result, pair.from(), pair.to(), horizontalFirst);
            LOG.debug("Carved corridor {} -> {} (distance {}) from region {} to hub {}",
                pair.from(), pair.to(), pair.distance(), region.label(), hub.label());
        }
        return result;
    }

    /**
     * Brute-force closest pair by Manhattan distance. The first pair found in iteration order wins ties.
     */
    public ClosestPair findClosestPair(List<Point> a, List<Point> b) {
        if (a.isEmpty() || b.isEmpty()) {
            throw new IllegalArgumentException("Both point sets must be non-empty");
        }
        Point bestA = null;
        Point bestB = null;
        int best = Integer.MAX_VALUE;
        for (Point pa : a) {
            for (Point pb : b) {
                int d = pa.manhattanDistance(pb);
                if (d < best) {
                    best = d;
                    bestA = pa;
                    bestB = pb;
                }
            }
        }
        return new ClosestPair(bestA, bestB, best);
    }

    /**
     * Carves an L-shaped corridor between two cells. The horizontal leg also clears the row below it
     * and the vertical leg also clears the column to its right; everything is clamped to the grid.
     */
    public void carveLShapedCorridor(CaveGrid grid, Point from, Point to, boolean horizontalFirst) {
        if (horizontalFirst) {
            carveHorizontal(grid, from.x(), to.x(), from.y());
            carveVertical(grid, from.y(), to.y(), to.x());
        } else {
            carveVertical(grid, from.y(), to.y(), from.x());
            carveHorizontal(grid, from.x(), to.x(), to.y());
        }
    }

    private static void carveHorizontal(CaveGrid grid, int x1, int x2, int y) {
        for (int x = Math.min(x1, x2); x <= Math.max(x1, x2); x++) {
            open(grid, x, y);
            open(grid, x, y + 1);
        }
    }

    private static void carveVertical(CaveGrid grid, int y1, int y2, int x) {
        for (int y = Math.min(y1, y2); y <= Math.max(y1, y2); y++) {
            open(grid, x, y);
            open(grid, x + 1, y);
        }
    }

    private static void open(CaveGrid grid, int x, int y) {
        int cx = Math.max(0, Math.min(grid.getWidth() - 1, x));
        int cy = Math.max(0, Math.min(grid.getHeight() - 1, y));
        grid.set(cx, cy, Config.FLOOR);
    }
}
