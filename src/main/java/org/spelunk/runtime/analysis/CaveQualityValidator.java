package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.RegionMap;

import java.util.ArrayList;
import java.util.List;

/**
 * Scores terrain against floor density, fragmentation and wall clutter thresholds. The score starts
 * at 100 and every missed threshold subtracts a fixed penalty.
 */
public final class CaveQualityValidator {

    static final int MIN_SIDE = 10;

    private final double minFloorRatio;
    private final double maxFloorRatio;
    private final int minConnectedFloorTiles;
    private final int maxIsolatedRegions;
    private final double minAverageRegionSize;
    private final int maxWallIslands;
    private final RegionDetector regionDetector = new RegionDetector();

    public CaveQualityValidator(double minFloorRatio, double maxFloorRatio, int minConnectedFloorTiles,
                                int maxIsolatedRegions, double minAverageRegionSize, int maxWallIslands) {
        if (minFloorRatio < 0.0 || maxFloorRatio > 1.0 || minFloorRatio >= maxFloorRatio) {
            throw new IllegalArgumentException("Floor ratio range is invalid: [" + minFloorRatio + ", " + maxFloorRatio + "]");
        }
        if (minConnectedFloorTiles < 0 || maxIsolatedRegions < 0 || minAverageRegionSize < 0 || maxWallIslands < 0) {
            throw new IllegalArgumentException("Quality thresholds must not be negative");
        }
        this.minFloorRatio = minFloorRatio;
        this.maxFloorRatio = maxFloorRatio;
        this.minConnectedFloorTiles = minConnectedFloorTiles;
        this.maxIsolatedRegions = maxIsolatedRegions;
        this.minAverageRegionSize = minAverageRegionSize;
        this.maxWallIslands = maxWallIslands;
    }

    public CaveQualityReport evaluate(CaveGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid is required");
        }
        RegionMap regions = regionDetector.detectRegions(grid);
        double floorRatio = (double) grid.countFloor() / grid.size();
        int regionCount = regions.regionCount();
        int largestArea = regionCount == 0 ? 0 : regions.largestRegion().area();
        double averageSize = regionCount == 0 ? 0.0 : (double) regions.totalArea() / regionCount;
        int wallIslands = countWallIslands(grid);

        int score = 100;
        List<String> issues = new ArrayList<>();
        if (floorRatio < minFloorRatio) {
            score -= 30;
            issues.add("Insufficient floor tiles");
        } else if (floorRatio > maxFloorRatio) {
            score -= 20;
            issues.add("Too many floor tiles");
        }
        if (largestArea < minConnectedFloorTiles) {
            score -= 25;
            issues.add("Insufficient connected floor tiles");
        }
        if (regionCount > maxIsolatedRegions) {
            score -= 15;
            issues.add("Too many isolated regions");
        }
        if (averageSize < minAverageRegionSize) {
            score -= 10;
            issues.add("Regions too small");
        }
        if (wallIslands > maxWallIslands) {
            score -= 10;
            issues.add("Too many wall islands");
        }
        if (grid.getWidth() < MIN_SIDE || grid.getHeight() < MIN_SIDE) {
            issues.add("Grid too small");
        }
        return new CaveQualityReport(floorRatio, largestArea, regionCount, averageSize, wallIslands,
            Math.max(0, score), issues);
    }

    /**
     * @return number of 4-connected groups of wall cells
     */
    static int countWallIslands(CaveGrid grid) {
        int w = grid.getWidth();
        int h = grid.getHeight();
        boolean[] seen = new boolean[w * h];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        int islands = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = grid.index(x, y);
                if (seen[idx] || !grid.isWall(x, y)) continue;
                islands++;
                seen[idx] = true;
                queue.enqueue(idx);
                while (!queue.isEmpty()) {
                    int cur = queue.dequeueInt();
                    int cx = cur % w;
                    int cy = cur / w;
                    for (int d = 0; d < 4; d++) {
                        int nx = cx + ReachableFrontierAnalyzer.DX[d];
                        int ny = cy + ReachableFrontierAnalyzer.DY[d];
                        if (!grid.inBounds(nx, ny)) continue;
                        int n = grid.index(nx, ny);
                        if (!seen[n] && grid.isWall(nx, ny)) {
                            seen[n] = true;
                            queue.enqueue(n);
                        }
                    }
                }
            }
        }
        return islands;
    }
}
