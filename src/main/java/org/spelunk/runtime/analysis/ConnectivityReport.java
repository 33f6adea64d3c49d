package org.spelunk.runtime.analysis;

import java.util.ArrayList;
import java.util.List;

/**
 * Snapshot of how well a grid's floor hangs together.
 *
 * @param connected whether the grid passes the connectivity threshold
 * @param score largest region area divided by the number of floor cells, 0 without floor
 * @param regionCount number of regions
 * @param floorTiles number of floor cells
 * @param largestRegionArea area of the largest region, 0 without floor
 * @param regionSizes region areas, largest first
 */
public record ConnectivityReport(
    boolean connected,
    double score,
    int regionCount,
    int floorTiles,
    int largestRegionArea,
    List<Integer> regionSizes
) {

    public ConnectivityReport {
        regionSizes = List.copyOf(regionSizes);
    }

    /**
     * @return human readable hints on how the grid could be improved
     */
    public List<String> recommendations() {
        List<String> hints = new ArrayList<>();
        if (floorTiles == 0) {
            hints.add("Grid has no floor cells; lower the initial wall ratio or the birth threshold");
            return hints;
        }
        if (regionCount > 1) {
            hints.add("Carve corridors to join " + (regionCount - 1) + " isolated region(s) to the main cave");
        }
        if (score < 0.5) {
            hints.add("Main region holds less than half of the floor; consider fewer automaton steps");
        }
        long tiny = regionSizes.stream().filter(size -> size < 5).count();
        if (tiny > 0) {
            hints.add(tiny + " region(s) smaller than 5 cells could be filled instead of connected");
        }
        return hints;
    }
}
