package org.spelunk.runtime.analysis;

import java.util.List;

/**
 * Terrain quality metrics with the resulting score.
 *
 * @param floorRatio floor cells divided by all cells
 * @param largestRegionArea floor cells in the largest 4-connected region
 * @param regionCount number of floor regions
 * @param averageRegionSize mean region area, 0 without floor
 * @param wallIslands number of 4-connected wall groups
 * @param score 0 to 100, lowered by every missed threshold
 * @param issues one entry per missed threshold, empty for a clean cave
 */
public record CaveQualityReport(
    double floorRatio,
    int largestRegionArea,
    int regionCount,
    double averageRegionSize,
    int wallIslands,
    int score,
    List<String> issues
) {

    public CaveQualityReport {
        issues = List.copyOf(issues);
    }

    public boolean acceptable() {
        return issues.isEmpty();
    }
}
