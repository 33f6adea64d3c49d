package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.Bounds;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Region;
import org.spelunk.runtime.model.RegionMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Labels every 4-connected group of floor cells. Flood fill runs on an explicit queue so grid size
 * is not limited by stack depth.
 */
public final class RegionDetector {

    private static final int[] DX = {1, -1, 0, 0};
    private static final int[] DY = {0, 0, 1, -1};

    /**
     * Scans in row-major order and starts a new label at every unlabelled floor cell.
     *
     * @param grid the grid to label
     * @return the label grid and region metadata
     */
    public RegionMap detectRegions(CaveGrid grid) {
        if (grid == null) {
            throw new IllegalArgumentException("grid is required");
        }
        int w = grid.getWidth();
        int h = grid.getHeight();
        int[] labels = new int[w * h];
        Map<Integer, Region> regions = new LinkedHashMap<>();
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();

        int nextLabel = Config.FIRST_REGION_LABEL;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = grid.index(x, y);
                if (grid.isWall(x, y)) {
                    labels[idx] = Config.WALL_LABEL;
                    continue;
                }
                if (labels[idx] != 0) continue;

                int label = nextLabel++;
                int area = 0;
                Bounds bounds = new Bounds(x, y, x, y);
                labels[idx] = label;
                queue.enqueue(idx);
                while (!queue.isEmpty()) {
                    int current = queue.dequeueInt();
                    int cx = current % w;
                    int cy = current / w;
                    area++;
                    bounds = bounds.include(cx, cy);
                    for (int d = 0; d < 4; d++) {
                        int nx = cx + DX[d];
                        int ny = cy + DY[d];
                        if (!grid.inBounds(nx, ny) || grid.isWall(nx, ny)) continue;
                        int nIdx = grid.index(nx, ny);
                        if (labels[nIdx] == 0) {
                            labels[nIdx] = label;
                            queue.enqueue(nIdx);
                        }
                    }
                }
                regions.put(label, new Region(label, area, bounds));
            }
        }
        return new RegionMap(w, h, labels, regions);
    }
}
