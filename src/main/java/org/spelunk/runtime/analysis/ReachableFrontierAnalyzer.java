package org.spelunk.runtime.analysis;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the boundary between explored and unexplored floor.
 */
public final class ReachableFrontierAnalyzer {

    static final int[] DX = {0, 1, 0, -1};
    static final int[] DY = {-1, 0, 1, 0};

    /**
     * @return reachable cells with at least one 4-neighbour that is floor but not reachable, row-major
     */
    public List<Point> findFrontier(CaveGrid grid, ReachabilityResult reachability) {
        List<Point> frontier = new ArrayList<>();
        for (Point p : reachability.points()) {
            if (!grid.isFloor(p)) continue;
            for (int d = 0; d < 4; d++) {
                int nx = p.x() + DX[d];
                int ny = p.y() + DY[d];
                if (grid.inBounds(nx, ny) && grid.isFloor(nx, ny) && !reachability.contains(nx, ny)) {
                    frontier.add(p);
                    break;
                }
            }
        }
        return frontier;
    }
}
