package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cells a player can occupy, with the minimal number of moves (walks and jumps) needed for each.
 * Cells are keyed by row-major index.
 */
public final class ReachabilityResult {

    private final int width;
    private final int height;
    private final Point start;
    private final Int2IntOpenHashMap reached;
    private final Int2IntOpenHashMap standing;

    ReachabilityResult(int width, int height, Point start, Int2IntOpenHashMap reached, Int2IntOpenHashMap standing) {
        this.width = width;
        this.height = height;
        this.start = start;
        this.reached = reached;
        this.standing = standing;
    }

    public Point start() {
        return start;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height && reached.containsKey(y * width + x);
    }

    public boolean contains(Point p) {
        return contains(p.x(), p.y());
    }

    public int size() {
        return reached.size();
    }

    /**
     * @return minimal move count to reach the cell, or -1 if unreachable
     */
    public int movesTo(Point p) {
        return contains(p) ? reached.get(p.y() * width + p.x()) : -1;
    }

    public boolean isStanding(Point p) {
        return p.x() >= 0 && p.x() < width && p.y() >= 0 && p.y() < height
            && standing.containsKey(p.y() * width + p.x());
    }

    /**
     * @return reached cells in row-major order
     */
    public List<Point> points() {
        return toPoints(reached);
    }

    /**
     * @return cells the player can stand on, in row-major order
     */
    public List<Point> standingPositions() {
        return toPoints(standing);
    }

    /**
     * @return number of reached cells that are floor in the given grid
     */
    public int reachableFloorCount(CaveGrid grid) {
        int count = 0;
        for (int idx : reached.keySet()) {
            if (grid.isFloor(idx % width, idx / width)) count++;
        }
        return count;
    }

    /**
     * @return reached floor cells divided by all floor cells of the grid, 0 for a grid without floor
     */
    public double reachableFloorRatio(CaveGrid grid) {
        int floor = grid.countFloor();
        return floor == 0 ? 0.0 : (double) reachableFloorCount(grid) / floor;
    }

    Int2IntOpenHashMap reachedMoves() {
        return reached;
    }

    Int2IntOpenHashMap standingMoves() {
        return standing;
    }

    private List<Point> toPoints(Int2IntOpenHashMap cells) {
        int[] keys = cells.keySet().toIntArray();
        Arrays.sort(keys);
        List<Point> points = new ArrayList<>(keys.length);
        for (int idx : keys) {
            points.add(new Point(idx % width, idx / width));
        }
        return points;
    }
}
