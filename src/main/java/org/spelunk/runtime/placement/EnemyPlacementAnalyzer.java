package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Finds cells where an enemy makes the level more interesting. All candidates are footing cells.
 */
public final class EnemyPlacementAnalyzer {

    /**
     * Candidate kinds, in priority order.
     */
    public enum CandidateType {
        /** Footing with a wall directly above: a low tunnel the player has to pass through. */
        CHOKE_POINT,
        /** Start of a flat run of footing cells long enough to patrol. */
        PATROL,
        /** Near a coin or the goal. */
        STRATEGIC
    }

    public record Candidate(Point position, CandidateType type) {
    }

    private final int minPatrolLength;
    private final int maxPatrolLength;
    private final int strategicDistance;

    public EnemyPlacementAnalyzer(int minPatrolLength, int maxPatrolLength, int strategicDistance) {
        if (minPatrolLength < 1 || maxPatrolLength < minPatrolLength) {
            throw new IllegalArgumentException("Patrol length range is invalid: [" + minPatrolLength + ", " + maxPatrolLength + "]");
        }
        if (strategicDistance < 0) {
            throw new IllegalArgumentException("strategicDistance must not be negative, got " + strategicDistance);
        }
        this.minPatrolLength = minPatrolLength;
        this.maxPatrolLength = maxPatrolLength;
        this.strategicDistance = strategicDistance;
    }

    /**
     * @param grid collision grid
     * @param coins placed coins
     * @param goal the goal, may be null
     * @return one candidate per cell, typed by the highest-priority kind that applies, row-major within a kind
     */
    public List<Candidate> findCandidates(CaveGrid grid, List<Point> coins, Point goal) {
        Map<Point, CandidateType> byCell = new LinkedHashMap<>();
        for (Point p : chokePoints(grid)) {
            byCell.putIfAbsent(p, CandidateType.CHOKE_POINT);
        }
        for (Point p : patrolStarts(grid)) {
            byCell.putIfAbsent(p, CandidateType.PATROL);
        }
        List<Point> anchors = new ArrayList<>(coins);
        if (goal != null) anchors.add(goal);
        for (Point p : strategicPositions(grid, anchors)) {
            byCell.putIfAbsent(p, CandidateType.STRATEGIC);
        }
        List<Candidate> candidates = new ArrayList<>();
        byCell.forEach((p, type) -> candidates.add(new Candidate(p, type)));
        return candidates;
    }

    List<Point> chokePoints(CaveGrid grid) {
        List<Point> result = new ArrayList<>();
        for (int y = 1; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                if (grid.hasFooting(x, y) && grid.isWall(x, y - 1)) {
                    result.add(new Point(x, y));
                }
            }
        }
        return result;
    }

    List<Point> patrolStarts(CaveGrid grid) {
        List<Point> result = new ArrayList<>();
        for (int y = 0; y < grid.getHeight(); y++) {
            int x = 0;
            while (x < grid.getWidth()) {
                if (!grid.hasFooting(x, y)) {
                    x++;
                    continue;
                }
                int start = x;
                while (x < grid.getWidth() && grid.hasFooting(x, y)) x++;
                int length = x - start;
                if (length >= minPatrolLength && length <= maxPatrolLength) {
                    result.add(new Point(start, y));
                }
            }
        }
        return result;
    }

    List<Point> strategicPositions(CaveGrid grid, List<Point> anchors) {
        List<Point> result = new ArrayList<>();
        if (anchors.isEmpty()) return result;
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                if (!grid.hasFooting(x, y)) continue;
                Point p = new Point(x, y);
                for (Point anchor : anchors) {
                    if (!anchor.equals(p) && anchor.distance(p) <= strategicDistance) {
                        result.add(p);
                        break;
                    }
                }
            }
        }
        return result;
    }
}
