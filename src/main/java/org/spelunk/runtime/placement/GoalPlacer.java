package org.spelunk.runtime.placement;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Places the level goal far from the spawn, on the right side of the map where possible.
 * <p>
 * In {@link GoalMode#BEFORE_PLATFORMS} the goal is the farthest valid cell that cannot be reached by
 * walking alone, so platforms become necessary. In {@link GoalMode#AFTER_PLATFORMS} the goal is drawn
 * among the right-most cells that are reachable with the platforms already placed.
 * </p>
 */
public final class GoalPlacer implements ILevelPlacer<GoalPlacement> {

    private static final Logger LOG = LoggerFactory.getLogger(GoalPlacer.class);

    private final GoalMode mode;
    private final double minDistance;
    private final double rightSideBoundary;
    private final int candidatePool;

    /**
     * @param mode placement mode
     * @param minDistance minimal Euclidean distance to the spawn
     * @param rightSideBoundary fraction of the width the goal must lie right of; 0 disables the constraint
     * @param candidatePool number of right-most reachable cells to choose from in after-platforms mode
     */
    public GoalPlacer(GoalMode mode, double minDistance, double rightSideBoundary, int candidatePool) {
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        if (minDistance < 0) {
            throw new IllegalArgumentException("minDistance must not be negative, got " + minDistance);
        }
        if (rightSideBoundary < 0.0 || rightSideBoundary >= 1.0) {
            throw new IllegalArgumentException("rightSideBoundary must be in [0, 1), got " + rightSideBoundary);
        }
        if (candidatePool <= 0) {
            throw new IllegalArgumentException("candidatePool must be positive, got " + candidatePool);
        }
        this.mode = mode;
        this.minDistance = minDistance;
        this.rightSideBoundary = rightSideBoundary;
        this.candidatePool = candidatePool;
    }

    public GoalMode getMode() {
        return mode;
    }

    @Override
    public String name() {
        return "goal";
    }

    @Override
    public PlacementResult<GoalPlacement> place(PlacementContext context, IRandomProvider random) {
        Point spawn = context.requireSpawn();
        CaveGrid grid = context.collisionGrid();
        ReachabilityResult walking = context.analyzer().reachableByWalking(grid, spawn);
        int minX = (int) Math.floor(grid.getWidth() * rightSideBoundary);

        Predicate<Point> modeFilter = mode == GoalMode.BEFORE_PLATFORMS
            ? p -> !walking.contains(p)
            : context.reachability()::contains;

        List<Point> constrained = candidates(grid, spawn, minX, modeFilter);
        boolean fallbackUsed = false;
        if (constrained.isEmpty() && minX > 0) {
            constrained = candidates(grid, spawn, 0, modeFilter);
            fallbackUsed = !constrained.isEmpty();
        }
        if (constrained.isEmpty()) {
            return PlacementResult.failure("No valid goal position: need a floor cell with a wall below, at least "
                + minDistance + " from spawn " + spawn
                + (mode == GoalMode.BEFORE_PLATFORMS ? ", not reachable by walking" : ", reachable from spawn"));
        }

        Point goal = mode == GoalMode.BEFORE_PLATFORMS
            ? farthest(constrained, spawn)
            : pickRightMost(constrained, random);
        if (fallbackUsed) {
            LOG.warn("No goal candidate right of x={}, fell back to {}", minX, goal);
        }
        GoalPlacement placement = new GoalPlacement(goal, goal.distance(spawn), walking.contains(goal),
            isVisible(grid, goal), mode, fallbackUsed);
        LOG.debug("Goal placed at {} ({} mode, distance {})", goal, mode, String.format(Locale.ROOT, "%.1f", placement.distance()));
        return PlacementResult.success(placement);
    }

    @Override
    public boolean validate(PlacementContext context, GoalPlacement placement) {
        if (placement == null) return false;
        Point spawn = context.requireSpawn();
        Point goal = placement.position();
        CaveGrid grid = context.collisionGrid();
        if (!grid.hasFooting(goal) || goal.equals(spawn) || goal.distance(spawn) < minDistance) {
            return false;
        }
        if (mode == GoalMode.AFTER_PLATFORMS) {
            return context.reachability().contains(goal);
        }
        return !context.analyzer().reachableByWalking(grid, spawn).contains(goal);
    }

    /**
     * A goal is visible when at least one of its 4-neighbours is open.
     */
    static boolean isVisible(CaveGrid grid, Point p) {
        return grid.getOrWall(p.x() + 1, p.y()) == Config.FLOOR || grid.getOrWall(p.x() - 1, p.y()) == Config.FLOOR
            || grid.getOrWall(p.x(), p.y() + 1) == Config.FLOOR || grid.getOrWall(p.x(), p.y() - 1) == Config.FLOOR;
    }

    private List<Point> candidates(CaveGrid grid, Point spawn, int minX, Predicate<Point> filter) {
        List<Point> result = new ArrayList<>();
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = minX; x < grid.getWidth(); x++) {
                if (!grid.hasFooting(x, y)) continue;
                Point p = new Point(x, y);
                if (p.equals(spawn) || p.distance(spawn) < minDistance) continue;
                if (filter.test(p)) result.add(p);
            }
        }
        return result;
    }

    private static Point farthest(List<Point> candidates, Point spawn) {
        Point best = null;
        double bestDistance = -1;
        for (Point p : candidates) {
            double d = p.distance(spawn);
            if (d > bestDistance) {
                bestDistance = d;
                best = p;
            }
        }
        return best;
    }

    private Point pickRightMost(List<Point> candidates, IRandomProvider random) {
        List<Point> sorted = new ArrayList<>(candidates);
        sorted.sort(Comparator.comparingInt(Point::x).reversed());
        List<Point> pool = sorted.subList(0, Math.min(candidatePool, sorted.size()));
        return pool.get(random.nextInt(pool.size()));
    }
}
