package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Places the player spawn on solid ground, preferably on the left side of the map, with a safe
 * landing zone around it.
 */
public final class PlayerSpawnPlacer implements ILevelPlacer<SpawnPlacement> {

    private static final Logger LOG = LoggerFactory.getLogger(PlayerSpawnPlacer.class);

    private final int maxAttempts;
    private final int safetyRadius;
    private final double leftSideBoundary;
    private final boolean allowFallback;

    /**
     * @param maxAttempts candidates to examine per pool
     * @param safetyRadius horizontal radius of ground that must be free of pits and edges
     * @param leftSideBoundary fraction of the width the spawn must lie left of; 1.0 disables the constraint
     * @param allowFallback whether to retry without the left-side constraint
     */
    public PlayerSpawnPlacer(int maxAttempts, int safetyRadius, double leftSideBoundary, boolean allowFallback) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive, got " + maxAttempts);
        }
        if (safetyRadius < 0) {
            throw new IllegalArgumentException("safetyRadius must not be negative, got " + safetyRadius);
        }
        if (leftSideBoundary <= 0.0 || leftSideBoundary > 1.0) {
            throw new IllegalArgumentException("leftSideBoundary must be in (0, 1], got " + leftSideBoundary);
        }
        this.maxAttempts = maxAttempts;
        this.safetyRadius = safetyRadius;
        this.leftSideBoundary = leftSideBoundary;
        this.allowFallback = allowFallback;
    }

    @Override
    public String name() {
        return "spawn";
    }

    @Override
    public PlacementResult<SpawnPlacement> place(PlacementContext context, IRandomProvider random) {
        CaveGrid grid = context.collisionGrid();
        int limitX = (int) Math.floor(grid.getWidth() * leftSideBoundary);

        List<Point> constrained = new ArrayList<>();
        List<Point> all = new ArrayList<>();
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                if (!grid.hasFooting(x, y)) continue;
                Point p = new Point(x, y);
                all.add(p);
                if (x < limitX) constrained.add(p);
            }
        }

        int[] attempts = {0};
        Point spawn = sample(grid, constrained, random, attempts);
        if (spawn != null) {
            LOG.debug("Spawn placed at {} after {} attempts", spawn, attempts[0]);
            return PlacementResult.success(new SpawnPlacement(spawn, attempts[0], false));
        }
        if (allowFallback && leftSideBoundary < 1.0) {
            spawn = sample(grid, all, random, attempts);
            if (spawn != null) {
                LOG.warn("No safe spawn left of x={}, fell back to {}", limitX, spawn);
                return PlacementResult.success(new SpawnPlacement(spawn, attempts[0], true));
            }
        }
        return PlacementResult.failure("No valid spawn position: need a floor cell with a wall below, headroom above"
            + " and a safe landing zone of radius " + safetyRadius + " left of x=" + limitX
            + " (" + constrained.size() + " footing candidates, " + attempts[0] + " attempts)");
    }

    /**
     * Draws candidates without replacement until one is safe or the attempt budget is used up.
     */
    private Point sample(CaveGrid grid, List<Point> pool, IRandomProvider random, int[] attempts) {
        List<Point> remaining = new ArrayList<>(pool);
        for (int i = 0; i < maxAttempts && !remaining.isEmpty(); i++) {
            attempts[0]++;
            int pick = random.nextInt(remaining.size());
            Point candidate = remaining.get(pick);
            remaining.set(pick, remaining.get(remaining.size() - 1));
            remaining.remove(remaining.size() - 1);
            if (isSafe(grid, candidate)) {
                return candidate;
            }
        }
        return null;
    }

    @Override
    public boolean validate(PlacementContext context, SpawnPlacement placement) {
        return placement != null && isSafe(context.collisionGrid(), placement.position());
    }

    /**
     * Footing, headroom, and every cell within {@code safetyRadius} on the same row is in the interior
     * and has footing as well.
     */
    boolean isSafe(CaveGrid grid, Point p) {
        if (!grid.hasFooting(p) || p.y() == 0 || !grid.isFloor(p.x(), p.y() - 1)) {
            return false;
        }
        for (int dx = -safetyRadius; dx <= safetyRadius; dx++) {
            int x = p.x() + dx;
            if (x <= 0 || x >= grid.getWidth() - 1 || !grid.hasFooting(x, p.y())) {
                return false;
            }
        }
        return true;
    }
}
