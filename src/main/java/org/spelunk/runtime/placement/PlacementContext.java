package org.spelunk.runtime.placement;

import org.spelunk.runtime.analysis.PhysicsAwareReachabilityAnalyzer;
import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Platform;
import org.spelunk.runtime.model.Point;

import java.util.List;
import java.util.Objects;

/**
 * Level state threaded through the placers. Instances are immutable; the {@code with*} methods
 * return modified copies.
 */
public final class PlacementContext {

    private final CaveGrid grid;
    private final PhysicsAwareReachabilityAnalyzer analyzer;
    private final List<Platform> platforms;
    private final Point spawn;
    private final Point goal;
    private final List<Point> coins;

    private CaveGrid collisionGrid;
    private ReachabilityResult reachability;

    public PlacementContext(CaveGrid grid, PhysicsAwareReachabilityAnalyzer analyzer) {
        this(grid, analyzer, List.of(), null, null, List.of());
    }

    private PlacementContext(CaveGrid grid, PhysicsAwareReachabilityAnalyzer analyzer, List<Platform> platforms,
                             Point spawn, Point goal, List<Point> coins) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.platforms = List.copyOf(platforms);
        this.spawn = spawn;
        this.goal = goal;
        this.coins = List.copyOf(coins);
    }

    public CaveGrid grid() {
        return grid;
    }

    public PhysicsAwareReachabilityAnalyzer analyzer() {
        return analyzer;
    }

    public List<Platform> platforms() {
        return platforms;
    }

    public Point spawn() {
        return spawn;
    }

    public Point goal() {
        return goal;
    }

    public List<Point> coins() {
        return coins;
    }

    public PlacementContext withSpawn(Point spawn) {
        return new PlacementContext(grid, analyzer, platforms, spawn, goal, coins);
    }

    public PlacementContext withGoal(Point goal) {
        return new PlacementContext(grid, analyzer, platforms, spawn, goal, coins);
    }

    public PlacementContext withPlatforms(List<Platform> platforms) {
        return new PlacementContext(grid, analyzer, platforms, spawn, goal, coins);
    }

    public PlacementContext withCoins(List<Point> coins) {
        return new PlacementContext(grid, analyzer, platforms, spawn, goal, coins);
    }

    /**
     * @return the grid with every platform cell stamped as wall
     */
    public CaveGrid collisionGrid() {
        if (collisionGrid == null) {
            collisionGrid = grid.withWalls(platforms.stream().flatMap(p -> p.cells().stream()).toList());
        }
        return collisionGrid;
    }

    public boolean isPlatformCell(Point p) {
        return platforms.stream().anyMatch(platform -> platform.occupies(p));
    }

    /**
     * @return full reachability from the spawn on the collision grid
     * @throws IllegalStateException if no spawn has been placed yet
     */
    public ReachabilityResult reachability() {
        if (reachability == null) {
            reachability = analyzer.analyze(collisionGrid(), requireSpawn());
        }
        return reachability;
    }

    public Point requireSpawn() {
        if (spawn == null) {
            throw new IllegalStateException("A spawn point must be placed first");
        }
        return spawn;
    }
}
