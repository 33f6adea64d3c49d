package org.spelunk.runtime.analysis;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;

import java.util.ArrayList;
import java.util.List;

/**
 * Replays the jump simulation from the spawn of a finished level and checks the goal and every coin
 * against the reachable set.
 */
public final class SolvabilityTester {

    private final PhysicsAwareReachabilityAnalyzer analyzer;

    public SolvabilityTester(PhysicsAwareReachabilityAnalyzer analyzer) {
        if (analyzer == null) {
            throw new IllegalArgumentException("analyzer is required");
        }
        this.analyzer = analyzer;
    }

    /**
     * @param collision terrain with platform cells stamped as walls
     * @param spawn the player's start cell
     * @param goal the goal cell
     * @param coins the placed coins
     * @throws IllegalArgumentException if spawn or goal is missing or outside the grid
     */
    public SolvabilityReport test(CaveGrid collision, Point spawn, Point goal, List<Point> coins) {
        if (collision == null || spawn == null || goal == null || coins == null) {
            throw new IllegalArgumentException("grid, spawn, goal and coins are required");
        }
        if (!collision.inBounds(spawn) || !collision.inBounds(goal)) {
            throw new IllegalArgumentException("Spawn " + spawn + " and goal " + goal + " must lie inside the grid");
        }
        List<String> issues = new ArrayList<>();
        if (collision.isWall(spawn.x(), spawn.y())) {
            issues.add("Spawn " + spawn + " is inside a wall");
            return new SolvabilityReport(false, -1, coins, 0.0, issues);
        }
        ReachabilityResult reach = analyzer.analyze(collision, spawn);
        boolean goalReachable = reach.contains(goal);
        if (!goalReachable) {
            issues.add("Goal " + goal + " is not reachable from spawn " + spawn);
        }
        List<Point> unreachableCoins = new ArrayList<>();
        for (Point coin : coins) {
            if (!reach.contains(coin)) unreachableCoins.add(coin);
        }
        if (!unreachableCoins.isEmpty()) {
            issues.add(unreachableCoins.size() + " of " + coins.size() + " coins are not reachable");
        }
        return new SolvabilityReport(goalReachable, reach.movesTo(goal), unreachableCoins,
            reach.reachableFloorRatio(collision), issues);
    }
}
