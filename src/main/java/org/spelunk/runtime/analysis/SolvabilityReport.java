package org.spelunk.runtime.analysis;

import org.spelunk.runtime.model.Point;

import java.util.List;

/**
 * Whether a finished level can be completed from its spawn.
 *
 * @param goalReachable whether the goal is in the reachable set of the spawn
 * @param movesToGoal minimal move count to the goal, -1 if unreachable
 * @param unreachableCoins coins outside the reachable set, in input order
 * @param reachableFloorRatio reachable floor cells divided by all floor cells
 * @param issues one line per problem found, empty when the goal and every coin are reachable
 */
public record SolvabilityReport(
    boolean goalReachable,
    int movesToGoal,
    List<Point> unreachableCoins,
    double reachableFloorRatio,
    List<String> issues
) {

    public SolvabilityReport {
        unreachableCoins = List.copyOf(unreachableCoins);
        issues = List.copyOf(issues);
    }

    /**
     * @return true if the goal can be reached; coins do not block completion
     */
    public boolean solvable() {
        return goalReachable;
    }

    public boolean allCoinsReachable() {
        return unreachableCoins.isEmpty();
    }
}
