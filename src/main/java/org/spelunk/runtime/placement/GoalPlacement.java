package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Point;

/**
 * @param position goal cell
 * @param distance Euclidean distance to the spawn
 * @param reachableByWalking whether the goal can be reached without jumping
 * @param visible whether at least one 4-neighbour is open
 * @param mode the mode the goal was placed in
 * @param fallbackUsed true when the right-side constraint had to be dropped
 */
public record GoalPlacement(Point position, double distance, boolean reachableByWalking, boolean visible,
                            GoalMode mode, boolean fallbackUsed) {
}
