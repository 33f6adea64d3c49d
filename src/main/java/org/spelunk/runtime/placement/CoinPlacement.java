package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Point;

import java.util.List;

/**
 * @param coins coin cells in placement order
 * @param deadEnds coins placed in dead ends
 * @param exploration coins placed in the exploration category
 * @param remaining coins placed in the third category (unreachable or general reachable floor)
 */
public record CoinPlacement(List<Point> coins, int deadEnds, int exploration, int remaining) {

    public CoinPlacement {
        coins = List.copyOf(coins);
    }
}
