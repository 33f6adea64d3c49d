package org.spelunk.runtime.placement;

import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Places coins only where the player can get with the placed platforms. Exploration coins go to the
 * cells that take the most moves to reach.
 */
public final class ReachableCoinPlacer extends AbstractCoinPlacer {

    private final double minReachableRatio;

    public ReachableCoinPlacer(int coinCount, double deadEndWeight, double explorationWeight,
                               double generalWeight, double minDistance, double minReachableRatio) {
        super(coinCount, deadEndWeight, explorationWeight, generalWeight, minDistance);
        if (minReachableRatio < 0.0 || minReachableRatio > 1.0) {
            throw new IllegalArgumentException("minReachableRatio must be between 0 and 1, got " + minReachableRatio);
        }
        this.minReachableRatio = minReachableRatio;
    }

    @Override
    public String name() {
        return "reachable-coins";
    }

    @Override
    protected String precondition(PlacementContext context) {
        double ratio = context.reachability().reachableFloorRatio(context.collisionGrid());
        if (ratio < minReachableRatio) {
            return String.format(Locale.ROOT, "Reachable floor ratio %.2f is below the required %.2f", ratio, minReachableRatio);
        }
        return null;
    }

    @Override
    protected List<List<Point>> candidates(PlacementContext context, IRandomProvider random) {
        CaveGrid grid = context.collisionGrid();
        ReachabilityResult reach = context.reachability();
        List<Point> deadEnds = new ArrayList<>();
        List<Point> general = new ArrayList<>();
        for (Point p : reach.points()) {
            if (!isFree(context, grid, p)) continue;
            general.add(p);
            if (isDeadEnd(grid, p.x(), p.y())) deadEnds.add(p);
        }
        List<Point> exploration = new ArrayList<>(general);
        exploration.sort(Comparator.comparingInt(reach::movesTo).reversed());
        Collections.shuffle(deadEnds, random.asJavaRandom());
        Collections.shuffle(general, random.asJavaRandom());
        return List.of(deadEnds, exploration, general);
    }

    @Override
    public boolean validate(PlacementContext context, CoinPlacement placement) {
        return super.validate(context, placement)
            && placement.coins().stream().allMatch(context.reachability()::contains);
    }
}
