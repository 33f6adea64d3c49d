package org.spelunk.runtime.placement;

import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.analysis.ReachableFrontierAnalyzer;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Distributes coins over dead ends, the exploration frontier and unreachable floor. Coins in
 * unreachable areas reward players who find routes the generator did not plan for.
 */
public final class CoinDistributor extends AbstractCoinPlacer {

    private final ReachableFrontierAnalyzer frontierAnalyzer = new ReachableFrontierAnalyzer();

    public CoinDistributor(int coinCount, double deadEndWeight, double explorationWeight,
                           double unreachableWeight, double minDistance) {
        super(coinCount, deadEndWeight, explorationWeight, unreachableWeight, minDistance);
    }

    @Override
    public String name() {
        return "coins";
    }

    @Override
    protected List<List<Point>> candidates(PlacementContext context, IRandomProvider random) {
        CaveGrid grid = context.collisionGrid();
        ReachabilityResult reach = context.reachability();
        List<Point> deadEnds = new ArrayList<>();
        List<Point> unreachable = new ArrayList<>();
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                Point p = new Point(x, y);
                if (!isFree(context, grid, p)) continue;
                if (isDeadEnd(grid, x, y)) deadEnds.add(p);
                if (!reach.contains(p)) unreachable.add(p);
            }
        }
        List<Point> exploration = new ArrayList<>();
        for (Point p : frontierAnalyzer.findFrontier(grid, reach)) {
            if (isFree(context, grid, p)) exploration.add(p);
        }
        Collections.shuffle(deadEnds, random.asJavaRandom());
        Collections.shuffle(exploration, random.asJavaRandom());
        Collections.shuffle(unreachable, random.asJavaRandom());
        return List.of(deadEnds, exploration, unreachable);
    }
}
