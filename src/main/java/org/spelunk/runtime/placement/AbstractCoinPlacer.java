package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared quota logic for coin placers. Coins are split over three candidate categories by weight;
 * quota a category cannot fill spills over to the next one. Coins keep a minimal Euclidean distance
 * to each other.
 */
public abstract class AbstractCoinPlacer implements ILevelPlacer<CoinPlacement> {

    private static final Logger LOG = LoggerFactory.getLogger(AbstractCoinPlacer.class);
    private static final double WEIGHT_TOLERANCE = 0.001;

    protected final int coinCount;
    protected final double[] weights;
    protected final double minDistance;

    protected AbstractCoinPlacer(int coinCount, double deadEndWeight, double explorationWeight,
                                 double remainingWeight, double minDistance) {
        if (coinCount < 0) {
            throw new IllegalArgumentException("coinCount must not be negative, got " + coinCount);
        }
        if (deadEndWeight < 0 || explorationWeight < 0 || remainingWeight < 0) {
            throw new IllegalArgumentException("Coin category weights must not be negative");
        }
        double sum = deadEndWeight + explorationWeight + remainingWeight;
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalArgumentException("Coin category weights must sum to 1.0, got " + sum);
        }
        if (minDistance < 0) {
            throw new IllegalArgumentException("minDistance must not be negative, got " + minDistance);
        }
        this.coinCount = coinCount;
        this.weights = new double[] {deadEndWeight, explorationWeight, remainingWeight};
        this.minDistance = minDistance;
    }

    /**
     * Produces the three candidate lists: dead ends, exploration cells, and the remaining category.
     * Lists are consumed in the order returned.
     */
    protected abstract List<List<Point>> candidates(PlacementContext context, IRandomProvider random);

    /**
     * Hook for placers with a precondition; returns an error message or null. Coins are still placed
     * when it fails, and the failed result carries them.
     */
    protected String precondition(PlacementContext context) {
        return null;
    }

    @Override
    public PlacementResult<CoinPlacement> place(PlacementContext context, IRandomProvider random) {
        String error = precondition(context);
        List<List<Point>> categories = candidates(context, random);
        int[] quotas = quotas();
        int[] placedPerCategory = new int[3];
        List<Point> coins = new ArrayList<>();
        int carry = 0;
        for (int c = 0; c < 3; c++) {
            int wanted = quotas[c] + carry;
            int placed = 0;
            for (Point candidate : categories.get(c)) {
                if (placed >= wanted) break;
                if (isFarEnough(candidate, coins)) {
                    coins.add(candidate);
                    placed++;
                }
            }
            placedPerCategory[c] = placed;
            carry = wanted - placed;
        }
        CoinPlacement placement = new CoinPlacement(coins, placedPerCategory[0], placedPerCategory[1], placedPerCategory[2]);
        LOG.debug("{} placed {} of {} coins (dead ends {}, exploration {}, other {})", name(), coins.size(), coinCount,
            placedPerCategory[0], placedPerCategory[1], placedPerCategory[2]);
        if (error != null) {
            return PlacementResult.failure(error, placement);
        }
        if (coins.size() < coinCount) {
            return PlacementResult.failure("Only " + coins.size() + " of " + coinCount
                + " coins could be placed with minimum distance " + minDistance, placement);
        }
        return PlacementResult.success(placement);
    }

    @Override
    public boolean validate(PlacementContext context, CoinPlacement placement) {
        if (placement == null) return false;
        CaveGrid grid = context.collisionGrid();
        List<Point> seen = new ArrayList<>();
        for (Point coin : placement.coins()) {
            if (!grid.isFloor(coin) || coin.equals(context.spawn()) || coin.equals(context.goal())) {
                return false;
            }
            if (!isFarEnough(coin, seen)) {
                return false;
            }
            seen.add(coin);
        }
        return true;
    }

    /**
     * Per-category quotas: floor(n * w) for the first two, the remainder for the last.
     */
    int[] quotas() {
        int first = (int) Math.floor(coinCount * weights[0]);
        int second = (int) Math.floor(coinCount * weights[1]);
        return new int[] {first, second, coinCount - first - second};
    }

    protected boolean isFarEnough(Point candidate, List<Point> placed) {
        for (Point p : placed) {
            if (p.equals(candidate) || p.distance(candidate) < minDistance) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return true if the cell may hold a coin: floor in the collision grid, not spawn, not goal
     */
    protected static boolean isFree(PlacementContext context, CaveGrid grid, Point p) {
        return grid.isFloor(p) && !p.equals(context.spawn()) && !p.equals(context.goal());
    }

    /**
     * @return floor cells with exactly one floor 4-neighbour
     */
    protected static boolean isDeadEnd(CaveGrid grid, int x, int y) {
        if (!grid.isFloor(x, y)) return false;
        int open = 0;
        if (grid.inBounds(x + 1, y) && grid.isFloor(x + 1, y)) open++;
        if (grid.inBounds(x - 1, y) && grid.isFloor(x - 1, y)) open++;
        if (grid.inBounds(x, y + 1) && grid.isFloor(x, y + 1)) open++;
        if (grid.inBounds(x, y - 1) && grid.isFloor(x, y - 1)) open++;
        return open == 1;
    }
}
