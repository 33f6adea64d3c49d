package org.spelunk.runtime.worldgen;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.CaveGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Smooths seeded noise into organic cave shapes with a birth/survival rule over the Moore
 * neighbourhood. Cells outside the grid count as walls, which pulls the cave away from the edges.
 */
public final class CellularAutomaton {

    private static final Logger LOG = LoggerFactory.getLogger(CellularAutomaton.class);

    /**
     * Runs {@code steps} synchronous generations. A floor cell becomes a wall when at least
     * {@code birthThreshold} of its neighbours are walls; a wall cell stays a wall when at least
     * {@code survivalThreshold} of its neighbours are walls. Every generation reads only the
     * previous generation.
     *
     * @param grid the input grid, never modified
     * @param steps number of generations, zero or more
     * @param birthThreshold wall-neighbour count turning floor into wall, in [0, 8]
     * @param survivalThreshold wall-neighbour count keeping a wall, in [0, 8]
     * @return a new grid
     */
    public CaveGrid applyRules(CaveGrid grid, int steps, int birthThreshold, int survivalThreshold) {
        if (grid == null) {
            throw new IllegalArgumentException("grid is required");
        }
        if (steps < 0) {
            throw new IllegalArgumentException("simulationSteps must not be negative, got " + steps);
        }
        checkThreshold("birthThreshold", birthThreshold);
        checkThreshold("survivalThreshold", survivalThreshold);

        CaveGrid current = grid.copy();
        CaveGrid next = grid.copy();
        for (int step = 0; step < steps; step++) {
            for (int y = 0; y < current.getHeight(); y++) {
                for (int x = 0; x < current.getWidth(); x++) {
                    int walls = countWallNeighbours(current, x, y);
                    boolean wall = current.isWall(x, y)
                        ? walls >= survivalThreshold
                        : walls >= birthThreshold;
                    next.set(x, y, wall ? Config.WALL : Config.FLOOR);
                }
            }
            CaveGrid swap = current;
            current = next;
            next = swap;
            LOG.trace("Automaton step {} done, {} floor cells", step + 1, current.countFloor());
        }
        return current;
    }

    /**
     * Extra clean-up passes over interior cells: more than five wall neighbours makes a wall, fewer
     * than three makes floor. Border cells keep their value.
     */
    public CaveGrid microSmooth(CaveGrid grid, int passes) {
        if (passes < 0) {
            throw new IllegalArgumentException("smoothing passes must not be negative, got " + passes);
        }
        CaveGrid current = grid.copy();
        for (int pass = 0; pass < passes; pass++) {
            CaveGrid next = current.copy();
            for (int y = 1; y < current.getHeight() - 1; y++) {
                for (int x = 1; x < current.getWidth() - 1; x++) {
                    int walls = countWallNeighbours(current, x, y);
                    if (walls > 5) {
                        next.set(x, y, Config.WALL);
                    } else if (walls < 3) {
                        next.set(x, y, Config.FLOOR);
                    }
                }
            }
            current = next;
        }
        return current;
    }

    /**
     * @return a copy whose outermost ring of cells is wall
     */
    public CaveGrid sealBorder(CaveGrid grid) {
        CaveGrid sealed = grid.copy();
        int w = sealed.getWidth();
        int h = sealed.getHeight();
        for (int x = 0; x < w; x++) {
            sealed.set(x, 0, Config.WALL);
            sealed.set(x, h - 1, Config.WALL);
        }
        for (int y = 0; y < h; y++) {
            sealed.set(0, y, Config.WALL);
            sealed.set(w - 1, y, Config.WALL);
        }
        return sealed;
    }

    static int countWallNeighbours(CaveGrid grid, int x, int y) {
        int count = 0;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if (dx == 0 && dy == 0) continue;
                if (grid.getOrWall(x + dx, y + dy) == Config.WALL) {
                    count++;
                }
            }
        }
        return count;
    }

    private static void checkThreshold(String name, int value) {
        if (value < 0 || value > Config.MOORE_NEIGHBOURS) {
            throw new IllegalArgumentException(name + " must be between 0 and 8, got " + value);
        }
    }
}
