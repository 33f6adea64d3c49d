package org.spelunk.runtime.worldgen;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Uniform noise: every cell is a wall with the same probability.
 */
public final class GridSeeder implements IGridSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(GridSeeder.class);

    /**
     * Fills a new grid cell by cell in row-major order. Each cell consumes exactly one draw and
     * becomes a wall iff the draw is below {@code initialWallRatio}.
     *
     * @param width number of columns, must be positive
     * @param height number of rows, must be positive
     * @param initialWallRatio probability of a wall, in [0, 1]
     * @param random the random stream
     * @return the seeded grid
     * @throws IllegalArgumentException if any parameter is out of range
     */
    @Override
    public CaveGrid initializeGrid(int width, int height, double initialWallRatio, IRandomProvider random) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive integers, got " + width + "x" + height);
        }
        if (Double.isNaN(initialWallRatio) || initialWallRatio < 0.0 || initialWallRatio > 1.0) {
            throw new IllegalArgumentException("initialWallRatio must be between 0 and 1, got " + initialWallRatio);
        }
        if (random == null) {
            throw new IllegalArgumentException("A random provider is required");
        }

        CaveGrid grid = new CaveGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (random.nextDouble() < initialWallRatio) {
                    grid.set(x, y, Config.WALL);
                }
            }
        }
        LOG.debug("Seeded {}x{} grid, wall ratio {} (requested {})", width, height,
            String.format(Locale.ROOT, "%.3f", wallRatio(grid)), initialWallRatio);
        return grid;
    }

    /**
     * @return the fraction of wall cells in the grid
     */
    public static double wallRatio(CaveGrid grid) {
        return (double) grid.countWalls() / grid.size();
    }
}
