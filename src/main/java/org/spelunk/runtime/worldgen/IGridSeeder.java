package org.spelunk.runtime.worldgen;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.spi.IRandomProvider;

/**
 * Produces the initial wall/floor pattern that the cellular automaton smooths into caves.
 */
public interface IGridSeeder {

    /**
     * @param width number of columns, must be positive
     * @param height number of rows, must be positive
     * @param initialWallRatio requested fraction of walls, in [0, 1]; seeders with their own density model may ignore it
     * @param random the random stream
     * @return a new grid
     * @throws IllegalArgumentException if any parameter is out of range
     */
    CaveGrid initializeGrid(int width, int height, double initialWallRatio, IRandomProvider random);
}
