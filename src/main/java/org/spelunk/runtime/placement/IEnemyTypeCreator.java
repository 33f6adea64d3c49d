package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Enemy;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;

/**
 * Creates an enemy of one type, rolling its type-specific attributes.
 */
@FunctionalInterface
public interface IEnemyTypeCreator {
    /**
     * @param position the cell the enemy stands in
     * @param placementType why the cell was chosen
     * @param random stream for attribute rolls
     * @return the enemy
     */
    Enemy create(Point position, String placementType, IRandomProvider random);
}
