package org.spelunk.runtime.model;

import java.util.List;

/**
 * A complete, validated level: terrain plus every placed entity.
 */
public record LevelLayout(
    String seed,
    CaveGrid grid,
    Point spawn,
    Point goal,
    List<Point> coins,
    List<Platform> platforms,
    List<Enemy> enemies
) {

    public LevelLayout {
        coins = List.copyOf(coins);
        platforms = List.copyOf(platforms);
        enemies = List.copyOf(enemies);
    }

    /**
     * @return the grid with every platform cell stamped as wall
     */
    public CaveGrid collisionGrid() {
        return grid.withWalls(platforms.stream().flatMap(p -> p.cells().stream()).toList());
    }
}
