package org.spelunk.runtime.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An enemy standing on a footing cell.
 *
 * @param position cell the enemy stands in
 * @param type client entity name of the enemy, e.g. {@code LoopHound}
 * @param placementType why the cell was chosen (choke point, patrol, strategic)
 * @param attributes type-specific attributes such as patrol distance or speed
 */
public record Enemy(Point position, String type, String placementType, Map<String, Object> attributes) {

    public Enemy {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }
}
