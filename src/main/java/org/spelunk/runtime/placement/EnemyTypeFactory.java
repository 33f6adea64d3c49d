package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Enemy;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A registry of enemy types, keyed by lower-case type name. Created enemies carry the client entity
 * name as their type, e.g. {@value #LOOP_HOUND} for the registry key {@code loophound}.
 */
public class EnemyTypeFactory {

    public static final String LOOP_HOUND = "LoopHound";

    private static final Map<String, IEnemyTypeCreator> registry = new HashMap<>();

    static {
        register("loophound", (position, placementType, random) -> {
            Map<String, Object> attributes = new LinkedHashMap<>();
            attributes.put("patrolDistance", 50 + random.nextInt(450));
            attributes.put("direction", random.nextDouble() < 0.5 ? -1 : 1);
            attributes.put("speed", 10 + random.nextInt(190));
            return new Enemy(position, LOOP_HOUND, placementType, attributes);
        });
    }

    /**
     * Registers a new enemy type.
     * @param type The type name.
     * @param creator The creator for the type.
     */
    public static void register(String type, IEnemyTypeCreator creator) {
        registry.put(type.toLowerCase(Locale.ROOT), creator);
    }

    public static boolean isRegistered(String type) {
        return type != null && registry.containsKey(type.toLowerCase(Locale.ROOT));
    }

    /**
     * Creates an enemy.
     * @param type The registered type name.
     * @param position The cell the enemy stands in.
     * @param placementType Why the cell was chosen.
     * @param random The random stream for attribute rolls.
     * @return The created enemy.
     * @throws IllegalArgumentException if the type is unknown.
     */
    public static Enemy create(String type, Point position, String placementType, IRandomProvider random) {
        Objects.requireNonNull(type, "Enemy type cannot be null.");
        IEnemyTypeCreator creator = registry.get(type.toLowerCase(Locale.ROOT));
        if (creator == null) {
            throw new IllegalArgumentException("Unknown enemy type: " + type);
        }
        return creator.create(position, placementType, random);
    }
}
