package org.spelunk.runtime.worldgen;

import java.util.Locale;

/**
 * Which seeder shapes the initial noise.
 */
public enum SeederMode {
    /** Uniform noise at the configured wall ratio. */
    NOISE,
    /** Open rooms around random main points, joined by corridors. */
    GRAPH;

    /**
     * Parses "noise" / "graph" (case-insensitive).
     */
    public static SeederMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown seeder: " + value, e);
        }
    }
}
