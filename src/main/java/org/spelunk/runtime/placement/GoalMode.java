package org.spelunk.runtime.placement;

import java.util.Locale;

/**
 * When the goal is placed relative to platform placement.
 */
public enum GoalMode {
    /** The goal must not be reachable by walking; platforms are then placed until it is reachable. */
    BEFORE_PLATFORMS,
    /** The goal is chosen among cells already reachable with the placed platforms. */
    AFTER_PLATFORMS;

    /**
     * Parses "before-platforms" / "after-platforms" (case-insensitive, '-' or '_').
     */
    public static GoalMode parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown goal mode: " + value, e);
        }
    }
}
