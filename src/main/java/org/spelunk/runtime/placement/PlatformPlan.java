package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Platform;

import java.util.List;

/**
 * @param platforms all platforms, including any that existed before this run
 * @param initialRatio reachable floor ratio before placement
 * @param finalRatio reachable floor ratio after placement
 * @param attempts candidate platforms examined
 * @param targetMet whether the ratio target and every must-reach cell were satisfied
 */
public record PlatformPlan(List<Platform> platforms, double initialRatio, double finalRatio, int attempts,
                           boolean targetMet) {

    public PlatformPlan {
        platforms = List.copyOf(platforms);
    }
}
