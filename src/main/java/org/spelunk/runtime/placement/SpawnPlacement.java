package org.spelunk.runtime.placement;

import org.spelunk.runtime.model.Point;

/**
 * @param position spawn cell
 * @param attempts candidates examined
 * @param fallbackUsed true when the left-side constraint had to be dropped
 */
public record SpawnPlacement(Point position, int attempts, boolean fallbackUsed) {
}
