package org.spelunk.runtime.model;

/**
 * A maximal 4-connected set of floor cells.
 *
 * @param label unique label, starting at {@code Config.FIRST_REGION_LABEL}
 * @param area number of cells
 * @param bounds inclusive bounding box
 */
public record Region(int label, int area, Bounds bounds) {
}
