package org.spelunk.runtime.model;

/**
 * Inclusive axis-aligned bounding box of a set of cells.
 */
public record Bounds(int minX, int minY, int maxX, int maxY) {

    public static Bounds of(Point p) {
        return new Bounds(p.x(), p.y(), p.x(), p.y());
    }

    public Bounds include(int x, int y) {
        return new Bounds(Math.min(minX, x), Math.min(minY, y), Math.max(maxX, x), Math.max(maxY, y));
    }

    public int width() {
        return maxX - minX + 1;
    }

    public int height() {
        return maxY - minY + 1;
    }
}
