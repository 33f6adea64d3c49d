package org.spelunk.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * A horizontal platform occupying {@code width} cells starting at {@code (x, y)}.
 * For collision purposes platform cells behave like walls.
 */
public record Platform(int x, int y, int width, int height, PlatformType type) {

    public Platform {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Platform size must be positive: " + width + "x" + height);
        }
    }

    public List<Point> cells() {
        List<Point> cells = new ArrayList<>(width * height);
        for (int dy = 0; dy < height; dy++) {
            for (int dx = 0; dx < width; dx++) {
                cells.add(new Point(x + dx, y + dy));
            }
        }
        return cells;
    }

    public boolean occupies(Point p) {
        return p.x() >= x && p.x() < x + width && p.y() >= y && p.y() < y + height;
    }
}
