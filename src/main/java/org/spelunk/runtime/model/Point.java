package org.spelunk.runtime.model;

/**
 * A cell coordinate. {@code x} is the column, {@code y} the row; rows grow downward.
 *
 * @param x column index
 * @param y row index
 */
public record Point(int x, int y) {

    public int manhattanDistance(Point other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    public double distance(Point other) {
        int dx = x - other.x;
        int dy = y - other.y;
        return Math.sqrt((double) dx * dx + (double) dy * dy);
    }

    public Point offset(int dx, int dy) {
        return new Point(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
