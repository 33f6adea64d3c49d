package org.spelunk.runtime.model;

import org.spelunk.runtime.Config;

import java.util.Arrays;
import java.util.Collection;

/**
 * Dense two-valued cave grid, stored row-major. Cells are {@link Config#FLOOR} or {@link Config#WALL}.
 * <p>
 * Stages treat grids as values: they copy before mutating and hand the copy downstream.
 * </p>
 */
public final class CaveGrid {

    private final int width;
    private final int height;
    private final byte[] cells;

    /**
     * Creates an all-floor grid.
     * @param width number of columns, must be positive
     * @param height number of rows, must be positive
     */
    public CaveGrid(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.cells = new byte[width * height];
    }

    private CaveGrid(int width, int height, byte[] cells) {
        this.width = width;
        this.height = height;
        this.cells = cells;
    }

    /**
     * Builds a grid from rows, where {@code rows[y][x]} is 0 (floor) or 1 (wall).
     * @param rows rectangular row data
     * @return the grid
     */
    public static CaveGrid fromRows(int[][] rows) {
        if (rows.length == 0 || rows[0].length == 0) {
            throw new IllegalArgumentException("Grid rows must not be empty");
        }
        CaveGrid grid = new CaveGrid(rows[0].length, rows.length);
        for (int y = 0; y < rows.length; y++) {
            if (rows[y].length != grid.width) {
                throw new IllegalArgumentException("Row " + y + " has length " + rows[y].length + ", expected " + grid.width);
            }
            for (int x = 0; x < grid.width; x++) {
                int v = rows[y][x];
                if (v != Config.FLOOR && v != Config.WALL) {
                    throw new IllegalArgumentException("Invalid cell value " + v + " at " + x + "," + y);
                }
                grid.set(x, y, (byte) v);
            }
        }
        return grid;
    }

    public int[][] toRows() {
        int[][] rows = new int[height][width];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                rows[y][x] = get(x, y);
            }
        }
        return rows;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int index(int x, int y) {
        return y * width + x;
    }

    public Point pointAt(int index) {
        return new Point(index % width, index / width);
    }

    public boolean inBounds(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height;
    }

    public boolean inBounds(Point p) {
        return inBounds(p.x(), p.y());
    }

    public byte get(int x, int y) {
        return cells[index(x, y)];
    }

    /**
     * Reads a cell, treating everything outside the grid as wall.
     */
    public byte getOrWall(int x, int y) {
        return inBounds(x, y) ? cells[index(x, y)] : Config.WALL;
    }

    public void set(int x, int y, byte value) {
        cells[index(x, y)] = value;
    }

    public boolean isWall(int x, int y) {
        return get(x, y) == Config.WALL;
    }

    public boolean isFloor(int x, int y) {
        return get(x, y) == Config.FLOOR;
    }

    public boolean isFloor(Point p) {
        return inBounds(p) && isFloor(p.x(), p.y());
    }

    /**
     * A cell has footing when it is floor and the cell directly below is an in-bounds wall.
     */
    public boolean hasFooting(int x, int y) {
        return inBounds(x, y) && isFloor(x, y) && y + 1 < height && isWall(x, y + 1);
    }

    public boolean hasFooting(Point p) {
        return hasFooting(p.x(), p.y());
    }

    public boolean isBorder(int x, int y) {
        return x == 0 || y == 0 || x == width - 1 || y == height - 1;
    }

    public int countFloor() {
        int count = 0;
        for (byte cell : cells) {
            if (cell == Config.FLOOR) count++;
        }
        return count;
    }

    public int countWalls() {
        return cells.length - countFloor();
    }

    public int size() {
        return cells.length;
    }

    public CaveGrid copy() {
        return new CaveGrid(width, height, cells.clone());
    }

    /**
     * Returns a copy in which every given in-bounds cell is a wall.
     */
    public CaveGrid withWalls(Collection<Point> points) {
        CaveGrid copy = copy();
        for (Point p : points) {
            if (inBounds(p)) {
                copy.set(p.x(), p.y(), Config.WALL);
            }
        }
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CaveGrid other)) return false;
        return width == other.width && height == other.height && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                sb.append(isWall(x, y) ? '#' : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
