package org.spelunk.runtime.worldgen;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Seeds caves around a small random graph. Between two and six main points are drawn; each one is
 * joined by a corridor to its one or two nearest neighbours, and a round room is opened around every
 * main point. Every cell then gets a floor probability (room, corridor or background) and one draw
 * decides whether it becomes a wall.
 * <p>
 * The configured wall ratio is ignored: density follows from the thresholds.
 * </p>
 */
public final class GraphGridSeeder implements IGridSeeder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphGridSeeder.class);

    static final int MIN_MAIN_POINTS = 2;
    static final int MAX_MAIN_POINTS = 6;
    /** Main points keep this distance to the grid edge. */
    static final int MARGIN = 3;
    private static final double ROOM_THRESHOLD = 1.0;

    /**
     * A corridor between two main points.
     */
    public record Corridor(Point from, Point to) {

        boolean joins(Point a, Point b) {
            return (from.equals(a) && to.equals(b)) || (from.equals(b) && to.equals(a));
        }
    }

    /**
     * The graph and the per-cell floor probabilities derived from it.
     *
     * @param width grid width
     * @param height grid height
     * @param thresholds floor probability per cell, row-major
     * @param mainPoints the drawn main points, in draw order
     * @param corridors the distinct corridors, in carving order
     */
    public record Layout(int width, int height, double[] thresholds, List<Point> mainPoints, List<Corridor> corridors) {

        public double threshold(int x, int y) {
            return thresholds[y * width + x];
        }
    }

    private final int corridorHeight;
    private final double corridorThreshold;
    private final double nonCorridorThreshold;
    private final int roomRadius;

    /**
     * @param corridorHeight rows a corridor spans below its centre line
     * @param corridorThreshold floor probability of corridor cells
     * @param nonCorridorThreshold floor probability of all other cells outside rooms
     * @param roomRadius radius of the fully open room around each main point, 0 for none
     */
    public GraphGridSeeder(int corridorHeight, double corridorThreshold, double nonCorridorThreshold, int roomRadius) {
        if (corridorHeight <= 0) {
            throw new IllegalArgumentException("corridorHeight must be positive, got " + corridorHeight);
        }
        if (corridorThreshold < 0.0 || corridorThreshold > 1.0) {
            throw new IllegalArgumentException("corridorThreshold must be between 0 and 1, got " + corridorThreshold);
        }
        if (nonCorridorThreshold < 0.0 || nonCorridorThreshold > 1.0) {
            throw new IllegalArgumentException("nonCorridorThreshold must be between 0 and 1, got " + nonCorridorThreshold);
        }
        if (roomRadius < 0) {
            throw new IllegalArgumentException("roomRadius must not be negative, got " + roomRadius);
        }
        this.corridorHeight = corridorHeight;
        this.corridorThreshold = corridorThreshold;
        this.nonCorridorThreshold = nonCorridorThreshold;
        this.roomRadius = roomRadius;
    }

    /**
     * Builds the layout, then draws one value per cell in row-major order; a cell is floor iff the draw
     * is below its threshold.
     */
    @Override
    public CaveGrid initializeGrid(int width, int height, double initialWallRatio, IRandomProvider random) {
        Layout layout = layout(width, height, random);
        CaveGrid grid = new CaveGrid(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                if (random.nextDouble() >= layout.threshold(x, y)) {
                    grid.set(x, y, Config.WALL);
                }
            }
        }
        LOG.debug("Graph-seeded {}x{} grid from {} main points and {} corridors, wall ratio {}", width, height,
            layout.mainPoints().size(), layout.corridors().size(),
            String.format(Locale.ROOT, "%.3f", GridSeeder.wallRatio(grid)));
        return grid;
    }

    /**
     * Draws the main points and carves corridors and rooms into the threshold map.
     *
     * @throws IllegalArgumentException if the grid cannot hold main points inside the margin
     */
    public Layout layout(int width, int height, IRandomProvider random) {
        if (width < 2 * MARGIN + 1 || height < 2 * MARGIN + 1) {
            throw new IllegalArgumentException("Graph seeding needs at least " + (2 * MARGIN + 1) + " cells per side, got "
                + width + "x" + height);
        }
        if (random == null) {
            throw new IllegalArgumentException("A random provider is required");
        }
        double[] thresholds = new double[width * height];
        Arrays.fill(thresholds, nonCorridorThreshold);

        int count = MIN_MAIN_POINTS + random.nextInt(MAX_MAIN_POINTS - MIN_MAIN_POINTS + 1);
        List<Point> mainPoints = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            int x = MARGIN + random.nextInt(width - 2 * MARGIN + 1);
            int y = MARGIN + random.nextInt(height - 2 * MARGIN + 1);
            mainPoints.add(new Point(x, y));
        }

        List<Corridor> corridors = new ArrayList<>();
        for (int i = 0; i < mainPoints.size(); i++) {
            Point point = mainPoints.get(i);
            int k = 1 + random.nextInt(2);
            for (Point neighbour : closest(mainPoints, i, k)) {
                carveCorridor(thresholds, width, height, point, neighbour);
                if (corridors.stream().noneMatch(c -> c.joins(point, neighbour))) {
                    corridors.add(new Corridor(point, neighbour));
                }
            }
        }

        int r2 = roomRadius * roomRadius;
        for (Point p : mainPoints) {
            for (int dy = -roomRadius; dy <= roomRadius; dy++) {
                for (int dx = -roomRadius; dx <= roomRadius; dx++) {
                    int x = p.x() + dx;
                    int y = p.y() + dy;
                    if (dx * dx + dy * dy > r2 || x < 0 || x >= width || y < 0 || y >= height) continue;
                    thresholds[y * width + x] = ROOM_THRESHOLD;
                }
            }
        }
        return new Layout(width, height, thresholds, List.copyOf(mainPoints), List.copyOf(corridors));
    }

    /**
     * @return the {@code k} main points nearest to {@code mainPoints[index]}, nearest first, ties by index
     */
    static List<Point> closest(List<Point> mainPoints, int index, int k) {
        Point origin = mainPoints.get(index);
        List<Point> others = new ArrayList<>(mainPoints.size() - 1);
        for (int i = 0; i < mainPoints.size(); i++) {
            if (i != index) others.add(mainPoints.get(i));
        }
        others.sort(Comparator.comparingDouble(origin::distance));
        return others.subList(0, Math.min(k, others.size()));
    }

    /**
     * Walks the straight line between the points and marks every cell touched by the band of
     * {@code corridorHeight} rows starting at the line.
     */
    private void carveCorridor(double[] thresholds, int width, int height, Point a, Point b) {
        int steps = Math.max(Math.abs(b.x() - a.x()), Math.abs(b.y() - a.y())) + 1;
        for (int step = 0; step <= steps; step++) {
            double alpha = (double) step / steps;
            double cx = a.x() * alpha + b.x() * (1 - alpha);
            double cy = a.y() * alpha + b.y() * (1 - alpha);
            int x0 = (int) Math.floor(cx);
            int x1 = (int) Math.ceil(cx);
            for (int d = 0; d < corridorHeight; d++) {
                int y0 = (int) Math.floor(cy + d);
                int y1 = (int) Math.ceil(cy + d);
                mark(thresholds, width, height, x0, y0);
                mark(thresholds, width, height, x1, y0);
                mark(thresholds, width, height, x0, y1);
                mark(thresholds, width, height, x1, y1);
            }
        }
    }

    private void mark(double[] thresholds, int width, int height, int x, int y) {
        if (x >= 0 && x < width && y >= 0 && y < height) {
            thresholds[y * width + x] = corridorThreshold;
        }
    }
}
