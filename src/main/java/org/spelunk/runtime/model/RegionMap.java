package org.spelunk.runtime.model;

import org.spelunk.runtime.Config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of region detection: a label grid plus metadata per label.
 * Wall cells carry {@link Config#WALL_LABEL}; every floor cell carries exactly one region label.
 */
public final class RegionMap {

    private final int width;
    private final int height;
    private final int[] labels;
    private final Map<Integer, Region> regions;

    public RegionMap(int width, int height, int[] labels, Map<Integer, Region> regions) {
        this.width = width;
        this.height = height;
        this.labels = labels;
        this.regions = Collections.unmodifiableMap(new LinkedHashMap<>(regions));
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int labelAt(int x, int y) {
        return labels[y * width + x];
    }

    /**
     * @return regions keyed by label, in label order
     */
    public Map<Integer, Region> getRegions() {
        return regions;
    }

    public int regionCount() {
        return regions.size();
    }

    public int totalArea() {
        return regions.values().stream().mapToInt(Region::area).sum();
    }

    /**
     * @return the region with the largest area; the lowest label wins ties
     */
    public Region largestRegion() {
        return regions.values().stream()
            .max(Comparator.comparingInt(Region::area).thenComparing(r -> -r.label()))
            .orElseThrow(() -> new IllegalStateException("Region map has no regions"));
    }

    /**
     * @return the cells of the given region in row-major order
     */
    public List<Point> pointsOf(int label) {
        Region region = regions.get(label);
        if (region == null) {
            throw new IllegalArgumentException("Unknown region label: " + label);
        }
        Bounds b = region.bounds();
        List<Point> points = new ArrayList<>(region.area());
        for (int y = b.minY(); y <= b.maxY(); y++) {
            for (int x = b.minX(); x <= b.maxX(); x++) {
                if (labelAt(x, y) == label) {
                    points.add(new Point(x, y));
                }
            }
        }
        return points;
    }
}
