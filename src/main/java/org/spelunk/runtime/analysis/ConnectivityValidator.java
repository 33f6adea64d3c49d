package org.spelunk.runtime.analysis;

import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Region;
import org.spelunk.runtime.model.RegionMap;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Decides whether a cave is connected and, if not, retries corridor carving within an attempt and
 * time budget.
 */
public final class ConnectivityValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ConnectivityValidator.class);

    private final double minConnectivityScore;
    private final int maxFallbackAttempts;
    private final long fallbackTimeoutMs;
    private final RegionDetector regionDetector;
    private final CorridorCarver corridorCarver;
    private final LongSupplier clock;

    public ConnectivityValidator(double minConnectivityScore, int maxFallbackAttempts, long fallbackTimeoutMs) {
        this(minConnectivityScore, maxFallbackAttempts, fallbackTimeoutMs,
            new RegionDetector(), new CorridorCarver(), System::currentTimeMillis);
    }

    /**
     * @param clock millisecond clock used for the fallback deadline
     */
    public ConnectivityValidator(double minConnectivityScore, int maxFallbackAttempts, long fallbackTimeoutMs,
                                 RegionDetector regionDetector, CorridorCarver corridorCarver, LongSupplier clock) {
        if (Double.isNaN(minConnectivityScore) || minConnectivityScore < 0.0 || minConnectivityScore > 1.0) {
            throw new IllegalArgumentException("minConnectivityScore must be between 0 and 1, got " + minConnectivityScore);
        }
        if (maxFallbackAttempts < 0) {
            throw new IllegalArgumentException("maxFallbackAttempts must not be negative, got " + maxFallbackAttempts);
        }
        if (fallbackTimeoutMs <= 0) {
            throw new IllegalArgumentException("fallbackTimeoutMs must be positive, got " + fallbackTimeoutMs);
        }
        this.minConnectivityScore = minConnectivityScore;
        this.maxFallbackAttempts = maxFallbackAttempts;
        this.fallbackTimeoutMs = fallbackTimeoutMs;
        this.regionDetector = regionDetector;
        this.corridorCarver = corridorCarver;
        this.clock = clock;
    }

    /**
     * Connected iff the grid has floor and either has at most one region or its score reaches the
     * configured threshold.
     */
    public ConnectivityReport validate(CaveGrid grid) {
        return report(regionDetector.detectRegions(grid));
    }

    ConnectivityReport report(RegionMap regionMap) {
        int floor = regionMap.totalArea();
        if (floor == 0) {
            return new ConnectivityReport(false, 0.0, 0, 0, 0, List.of());
        }
        List<Integer> sizes = regionMap.getRegions().values().stream()
            .map(Region::area)
            .sorted(Comparator.reverseOrder())
            .toList();
        int largest = sizes.get(0);
        double score = (double) largest / floor;
        boolean connected = sizes.size() <= 1 || score >= minConnectivityScore;
        return new ConnectivityReport(connected, score, sizes.size(), floor, largest, sizes);
    }

    /**
     * Validates the grid and, if it is not connected, re-detects regions and carves corridors until it
     * is, the attempts run out or the timeout expires. The deadline is checked before each attempt.
     *
     * @param grid the grid to connect, never modified
     * @param random stream for corridor orientation
     * @return the structured outcome, whose grid never aliases the input
     * @throws IllegalStateException if the grid has no floor cells at all
     */
    public ConnectivityResult validateWithFallback(CaveGrid grid, IRandomProvider random) {
        long start = clock.getAsLong();
        ConnectivityReport initial = validate(grid);
        if (initial.connected()) {
            return new ConnectivityResult(true, ConnectivityResult.Outcome.ALREADY_CONNECTED, grid.copy(), 0,
                clock.getAsLong() - start, initial, initial, null);
        }
        if (initial.floorTiles() == 0) {
            throw new IllegalStateException("Cannot connect a grid without floor cells");
        }
        LOG.debug("Grid not connected ({} regions, score {}), starting fallback", initial.regionCount(), initial.score());

        CaveGrid current = grid;
        ConnectivityReport report = initial;
        int attempts = 0;
        while (attempts < maxFallbackAttempts) {
            if (clock.getAsLong() - start >= fallbackTimeoutMs) {
                String error = "Fallback operation timed out after " + attempts + " attempts";
                LOG.warn(error);
                return new ConnectivityResult(false, ConnectivityResult.Outcome.TIMED_OUT, current, attempts,
                    clock.getAsLong() - start, initial, report, error);
            }
            attempts++;
            RegionMap regions = regionDetector.detectRegions(current);
            current = corridorCarver.carveCorridors(current, regions, random);
            report = validate(current);
            LOG.debug("Fallback attempt {}: {} regions, score {}", attempts, report.regionCount(), report.score());
            if (report.connected()) {
                return new ConnectivityResult(true, ConnectivityResult.Outcome.CONNECTED_AFTER_FALLBACK, current,
                    attempts, clock.getAsLong() - start, initial, report, null);
            }
        }
        String error = "Failed to connect regions after " + attempts + " fallback attempts";
        LOG.warn(error);
        return new ConnectivityResult(false, ConnectivityResult.Outcome.ATTEMPTS_EXHAUSTED, current, attempts,
            clock.getAsLong() - start, initial, report, error);
    }
}
