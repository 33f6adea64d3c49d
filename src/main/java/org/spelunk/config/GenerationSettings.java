package org.spelunk.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.spelunk.runtime.analysis.JumpPhysics;
import org.spelunk.runtime.placement.EnemyTypeFactory;
import org.spelunk.runtime.placement.GoalMode;
import org.spelunk.runtime.worldgen.SeederMode;

/**
 * Typed, validated view of the {@code spelunk} configuration block. Every value is checked when the
 * settings are built, so a bad configuration fails before any generation work starts.
 */
public record GenerationSettings(
    SeedSettings seed,
    SeederSettings seeder,
    AutomatonSettings automaton,
    ConnectivitySettings connectivity,
    JumpPhysics physics,
    SpawnSettings spawn,
    GoalSettings goal,
    PlatformSettings platforms,
    CoinSettings coins,
    EnemySettings enemies,
    QualitySettings quality
) {

    private static final String ROOT = "spelunk";

    public record SeedSettings(String seed, int width, int height, double initialWallRatio) {
    }

    public record SeederSettings(SeederMode mode, int corridorHeight, double corridorThreshold,
                                 double nonCorridorThreshold, int roomRadius) {
    }

    public record AutomatonSettings(int simulationSteps, int birthThreshold, int survivalThreshold,
                                    int smoothingPasses, boolean sealBorder, boolean refine) {
    }

    public record ConnectivitySettings(double minConnectivityScore, int maxFallbackAttempts, long fallbackTimeoutMs) {
    }

    public record SpawnSettings(int maxAttempts, int safetyRadius, double leftSideBoundary, boolean allowFallback) {
    }

    public record GoalSettings(GoalMode mode, double minDistance, double rightSideBoundary, int candidatePool) {
    }

    public record PlatformSettings(double targetReachability, int maxPlatforms, int maxAttempts, int minSize,
                                   int maxSize, double floatingProbability, double maxVisualImpact,
                                   int proposalsPerRingTile) {
    }

    public record CoinSettings(int count, double deadEndWeight, double explorationWeight, double unreachableWeight,
                               double minDistance, boolean reachableOnly, double minReachableRatio) {
    }

    public record EnemySettings(String type, int maxEnemies, double density, double minDistanceFromSpawn,
                                double minDistanceFromGoal, int minPatrolLength, int maxPatrolLength,
                                int strategicDistance, boolean preserveSolvability) {
    }

    public record QualitySettings(double minFloorRatio, double maxFloorRatio, int minConnectedFloorTiles,
                                  int maxIsolatedRegions, double minAverageRegionSize, int maxWallIslands) {
    }

    /**
     * @return settings built from reference.conf alone
     */
    public static GenerationSettings defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * Builds and validates settings from a configuration containing the {@code spelunk} block.
     *
     * @throws IllegalArgumentException naming the offending key if a value is missing or out of range
     */
    public static GenerationSettings fromConfig(Config root) {
        try {
            Config c = root.getConfig(ROOT);
            Config gen = c.getConfig("generation");
            SeedSettings seed = new SeedSettings(
                gen.getString("seed"),
                intIn(gen, "generation.width", "width", 10, 1000),
                intIn(gen, "generation.height", "height", 10, 1000),
                doubleIn(gen, "generation.initial-wall-ratio", "initial-wall-ratio", 0.0, 1.0));
            if (seed.seed().isBlank()) {
                throw new IllegalArgumentException("spelunk.generation.seed must not be blank");
            }
            Config graph = gen.getConfig("graph");
            SeederSettings seeder = new SeederSettings(
                SeederMode.parse(gen.getString("seeder")),
                intIn(graph, "generation.graph.corridor-height", "corridor-height", 1, 100),
                doubleIn(graph, "generation.graph.corridor-threshold", "corridor-threshold", 0.0, 1.0),
                doubleIn(graph, "generation.graph.non-corridor-threshold", "non-corridor-threshold", 0.0, 1.0),
                intIn(graph, "generation.graph.room-radius", "room-radius", 0, 100));
            AutomatonSettings automaton = new AutomatonSettings(
                intIn(gen, "generation.simulation-steps", "simulation-steps", 0, 20),
                intIn(gen, "generation.birth-threshold", "birth-threshold", 0, 8),
                intIn(gen, "generation.survival-threshold", "survival-threshold", 0, 8),
                intIn(gen, "generation.smoothing-passes", "smoothing-passes", 0, 10),
                gen.getBoolean("seal-border"),
                gen.getBoolean("refine"));

            Config con = c.getConfig("connectivity");
            ConnectivitySettings connectivity = new ConnectivitySettings(
                doubleIn(con, "connectivity.min-connectivity-score", "min-connectivity-score", 0.0, 1.0),
                intIn(con, "connectivity.max-fallback-attempts", "max-fallback-attempts", 0, 100),
                longIn(con, "connectivity.fallback-timeout-ms", "fallback-timeout-ms", 1, 600_000));

            Config phy = c.getConfig("physics");
            JumpPhysics physics = new JumpPhysics(
                doubleIn(phy, "physics.jump-height", "jump-height", 1.0, 10_000.0),
                doubleIn(phy, "physics.gravity", "gravity", 1.0, 100_000.0),
                doubleIn(phy, "physics.run-speed", "run-speed", 1.0, 10_000.0),
                intIn(phy, "physics.tile-size", "tile-size", 1, 1024));

            Config sp = c.getConfig("spawn");
            SpawnSettings spawn = new SpawnSettings(
                intIn(sp, "spawn.max-attempts", "max-attempts", 1, 100_000),
                intIn(sp, "spawn.safety-radius", "safety-radius", 0, 10),
                doubleIn(sp, "spawn.left-side-boundary", "left-side-boundary", 0.01, 1.0),
                sp.getBoolean("allow-fallback"));

            Config go = c.getConfig("goal");
            GoalSettings goal = new GoalSettings(
                GoalMode.parse(go.getString("mode")),
                doubleIn(go, "goal.min-distance", "min-distance", 0.0, 10_000.0),
                doubleIn(go, "goal.right-side-boundary", "right-side-boundary", 0.0, 0.99),
                intIn(go, "goal.candidate-pool", "candidate-pool", 1, 10_000));

            Config pl = c.getConfig("platforms");
            PlatformSettings platforms = new PlatformSettings(
                doubleIn(pl, "platforms.target-reachability", "target-reachability", 0.0, 1.0),
                intIn(pl, "platforms.max-platforms", "max-platforms", 0, 10_000),
                intIn(pl, "platforms.max-attempts", "max-attempts", 0, 1_000_000),
                intIn(pl, "platforms.min-size", "min-size", 1, 100),
                intIn(pl, "platforms.max-size", "max-size", 1, 100),
                doubleIn(pl, "platforms.floating-probability", "floating-probability", 0.0, 1.0),
                doubleIn(pl, "platforms.max-visual-impact", "max-visual-impact", 0.0, 1.0),
                intIn(pl, "platforms.proposals-per-ring-tile", "proposals-per-ring-tile", 1, 1000));
            if (platforms.maxSize() < platforms.minSize()) {
                throw new IllegalArgumentException("spelunk.platforms.max-size must not be smaller than min-size");
            }

            Config co = c.getConfig("coins");
            CoinSettings coins = new CoinSettings(
                intIn(co, "coins.count", "count", 0, 10_000),
                doubleIn(co, "coins.dead-end-weight", "dead-end-weight", 0.0, 1.0),
                doubleIn(co, "coins.exploration-weight", "exploration-weight", 0.0, 1.0),
                doubleIn(co, "coins.unreachable-weight", "unreachable-weight", 0.0, 1.0),
                doubleIn(co, "coins.min-distance", "min-distance", 0.0, 1000.0),
                co.getBoolean("reachable-only"),
                doubleIn(co, "coins.min-reachable-ratio", "min-reachable-ratio", 0.0, 1.0));
            double weightSum = coins.deadEndWeight() + coins.explorationWeight() + coins.unreachableWeight();
            if (Math.abs(weightSum - 1.0) > 0.001) {
                throw new IllegalArgumentException("spelunk.coins weights must sum to 1.0, got " + weightSum);
            }

            Config en = c.getConfig("enemies");
            EnemySettings enemies = new EnemySettings(
                en.getString("type"),
                intIn(en, "enemies.max-enemies", "max-enemies", 0, 10_000),
                doubleIn(en, "enemies.density", "density", 0.0, 1.0),
                doubleIn(en, "enemies.min-distance-from-spawn", "min-distance-from-spawn", 0.0, 10_000.0),
                doubleIn(en, "enemies.min-distance-from-goal", "min-distance-from-goal", 0.0, 10_000.0),
                intIn(en, "enemies.min-patrol-length", "min-patrol-length", 1, 1000),
                intIn(en, "enemies.max-patrol-length", "max-patrol-length", 1, 1000),
                intIn(en, "enemies.strategic-distance", "strategic-distance", 0, 1000),
                en.getBoolean("preserve-solvability"));
            if (!EnemyTypeFactory.isRegistered(enemies.type())) {
                throw new IllegalArgumentException("spelunk.enemies.type is not a known enemy type: " + enemies.type());
            }
            if (enemies.maxPatrolLength() < enemies.minPatrolLength()) {
                throw new IllegalArgumentException("spelunk.enemies.max-patrol-length must not be smaller than min-patrol-length");
            }

            Config qa = c.getConfig("quality");
            QualitySettings quality = new QualitySettings(
                doubleIn(qa, "quality.min-floor-ratio", "min-floor-ratio", 0.0, 1.0),
                doubleIn(qa, "quality.max-floor-ratio", "max-floor-ratio", 0.0, 1.0),
                intIn(qa, "quality.min-connected-floor-tiles", "min-connected-floor-tiles", 0, 1_000_000),
                intIn(qa, "quality.max-isolated-regions", "max-isolated-regions", 0, 1_000_000),
                doubleIn(qa, "quality.min-average-region-size", "min-average-region-size", 0.0, 1_000_000.0),
                intIn(qa, "quality.max-wall-islands", "max-wall-islands", 0, 1_000_000));
            if (quality.minFloorRatio() >= quality.maxFloorRatio()) {
                throw new IllegalArgumentException("spelunk.quality.min-floor-ratio must be below max-floor-ratio");
            }

            return new GenerationSettings(seed, seeder, automaton, connectivity, physics, spawn, goal, platforms, coins,
                enemies, quality);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid spelunk configuration: " + e.getMessage(), e);
        }
    }

    public GenerationSettings withSeed(String newSeed) {
        if (newSeed == null || newSeed.isBlank()) {
            throw new IllegalArgumentException("seed must not be blank");
        }
        return new GenerationSettings(new SeedSettings(newSeed, seed.width(), seed.height(), seed.initialWallRatio()),
            seeder, automaton, connectivity, physics, spawn, goal, platforms, coins, enemies, quality);
    }

    public GenerationSettings withSize(int width, int height) {
        if (width < 10 || height < 10 || width > 1000 || height > 1000) {
            throw new IllegalArgumentException("width and height must be between 10 and 1000, got " + width + "x" + height);
        }
        return new GenerationSettings(new SeedSettings(seed.seed(), width, height, seed.initialWallRatio()),
            seeder, automaton, connectivity, physics, spawn, goal, platforms, coins, enemies, quality);
    }

    private static int intIn(Config c, String key, String path, int min, int max) {
        int value = c.getInt(path);
        if (value < min || value > max) {
            throw new IllegalArgumentException(ROOT + "." + key + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    private static long longIn(Config c, String key, String path, long min, long max) {
        long value = c.getLong(path);
        if (value < min || value > max) {
            throw new IllegalArgumentException(ROOT + "." + key + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    private static double doubleIn(Config c, String key, String path, double min, double max) {
        double value = c.getDouble(path);
        if (Double.isNaN(value) || value < min || value > max) {
            throw new IllegalArgumentException(ROOT + "." + key + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }
}
