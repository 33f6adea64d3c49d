package org.spelunk.runtime;

import org.spelunk.config.GenerationSettings;
import org.spelunk.runtime.analysis.CaveQualityReport;
import org.spelunk.runtime.analysis.CaveQualityValidator;
import org.spelunk.runtime.analysis.ConnectivityResult;
import org.spelunk.runtime.analysis.ConnectivityValidator;
import org.spelunk.runtime.analysis.PhysicsAwareReachabilityAnalyzer;
import org.spelunk.runtime.analysis.SolvabilityReport;
import org.spelunk.runtime.analysis.SolvabilityTester;
import org.spelunk.runtime.internal.services.SeededRandomProvider;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Enemy;
import org.spelunk.runtime.model.LevelLayout;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.placement.AbstractCoinPlacer;
import org.spelunk.runtime.placement.CoinDistributor;
import org.spelunk.runtime.placement.CoinPlacement;
import org.spelunk.runtime.placement.EnemyPlacementAnalyzer;
import org.spelunk.runtime.placement.GoalMode;
import org.spelunk.runtime.placement.GoalPlacement;
import org.spelunk.runtime.placement.GoalPlacer;
import org.spelunk.runtime.placement.PlacementContext;
import org.spelunk.runtime.placement.PlacementResult;
import org.spelunk.runtime.placement.PlatformPlan;
import org.spelunk.runtime.placement.PlayerSpawnPlacer;
import org.spelunk.runtime.placement.ReachableCoinPlacer;
import org.spelunk.runtime.placement.SpawnPlacement;
import org.spelunk.runtime.placement.StrategicEnemyPlacer;
import org.spelunk.runtime.placement.StrategicPlatformPlacer;
import org.spelunk.runtime.spi.IRandomProvider;
import org.spelunk.runtime.worldgen.CaveRefiner;
import org.spelunk.runtime.worldgen.CellularAutomaton;
import org.spelunk.runtime.worldgen.GraphGridSeeder;
import org.spelunk.runtime.worldgen.GridSeeder;
import org.spelunk.runtime.worldgen.IGridSeeder;
import org.spelunk.runtime.worldgen.SeederMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the full generation pipeline: terrain, connectivity, refinement, entity placement and a final
 * solvability check.
 * <p>
 * Every stage draws from its own random sub-stream derived from the level seed, so a seed always
 * produces the same level and changes to one stage's consumption leave the others untouched.
 * </p>
 */
public final class LevelGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(LevelGenerator.class);

    private final GenerationSettings settings;
    private final IGenerationListener listener;

    private final IGridSeeder seeder;
    private final CellularAutomaton automaton = new CellularAutomaton();
    private final CaveRefiner refiner = new CaveRefiner();
    private final ConnectivityValidator connectivityValidator;
    private final PhysicsAwareReachabilityAnalyzer analyzer;
    private final PlayerSpawnPlacer spawnPlacer;
    private final GoalPlacer goalPlacer;
    private final StrategicPlatformPlacer platformPlacer;
    private final AbstractCoinPlacer coinPlacer;
    private final StrategicEnemyPlacer enemyPlacer;
    private final CaveQualityValidator qualityValidator;
    private final SolvabilityTester solvabilityTester;

    public LevelGenerator(GenerationSettings settings) {
        this(settings, IGenerationListener.NONE);
    }

    public LevelGenerator(GenerationSettings settings, IGenerationListener listener) {
        if (settings == null || listener == null) {
            throw new IllegalArgumentException("settings and listener are required");
        }
        this.settings = settings;
        this.listener = listener;

        GenerationSettings.SeederSettings se = settings.seeder();
        this.seeder = se.mode() == SeederMode.GRAPH
            ? new GraphGridSeeder(se.corridorHeight(), se.corridorThreshold(), se.nonCorridorThreshold(), se.roomRadius())
            : new GridSeeder();

        GenerationSettings.ConnectivitySettings con = settings.connectivity();
        this.connectivityValidator = new ConnectivityValidator(con.minConnectivityScore(), con.maxFallbackAttempts(),
            con.fallbackTimeoutMs());
        this.analyzer = new PhysicsAwareReachabilityAnalyzer(settings.physics());

        GenerationSettings.SpawnSettings sp = settings.spawn();
        this.spawnPlacer = new PlayerSpawnPlacer(sp.maxAttempts(), sp.safetyRadius(), sp.leftSideBoundary(), sp.allowFallback());

        GenerationSettings.GoalSettings go = settings.goal();
        this.goalPlacer = new GoalPlacer(go.mode(), go.minDistance(), go.rightSideBoundary(), go.candidatePool());

        GenerationSettings.PlatformSettings pl = settings.platforms();
        this.platformPlacer = new StrategicPlatformPlacer(pl.targetReachability(), pl.maxPlatforms(), pl.maxAttempts(),
            pl.minSize(), pl.maxSize(), pl.floatingProbability(), pl.maxVisualImpact(), pl.proposalsPerRingTile());

        GenerationSettings.CoinSettings co = settings.coins();
        this.coinPlacer = co.reachableOnly()
            ? new ReachableCoinPlacer(co.count(), co.deadEndWeight(), co.explorationWeight(), co.unreachableWeight(),
                co.minDistance(), co.minReachableRatio())
            : new CoinDistributor(co.count(), co.deadEndWeight(), co.explorationWeight(), co.unreachableWeight(),
                co.minDistance());

        GenerationSettings.EnemySettings en = settings.enemies();
        this.enemyPlacer = new StrategicEnemyPlacer(en.type(), en.maxEnemies(), en.density(), en.minDistanceFromSpawn(),
            en.minDistanceFromGoal(), en.preserveSolvability(),
            new EnemyPlacementAnalyzer(en.minPatrolLength(), en.maxPatrolLength(), en.strategicDistance()));

        GenerationSettings.QualitySettings qa = settings.quality();
        this.qualityValidator = new CaveQualityValidator(qa.minFloorRatio(), qa.maxFloorRatio(),
            qa.minConnectedFloorTiles(), qa.maxIsolatedRegions(), qa.minAverageRegionSize(), qa.maxWallIslands());
        this.solvabilityTester = new SolvabilityTester(analyzer);
    }

    public GenerationSettings getSettings() {
        return settings;
    }

    /**
     * Generates one level.
     *
     * @return the level, or a failure naming the stage and the unmet constraint
     * @throws IllegalStateException if a stage hits an invariant violation
     */
    public GenerationResult generate() {
        final String seed = settings.seed().seed();
        final IRandomProvider root = SeededRandomProvider.fromSeed(seed);
        final Map<StageId, Long> timings = new LinkedHashMap<>();

        GenerationSettings.SeedSettings ss = settings.seed();
        final CaveGrid seeded = stage(StageId.SEED, timings, () ->
            seeder.initializeGrid(ss.width(), ss.height(), ss.initialWallRatio(), stream(root, StageId.SEED)));

        GenerationSettings.AutomatonSettings as = settings.automaton();
        final CaveGrid smoothed = stage(StageId.AUTOMATON, timings, () -> {
            CaveGrid grid = automaton.applyRules(seeded, as.simulationSteps(), as.birthThreshold(), as.survivalThreshold());
            if (as.smoothingPasses() > 0) {
                grid = automaton.microSmooth(grid, as.smoothingPasses());
            }
            return as.sealBorder() ? automaton.sealBorder(grid) : grid;
        });

        final ConnectivityResult connectivity = stage(StageId.CONNECTIVITY, timings, () ->
            connectivityValidator.validateWithFallback(smoothed, stream(root, StageId.CONNECTIVITY)));
        if (!connectivity.connected()) {
            return fail(StageId.CONNECTIVITY, connectivity.error(), timings);
        }

        final CaveGrid terrain = as.refine()
            ? stage(StageId.REFINE, timings, () -> refiner.refine(connectivity.grid()))
            : connectivity.grid();

        PlacementContext context = new PlacementContext(terrain, analyzer);

        final PlacementContext spawnContext = context;
        PlacementResult<SpawnPlacement> spawn = stage(StageId.SPAWN, timings, () ->
            spawnPlacer.place(spawnContext, stream(root, StageId.SPAWN)));
        if (!spawn.success()) {
            return fail(StageId.SPAWN, spawn.error(), timings);
        }
        context = context.withSpawn(spawn.value().position());

        GoalPlacement goal = null;
        if (goalPlacer.getMode() == GoalMode.BEFORE_PLATFORMS) {
            PlacementResult<GoalPlacement> placed = placeGoal(context, root, timings);
            if (!placed.success()) {
                return fail(StageId.GOAL, placed.error(), timings);
            }
            goal = placed.value();
            context = context.withGoal(goal.position());
        }

        final PlacementContext platformContext = context;
        PlacementResult<PlatformPlan> platforms = stage(StageId.PLATFORMS, timings, () ->
            platformPlacer.place(platformContext, stream(root, StageId.PLATFORMS)));
        if (platforms.value() != null) {
            context = context.withPlatforms(platforms.value().platforms());
        }
        if (!platforms.success()) {
            LOG.warn("Platform placement incomplete: {}", platforms.error());
        }

        if (goal == null) {
            PlacementResult<GoalPlacement> placed = placeGoal(context, root, timings);
            if (!placed.success()) {
                return fail(StageId.GOAL, placed.error(), timings);
            }
            goal = placed.value();
            context = context.withGoal(goal.position());
        } else if (!context.reachability().contains(goal.position())) {
            return fail(StageId.PLATFORMS, "Goal " + goal.position() + " is not reachable after platform placement", timings);
        }

        final PlacementContext coinContext = context;
        PlacementResult<CoinPlacement> coins = stage(StageId.COINS, timings, () ->
            coinPlacer.place(coinContext, stream(root, StageId.COINS)));
        if (!coins.success()) {
            LOG.warn("Coin placement incomplete: {}", coins.error());
        }
        List<Point> coinCells = coins.value() == null ? List.of() : coins.value().coins();
        context = context.withCoins(coinCells);

        final PlacementContext enemyContext = context;
        PlacementResult<List<Enemy>> enemies = stage(StageId.ENEMIES, timings, () ->
            enemyPlacer.place(enemyContext, stream(root, StageId.ENEMIES)));
        if (!enemies.success()) {
            LOG.warn("Enemy placement incomplete: {}", enemies.error());
        }
        List<Enemy> enemyList = enemies.value() == null ? List.of() : enemies.value();

        LevelLayout level = new LevelLayout(seed, terrain, spawn.value().position(), goal.position(), coinCells,
            context.platforms(), enemyList);

        final CaveGrid collision = context.collisionGrid();
        final Point goalCell = goal.position();
        SolvabilityReport solvability = stage(StageId.VALIDATE, timings, () ->
            solvabilityTester.test(collision, level.spawn(), goalCell, coinCells));
        if (!solvability.solvable()) {
            LOG.warn("Level generation failed at stage {}: {}", StageId.VALIDATE, solvability.issues());
            return GenerationResult.failure(StageId.VALIDATE, String.join("; ", solvability.issues()),
                Collections.unmodifiableMap(timings), solvability);
        }
        if (!solvability.allCoinsReachable()) {
            LOG.info("{} coin(s) cannot be collected", solvability.unreachableCoins().size());
        }
        CaveQualityReport quality = qualityValidator.evaluate(terrain);
        if (!quality.acceptable()) {
            LOG.info("Terrain quality {}/100 misses: {}", quality.score(), quality.issues());
        }

        double ratio = solvability.reachableFloorRatio();
        LOG.info("Generated level '{}' ({}x{}): {} platforms, {} coins, {} enemies, reachability {}, quality {}/100",
            seed, terrain.getWidth(), terrain.getHeight(), level.platforms().size(), coinCells.size(), enemyList.size(),
            String.format(Locale.ROOT, "%.3f", ratio), quality.score());
        return GenerationResult.success(level, Collections.unmodifiableMap(timings), ratio, quality, solvability);
    }

    private PlacementResult<GoalPlacement> placeGoal(PlacementContext context, IRandomProvider root,
                                                     Map<StageId, Long> timings) {
        return stage(StageId.GOAL, timings, () -> goalPlacer.place(context, stream(root, StageId.GOAL)));
    }

    private static IRandomProvider stream(IRandomProvider root, StageId stage) {
        return root.deriveFor("stage", stage.ordinal());
    }

    private <T> T stage(StageId id, Map<StageId, Long> timings, Supplier<T> body) {
        listener.onStageStart(id);
        long start = System.nanoTime();
        T result;
        try {
            result = body.get();
        } catch (RuntimeException e) {
            throw new IllegalStateException("Generation failed at stage: " + id, e);
        }
        long elapsedMs = (System.nanoTime() - start) / 1_000_000L;
        timings.put(id, elapsedMs);
        listener.onStageEnd(id, elapsedMs);
        LOG.debug("Stage {} finished in {} ms", id, elapsedMs);
        return result;
    }

    private GenerationResult fail(StageId stage, String error, Map<StageId, Long> timings) {
        LOG.warn("Level generation failed at stage {}: {}", stage, error);
        return GenerationResult.failure(stage, error, Collections.unmodifiableMap(timings));
    }
}
