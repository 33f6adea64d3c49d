package org.spelunk.runtime.placement;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Enemy;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.placement.EnemyPlacementAnalyzer.Candidate;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Spreads enemies over the left, middle and right thirds of the map, taking candidates round-robin.
 * With solvability preservation an enemy is treated as an impassable cell and only accepted if the
 * player can still reach everything reachable before enemies were placed.
 */
public final class StrategicEnemyPlacer implements ILevelPlacer<List<Enemy>> {

    private static final Logger LOG = LoggerFactory.getLogger(StrategicEnemyPlacer.class);
    private static final int ZONES = 3;

    private final String enemyType;
    private final int maxEnemies;
    private final double density;
    private final double minDistanceFromSpawn;
    private final double minDistanceFromGoal;
    private final boolean preserveSolvability;
    private final EnemyPlacementAnalyzer candidateAnalyzer;

    public StrategicEnemyPlacer(String enemyType, int maxEnemies, double density, double minDistanceFromSpawn,
                                double minDistanceFromGoal, boolean preserveSolvability,
                                EnemyPlacementAnalyzer candidateAnalyzer) {
        if (!EnemyTypeFactory.isRegistered(enemyType)) {
            throw new IllegalArgumentException("Unknown enemy type: " + enemyType);
        }
        if (maxEnemies < 0) {
            throw new IllegalArgumentException("maxEnemies must not be negative, got " + maxEnemies);
        }
        if (density < 0.0 || density > 1.0) {
            throw new IllegalArgumentException("density must be between 0 and 1, got " + density);
        }
        if (minDistanceFromSpawn < 0 || minDistanceFromGoal < 0) {
            throw new IllegalArgumentException("Enemy minimum distances must not be negative");
        }
        this.enemyType = enemyType;
        this.maxEnemies = maxEnemies;
        this.density = density;
        this.minDistanceFromSpawn = minDistanceFromSpawn;
        this.minDistanceFromGoal = minDistanceFromGoal;
        this.preserveSolvability = preserveSolvability;
        this.candidateAnalyzer = candidateAnalyzer;
    }

    @Override
    public String name() {
        return "enemies";
    }

    /**
     * @return the number of enemies aimed for on this grid
     */
    int targetCount(CaveGrid grid, int candidates) {
        int target = Math.min(maxEnemies, (int) Math.floor(grid.countFloor() * density));
        if (target == 0 && maxEnemies > 0 && candidates > 0) {
            target = 1;
        }
        return target;
    }

    @Override
    public PlacementResult<List<Enemy>> place(PlacementContext context, IRandomProvider random) {
        Point spawn = context.requireSpawn();
        CaveGrid grid = context.collisionGrid();
        List<Candidate> candidates = eligible(context, candidateAnalyzer.findCandidates(grid, context.coins(), context.goal()));
        int target = targetCount(grid, candidates.size());
        if (target == 0) {
            return PlacementResult.success(List.of());
        }

        Collections.shuffle(candidates, random.asJavaRandom());
        candidates.sort(Comparator.comparingInt(c -> c.type().ordinal()));
        List<Deque<Candidate>> zones = new ArrayList<>();
        for (int z = 0; z < ZONES; z++) {
            zones.add(new ArrayDeque<>());
        }
        for (Candidate c : candidates) {
            zones.get(Math.min(ZONES - 1, c.position().x() * ZONES / grid.getWidth())).add(c);
        }

        ReachabilityResult baseline = context.reachability();
        IntOpenHashSet blocked = new IntOpenHashSet();
        List<Enemy> enemies = new ArrayList<>();
        int zone = 0;
        int rejected = 0;
        while (enemies.size() < target && zones.stream().anyMatch(q -> !q.isEmpty())) {
            Deque<Candidate> queue = zones.get(zone);
            zone = (zone + 1) % ZONES;
            Candidate candidate = queue.poll();
            if (candidate == null) continue;
            Point p = candidate.position();
            if (preserveSolvability && !keepsLevelSolvable(context, grid, baseline, blocked, p)) {
                rejected++;
                continue;
            }
            blocked.add(grid.index(p.x(), p.y()));
            enemies.add(EnemyTypeFactory.create(enemyType, p, candidate.type().name(), random));
        }
        LOG.debug("Placed {} of {} enemies ({} rejected to keep the level solvable)", enemies.size(), target, rejected);
        if (enemies.size() < target) {
            return PlacementResult.failure("Only " + enemies.size() + " of " + target + " enemies could be placed", enemies);
        }
        return PlacementResult.success(enemies);
    }

    @Override
    public boolean validate(PlacementContext context, List<Enemy> enemies) {
        if (enemies == null) return false;
        CaveGrid grid = context.collisionGrid();
        Set<Point> used = new HashSet<>();
        for (Enemy enemy : enemies) {
            Point p = enemy.position();
            if (!grid.hasFooting(p) || !used.add(p) || !isFarEnough(context, p)) {
                return false;
            }
        }
        return true;
    }

    private List<Candidate> eligible(PlacementContext context, List<Candidate> candidates) {
        Set<Point> coins = new HashSet<>(context.coins());
        List<Candidate> result = new ArrayList<>();
        for (Candidate c : candidates) {
            if (!coins.contains(c.position()) && isFarEnough(context, c.position())) {
                result.add(c);
            }
        }
        return result;
    }

    private boolean isFarEnough(PlacementContext context, Point p) {
        if (p.equals(context.spawn()) || p.distance(context.spawn()) < minDistanceFromSpawn) {
            return false;
        }
        Point goal = context.goal();
        return goal == null || (!p.equals(goal) && p.distance(goal) >= minDistanceFromGoal);
    }

    /**
     * Re-runs reachability with the candidate blocked and requires every baseline cell except the
     * blocked ones to remain reachable, goal and coins included.
     */
    private boolean keepsLevelSolvable(PlacementContext context, CaveGrid grid, ReachabilityResult baseline,
                                       IntOpenHashSet blocked, Point candidate) {
        IntOpenHashSet trial = new IntOpenHashSet(blocked);
        trial.add(grid.index(candidate.x(), candidate.y()));
        ReachabilityResult result = context.analyzer().analyze(grid, context.spawn(), null, trial);
        for (Point p : baseline.points()) {
            if (!trial.contains(grid.index(p.x(), p.y())) && !result.contains(p)) {
                LOG.trace("Enemy at {} would cut off {}", candidate, p);
                return false;
            }
        }
        if (context.goal() != null && baseline.contains(context.goal()) && !result.contains(context.goal())) {
            return false;
        }
        return context.coins().stream().filter(baseline::contains).allMatch(result::contains);
    }
}
