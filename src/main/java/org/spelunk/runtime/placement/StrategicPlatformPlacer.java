package org.spelunk.runtime.placement;

import org.spelunk.runtime.Config;
import org.spelunk.runtime.analysis.CriticalRingAnalyzer;
import org.spelunk.runtime.analysis.CriticalRingAnalyzer.RingTile;
import org.spelunk.runtime.analysis.PhysicsAwareReachabilityAnalyzer;
import org.spelunk.runtime.analysis.ReachabilityResult;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Platform;
import org.spelunk.runtime.model.PlatformType;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Adds platforms until enough of the cave is reachable.
 * <p>
 * Each round asks the {@link CriticalRingAnalyzer} where explored space borders the largest
 * unexplored areas and proposes platforms a jump away from nearby standing positions, towards the
 * unexplored area. Ring cells whose proposals all failed are skipped until a platform lands near them;
 * once the critical ring is used up, the remaining frontier is tried in random order.
 * A proposal is screened with a local re-simulation around the platform and only accepted after a
 * full reachability run confirms that it adds floor without cutting off any cell that was reachable
 * before.
 * </p>
 */
public final class StrategicPlatformPlacer implements ILevelPlacer<PlatformPlan> {

    private static final Logger LOG = LoggerFactory.getLogger(StrategicPlatformPlacer.class);

    private final double targetReachability;
    private final int maxPlatforms;
    private final int maxAttempts;
    private final int minSize;
    private final int maxSize;
    private final double floatingProbability;
    private final double maxVisualImpact;
    private final int proposalsPerRingTile;
    private final CriticalRingAnalyzer ringAnalyzer;

    public StrategicPlatformPlacer(double targetReachability, int maxPlatforms, int maxAttempts, int minSize, int maxSize,
                                   double floatingProbability, double maxVisualImpact, int proposalsPerRingTile) {
        if (targetReachability < 0.0 || targetReachability > 1.0) {
            throw new IllegalArgumentException("targetReachability must be between 0 and 1, got " + targetReachability);
        }
        if (maxPlatforms < 0 || maxAttempts < 0) {
            throw new IllegalArgumentException("Platform budgets must not be negative");
        }
        if (minSize < 1 || maxSize < minSize) {
            throw new IllegalArgumentException("Platform size range is invalid: [" + minSize + ", " + maxSize + "]");
        }
        if (floatingProbability < 0.0 || floatingProbability > 1.0) {
            throw new IllegalArgumentException("floatingProbability must be between 0 and 1, got " + floatingProbability);
        }
        if (maxVisualImpact < 0.0 || maxVisualImpact > 1.0) {
            throw new IllegalArgumentException("maxVisualImpact must be between 0 and 1, got " + maxVisualImpact);
        }
        if (proposalsPerRingTile <= 0) {
            throw new IllegalArgumentException("proposalsPerRingTile must be positive, got " + proposalsPerRingTile);
        }
        this.targetReachability = targetReachability;
        this.maxPlatforms = maxPlatforms;
        this.maxAttempts = maxAttempts;
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.floatingProbability = floatingProbability;
        this.maxVisualImpact = maxVisualImpact;
        this.proposalsPerRingTile = proposalsPerRingTile;
        this.ringAnalyzer = new CriticalRingAnalyzer();
    }

    @Override
    public String name() {
        return "platforms";
    }

    /**
     * Places platforms from the context's spawn. If the context already holds a goal it becomes a
     * must-reach cell: placement continues until it is reachable as well.
     */
    @Override
    public PlacementResult<PlatformPlan> place(PlacementContext context, IRandomProvider random) {
        Point spawn = context.requireSpawn();
        PhysicsAwareReachabilityAnalyzer analyzer = context.analyzer();
        List<Point> mustReach = context.goal() == null ? List.of() : List.of(context.goal());
        Set<Point> reserved = reservedCells(context, mustReach);

        int maxRiseTiles = analyzer.getPhysics().maxRiseTiles();
        int maxJumpTiles = analyzer.getPhysics().maxJumpDistanceTiles();
        int influence = maxJumpTiles + maxRiseTiles + 1;
        List<Platform> platforms = new ArrayList<>(context.platforms());
        CaveGrid collision = context.collisionGrid();
        ReachabilityResult reach = analyzer.analyze(collision, spawn);
        double initialRatio = reach.reachableFloorRatio(collision);
        Set<Point> exhausted = new HashSet<>();
        int attempts = 0;

        while (!isDone(reach, collision, mustReach) && platforms.size() < maxPlatforms && attempts < maxAttempts) {
            List<RingTile> pending = withoutExhausted(ringAnalyzer.findCriticalRing(collision, reach), exhausted);
            if (pending.isEmpty()) {
                pending = withoutExhausted(ringAnalyzer.findFullRing(collision, reach), exhausted);
                Collections.shuffle(pending, random.asJavaRandom());
            }
            if (pending.isEmpty()) {
                LOG.debug("No frontier left to extend at ratio {}", reach.reachableFloorRatio(collision));
                break;
            }
            List<Point> standing = reach.standingPositions();
            Platform accepted = null;
            ReachabilityResult acceptedReach = null;
            for (RingTile tile : pending) {
                List<Point> anchors = anchorsFor(tile, standing, maxRiseTiles, maxJumpTiles);
                for (int i = 0; i < proposalsPerRingTile && attempts < maxAttempts && accepted == null; i++) {
                    attempts++;
                    Point anchor = anchors.isEmpty() ? tile.frontier() : anchors.get(random.nextInt(anchors.size()));
                    Platform candidate = propose(tile, anchor, maxRiseTiles, maxJumpTiles, random);
                    if (!fits(collision, candidate, anchor, reserved)) continue;
                    CaveGrid trial = collision.withWalls(candidate.cells());
                    ReachabilityResult confirmed = confirm(analyzer, trial, reach, candidate, spawn);
                    if (confirmed != null) {
                        accepted = candidate;
                        acceptedReach = confirmed;
                    }
                }
                if (accepted != null || attempts >= maxAttempts) break;
                exhausted.add(tile.frontier());
            }
            if (accepted == null) {
                continue;
            }
            platforms.add(accepted);
            collision = collision.withWalls(accepted.cells());
            reach = acceptedReach;
            Platform placed = accepted;
            exhausted.removeIf(p -> near(placed, p, influence));
            LOG.debug("Placed {} platform at ({},{}) width {}, reachability now {}", accepted.type(), accepted.x(),
                accepted.y(), accepted.width(), String.format(Locale.ROOT, "%.3f", reach.reachableFloorRatio(collision)));
        }

        double finalRatio = reach.reachableFloorRatio(collision);
        ReachabilityResult finalReach = reach;
        boolean targetMet = isDone(finalReach, collision, mustReach);
        PlatformPlan plan = new PlatformPlan(platforms, initialRatio, finalRatio, attempts, targetMet);
        if (!targetMet) {
            String unreached = mustReach.stream().filter(p -> !finalReach.contains(p)).map(Point::toString)
                .reduce((a, b) -> a + ", " + b).map(s -> ", unreachable: " + s).orElse("");
            return PlacementResult.failure(String.format(Locale.ROOT, "Platform budget exhausted at reachability %.3f (target %.2f)%s",
                finalRatio, targetReachability, unreached), plan);
        }
        return PlacementResult.success(plan);
    }

    @Override
    public boolean validate(PlacementContext context, PlatformPlan plan) {
        if (plan == null) return false;
        CaveGrid grid = context.grid();
        Set<Point> occupied = new HashSet<>();
        for (Platform platform : plan.platforms()) {
            for (Point cell : platform.cells()) {
                if (!grid.inBounds(cell) || grid.isBorder(cell.x(), cell.y()) || !grid.isFloor(cell)) return false;
                if (!occupied.add(cell)) return false;
                if (cell.equals(context.spawn()) || cell.equals(context.goal())) return false;
            }
        }
        return true;
    }

    private boolean isDone(ReachabilityResult reach, CaveGrid collision, List<Point> mustReach) {
        return reach.reachableFloorRatio(collision) >= targetReachability && mustReach.stream().allMatch(reach::contains);
    }

    private static List<RingTile> withoutExhausted(List<RingTile> ring, Set<Point> exhausted) {
        List<RingTile> pending = new ArrayList<>(ring.size());
        for (RingTile tile : ring) {
            if (!exhausted.contains(tile.frontier())) pending.add(tile);
        }
        return pending;
    }

    private static boolean near(Platform platform, Point p, int radius) {
        return p.x() >= platform.x() - radius && p.x() < platform.x() + platform.width() + radius
            && Math.abs(p.y() - platform.y()) <= radius;
    }

    /**
     * Standing positions close enough to the ring tile to jump towards its unexplored neighbour.
     */
    static List<Point> anchorsFor(RingTile tile, List<Point> standing, int maxRiseTiles, int maxJumpTiles) {
        Point f = tile.frontier();
        List<Point> anchors = new ArrayList<>();
        for (Point s : standing) {
            if (Math.abs(s.x() - f.x()) <= maxJumpTiles && Math.abs(s.y() - f.y()) <= maxRiseTiles) {
                anchors.add(s);
            }
        }
        return anchors;
    }

    /**
     * Draws a platform a jump away from {@code anchor}, towards the tile's unexplored neighbour: its top
     * is one to {@code maxRiseTiles} rows above the anchor's footing and the gap to the anchor is below
     * {@code maxJumpTiles} columns.
     */
    Platform propose(RingTile tile, Point anchor, int maxRiseTiles, int maxJumpTiles, IRandomProvider random) {
        int width = minSize + random.nextInt(maxSize - minSize + 1);
        int rise = 1 + random.nextInt(Math.max(1, maxRiseTiles));
        int row = anchor.y() + 1 - rise;
        int dir = Integer.signum(tile.target().x() - anchor.x());
        if (dir == 0) {
            dir = random.nextDouble() < 0.5 ? -1 : 1;
        }
        int gap = random.nextInt(Math.max(1, maxJumpTiles));
        int startX = dir > 0 ? anchor.x() + 1 + gap : anchor.x() - gap - width;
        PlatformType type = random.nextDouble() < floatingProbability ? PlatformType.FLOATING : PlatformType.MOVING;
        return new Platform(startX, row, width, 1, type);
    }

    /**
     * Shape and aesthetic checks that need no simulation. The anchor and the cell above it stay free.
     */
    boolean fits(CaveGrid collision, Platform candidate, Point anchor, Set<Point> reserved) {
        for (Point cell : candidate.cells()) {
            if (!collision.inBounds(cell) || collision.isBorder(cell.x(), cell.y()) || !collision.isFloor(cell)) {
                return false;
            }
            if (reserved.contains(cell) || cell.equals(anchor) || cell.equals(anchor.offset(0, -1))) {
                return false;
            }
        }
        return visualImpact(collision, candidate) <= maxVisualImpact;
    }

    /**
     * Fraction of the cells surrounding the platform that are solid (walls, other platforms or outside
     * the grid). Platforms hugging walls add clutter without opening space.
     */
    static double visualImpact(CaveGrid collision, Platform platform) {
        int solid = 0;
        int total = 0;
        for (int y = platform.y() - 1; y <= platform.y() + platform.height(); y++) {
            for (int x = platform.x() - 1; x <= platform.x() + platform.width(); x++) {
                if (platform.occupies(new Point(x, y))) continue;
                total++;
                if (collision.getOrWall(x, y) != Config.FLOOR) solid++;
            }
        }
        return (double) solid / total;
    }

    /**
     * Local screening followed by a full confirmation run.
     *
     * @return the full reachability with the candidate, or null if the candidate is rejected
     */
    private ReachabilityResult confirm(PhysicsAwareReachabilityAnalyzer analyzer, CaveGrid trial,
                                       ReachabilityResult reach, Platform candidate, Point spawn) {
        int before = reach.reachableFloorCount(trial);
        int radius = analyzer.getPhysics().maxJumpDistanceTiles() + analyzer.getPhysics().maxRiseTiles() + 1;
        List<Point> seeds = new ArrayList<>();
        for (Point p : reach.standingPositions()) {
            if (near(candidate, p, radius)) {
                seeds.add(p);
            }
        }
        ReachabilityResult screened = analyzer.expand(trial, reach, seeds);
        if (screened.reachableFloorCount(trial) <= before) {
            return null;
        }
        if (trial.isWall(spawn.x(), spawn.y())) {
            return null;
        }
        ReachabilityResult full = analyzer.analyze(trial, spawn);
        if (full.reachableFloorCount(trial) <= before) {
            return null;
        }
        for (Point p : reach.points()) {
            if (!candidate.occupies(p) && !full.contains(p)) {
                return null;
            }
        }
        return full;
    }

    private Set<Point> reservedCells(PlacementContext context, List<Point> mustReach) {
        Set<Point> reserved = new HashSet<>();
        List<Point> anchors = new ArrayList<>(mustReach);
        anchors.add(context.spawn());
        for (Point p : anchors) {
            reserved.add(p);
            reserved.add(p.offset(0, -1));
        }
        return reserved;
    }
}
