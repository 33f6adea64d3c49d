package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * Computes which cells a player can reach from a start cell under gravity-based jump physics.
 * <p>
 * The search is a breadth-first traversal over standing positions (free cells with a wall below).
 * From each standing position the player can walk one cell sideways or jump; both count as one move.
 * Jumps are simulated as projectile arcs in pixel space and every cell an arc passes through counts as
 * reached. Falling, including one cell of sideways drift per row, is part of the move that caused it.
 * </p>
 */
public final class PhysicsAwareReachabilityAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(PhysicsAwareReachabilityAnalyzer.class);

    /** Horizontal speed fractions sampled for jump arcs. */
    private static final double[] JUMP_FRACTIONS = {-1.0, -2.0 / 3.0, -1.0 / 3.0, 0.0, 1.0 / 3.0, 2.0 / 3.0, 1.0};

    private final JumpPhysics physics;
    private final double dt;
    private final int maxArcSteps;

    public PhysicsAwareReachabilityAnalyzer(JumpPhysics physics) {
        if (physics == null) {
            throw new IllegalArgumentException("physics is required");
        }
        this.physics = physics;
        this.dt = physics.tileSize() / (8.0 * Math.max(physics.jumpVelocity(), physics.runSpeed()));
        this.maxArcSteps = (int) Math.ceil((physics.airTime() + 1.0) / dt);
    }

    public JumpPhysics getPhysics() {
        return physics;
    }

    /**
     * Unlimited search, equivalent to {@code analyze(grid, start, null)}.
     */
    public ReachabilityResult analyze(CaveGrid grid, Point start) {
        return analyze(grid, start, null, IntSets.EMPTY_SET);
    }

    /**
     * @param maxMoves move budget, or null to run until no new cell is found
     */
    public ReachabilityResult analyze(CaveGrid grid, Point start, Integer maxMoves) {
        return analyze(grid, start, maxMoves, IntSets.EMPTY_SET);
    }

    /**
     * Full search from {@code start}.
     *
     * @param grid collision grid; platforms must already be stamped as walls
     * @param start start cell, must be an in-bounds floor cell that is not blocked
     * @param maxMoves move budget, or null to run until no new cell is found
     * @param blocked row-major indices of cells that cannot be entered but give no footing (hazards)
     * @return the reachable set; always contains {@code start}
     */
    public ReachabilityResult analyze(CaveGrid grid, Point start, Integer maxMoves, IntSet blocked) {
        validate(grid, start, maxMoves, blocked);
        Search search = new Search(grid, blocked, true, maxMoves, new Int2IntOpenHashMap(), new Int2IntOpenHashMap());
        search.begin(start);
        search.run();
        LOG.trace("Reachability from {}: {} cells, {} standing positions", start,
            search.reached.size(), search.standing.size());
        return new ReachabilityResult(grid.getWidth(), grid.getHeight(), start, search.reached, search.standing);
    }

    /**
     * Reachable set with jumping disabled: walking and falling only.
     */
    public ReachabilityResult reachableByWalking(CaveGrid grid, Point start) {
        validate(grid, start, null, IntSets.EMPTY_SET);
        Search search = new Search(grid, IntSets.EMPTY_SET, false, null, new Int2IntOpenHashMap(), new Int2IntOpenHashMap());
        search.begin(start);
        search.run();
        return new ReachabilityResult(grid.getWidth(), grid.getHeight(), start, search.reached, search.standing);
    }

    /**
     * Continues an earlier search on a modified grid, re-expanding only the given standing positions.
     * Cells that are no longer free are dropped from the copied base result. Used to screen local grid
     * changes cheaply; the result is an approximation that never re-examines distant positions.
     *
     * @param grid the modified collision grid, same dimensions as the base search
     * @param base the earlier result
     * @param seeds standing positions of {@code base} to re-expand
     * @return the extended result
     */
    public ReachabilityResult expand(CaveGrid grid, ReachabilityResult base, Collection<Point> seeds) {
        Int2IntOpenHashMap reached = new Int2IntOpenHashMap(base.reachedMoves());
        Int2IntOpenHashMap standing = new Int2IntOpenHashMap(base.standingMoves());
        int width = grid.getWidth();
        for (IntIterator it = reached.keySet().iterator(); it.hasNext(); ) {
            int idx = it.nextInt();
            if (!grid.isFloor(idx % width, idx / width)) it.remove();
        }
        for (IntIterator it = standing.keySet().iterator(); it.hasNext(); ) {
            int idx = it.nextInt();
            if (!grid.hasFooting(idx % width, idx / width)) it.remove();
        }
        Search search = new Search(grid, IntSets.EMPTY_SET, true, null, reached, standing);
        for (Point seed : seeds) {
            int idx = grid.index(seed.x(), seed.y());
            if (standing.containsKey(idx)) {
                search.queue.enqueue(idx);
            }
        }
        search.run();
        return new ReachabilityResult(grid.getWidth(), grid.getHeight(), base.start(), reached, standing);
    }

    private static void validate(CaveGrid grid, Point start, Integer maxMoves, IntSet blocked) {
        if (grid == null || start == null) {
            throw new IllegalArgumentException("grid and start are required");
        }
        if (!grid.inBounds(start)) {
            throw new IllegalArgumentException("Start " + start + " is outside the " + grid.getWidth() + "x" + grid.getHeight() + " grid");
        }
        if (!grid.isFloor(start) || blocked.contains(grid.index(start.x(), start.y()))) {
            throw new IllegalArgumentException("Start " + start + " must be a free floor cell");
        }
        if (maxMoves != null && maxMoves < 0) {
            throw new IllegalArgumentException("maxMoves must not be negative, got " + maxMoves);
        }
    }

    /**
     * Mutable state of one traversal.
     */
    private final class Search {
        private final CaveGrid grid;
        private final IntSet blocked;
        private final boolean jumps;
        private final Integer maxMoves;
        private final Int2IntOpenHashMap reached;
        private final Int2IntOpenHashMap standing;
        private final IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        private final int width;
        private final int height;

        Search(CaveGrid grid, IntSet blocked, boolean jumps, Integer maxMoves,
               Int2IntOpenHashMap reached, Int2IntOpenHashMap standing) {
            this.grid = grid;
            this.blocked = blocked;
            this.jumps = jumps;
            this.maxMoves = maxMoves;
            this.reached = reached;
            this.standing = standing;
            this.width = grid.getWidth();
            this.height = grid.getHeight();
        }

        void begin(Point start) {
            reach(start.x(), start.y(), 0);
            if (footing(start.x(), start.y())) {
                land(start.x(), start.y(), 0);
            } else {
                fall(start.x(), start.y(), 0);
            }
        }

        void run() {
            while (!queue.isEmpty()) {
                int idx = queue.dequeueInt();
                int moves = standing.get(idx);
                if (maxMoves != null && moves >= maxMoves) {
                    continue;
                }
                int x = idx % width;
                int y = idx / width;
                walk(x, y, moves + 1);
                if (jumps) {
                    for (double fraction : JUMP_FRACTIONS) {
                        arc(x, y, fraction * physics.runSpeed(), moves + 1);
                    }
                }
            }
        }

        private boolean free(int x, int y) {
            return grid.inBounds(x, y) && grid.isFloor(x, y) && !blocked.contains(y * width + x);
        }

        private boolean footing(int x, int y) {
            return free(x, y) && y + 1 < height && grid.isWall(x, y + 1);
        }

        private void reach(int x, int y, int moves) {
            int idx = y * width + x;
            if (!reached.containsKey(idx) || reached.get(idx) > moves) {
                reached.put(idx, moves);
            }
        }

        private void land(int x, int y, int moves) {
            int idx = y * width + x;
            reach(x, y, moves);
            if (!standing.containsKey(idx)) {
                standing.put(idx, moves);
                queue.enqueue(idx);
            }
        }

        private void walk(int x, int y, int moves) {
            for (int dx = -1; dx <= 1; dx += 2) {
                int nx = x + dx;
                if (!free(nx, y)) continue;
                reach(nx, y, moves);
                if (footing(nx, y)) {
                    land(nx, y, moves);
                } else {
                    fall(nx, y, moves);
                }
            }
        }

        /**
         * Drops from an airborne cell until every branch lands or leaves the grid. Each row down the
         * player may drift one column, provided the cell beside them is free.
         */
        private void fall(int x, int y, int moves) {
            if (footing(x, y)) {
                land(x, y, moves);
                return;
            }
            IntArrayFIFOQueue airborne = new IntArrayFIFOQueue();
            IntOpenHashSet seen = new IntOpenHashSet();
            airborne.enqueue(y * width + x);
            seen.add(y * width + x);
            while (!airborne.isEmpty()) {
                int idx = airborne.dequeueInt();
                int cx = idx % width;
                int cy = idx / width;
                int ny = cy + 1;
                if (ny >= height) continue;
                for (int dx = 0; dx <= 2; dx++) {
                    int step = dx == 2 ? -1 : dx;
                    int nx = cx + step;
                    if (step != 0 && !free(nx, cy)) continue;
                    if (!free(nx, ny)) continue;
                    reach(nx, ny, moves);
                    if (footing(nx, ny)) {
                        land(nx, ny, moves);
                    } else if (seen.add(ny * width + nx)) {
                        airborne.enqueue(ny * width + nx);
                    }
                }
            }
        }

        /**
         * Traces one jump arc from the centre of a standing cell.
         */
        private void arc(int x, int y, double vx, int moves) {
            double tile = physics.tileSize();
            double v0 = physics.jumpVelocity();
            double g = physics.gravity();
            double px0 = x * tile + tile / 2.0;
            double py0 = y * tile + tile / 2.0;
            int cx = x;
            int cy = y;
            for (int step = 1; step <= maxArcSteps; step++) {
                double t = step * dt;
                int nx = (int) Math.floor((px0 + vx * t) / tile);
                int ny = (int) Math.floor((py0 - v0 * t + 0.5 * g * t * t) / tile);
                boolean descending = g * t > v0;

                if (nx != cx || ny != cy) {
                    if (ny >= height) {
                        return;
                    }
                    boolean cornerBlocked = nx != cx && ny != cy && !free(nx, cy) && !free(cx, ny);
                    if (nx < 0 || nx >= width || ny < 0 || cornerBlocked || !free(nx, ny)) {
                        settle(cx, cy, moves);
                        return;
                    }
                    cx = nx;
                    cy = ny;
                    reach(cx, cy, moves);
                }
                if (descending && footing(cx, cy)) {
                    land(cx, cy, moves);
                    return;
                }
                if (descending && cy > y) {
                    fall(cx, cy, moves);
                    return;
                }
            }
            settle(cx, cy, moves);
        }

        private void settle(int x, int y, int moves) {
            if (footing(x, y)) {
                land(x, y, moves);
            } else {
                fall(x, y, moves);
            }
        }
    }
}
