package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Selects the frontier cells from which new platforms are most likely to open up unreachable floor.
 * <p>
 * Unreachable floor is grouped into 4-connected components. Every frontier cell is scored by the total
 * area of the components it borders, and cells are then picked greedily, best first, as long as each
 * one borders a component that no earlier pick already covers.
 * </p>
 */
public final class CriticalRingAnalyzer {

    /**
     * One selected frontier cell.
     *
     * @param frontier the reachable cell at the edge of explored space
     * @param target an unreachable floor neighbour of {@code frontier} in the largest adjacent component
     * @param reclaimableArea total area of the unreachable components bordering {@code frontier}
     */
    public record RingTile(Point frontier, Point target, int reclaimableArea) {
    }

    private final ReachableFrontierAnalyzer frontierAnalyzer;

    public CriticalRingAnalyzer() {
        this(new ReachableFrontierAnalyzer());
    }

    public CriticalRingAnalyzer(ReachableFrontierAnalyzer frontierAnalyzer) {
        this.frontierAnalyzer = frontierAnalyzer;
    }

    private record Candidate(Point frontier, Point target, int area, IntSet components) {
    }

    /**
     * Greedy cover of the unreachable components: the fewest frontier cells, largest area first, that
     * together border every component the frontier touches.
     */
    public List<RingTile> findCriticalRing(CaveGrid grid, ReachabilityResult reachability) {
        List<Candidate> candidates = candidates(grid, reachability);
        IntSet covered = new IntOpenHashSet();
        List<RingTile> ring = new ArrayList<>();
        for (Candidate candidate : candidates) {
            boolean addsCoverage = false;
            for (int c : candidate.components()) {
                if (!covered.contains(c)) {
                    addsCoverage = true;
                    break;
                }
            }
            if (!addsCoverage) continue;
            covered.addAll(candidate.components());
            ring.add(new RingTile(candidate.frontier(), candidate.target(), candidate.area()));
        }
        return ring;
    }

    /**
     * Every frontier cell with its target and reclaimable area, largest area first. Used once the
     * critical ring has nothing left to offer.
     */
    public List<RingTile> findFullRing(CaveGrid grid, ReachabilityResult reachability) {
        List<RingTile> ring = new ArrayList<>();
        for (Candidate candidate : candidates(grid, reachability)) {
            ring.add(new RingTile(candidate.frontier(), candidate.target(), candidate.area()));
        }
        return ring;
    }

    private List<Candidate> candidates(CaveGrid grid, ReachabilityResult reachability) {
        int w = grid.getWidth();
        int[] component = labelUnreachable(grid, reachability);
        int[] areas = componentAreas(component);

        List<Candidate> candidates = new ArrayList<>();
        for (Point f : frontierAnalyzer.findFrontier(grid, reachability)) {
            IntSet touched = new IntOpenHashSet();
            Point target = null;
            int targetArea = -1;
            for (int d = 0; d < 4; d++) {
                int nx = f.x() + ReachableFrontierAnalyzer.DX[d];
                int ny = f.y() + ReachableFrontierAnalyzer.DY[d];
                if (!grid.inBounds(nx, ny)) continue;
                int c = component[ny * w + nx];
                if (c <= 0) continue;
                touched.add(c);
                if (areas[c] > targetArea) {
                    targetArea = areas[c];
                    target = new Point(nx, ny);
                }
            }
            int area = 0;
            for (int c : touched) {
                area += areas[c];
            }
            candidates.add(new Candidate(f, target, area, touched));
        }

        // frontier order is row-major and the sort is stable, so ties stay row-major
        candidates.sort(Comparator.comparingInt(Candidate::area).reversed());
        return candidates;
    }

    /**
     * @return component id per cell: 0 for walls and reachable cells, 1.. for unreachable floor components
     */
    private static int[] labelUnreachable(CaveGrid grid, ReachabilityResult reachability) {
        int w = grid.getWidth();
        int h = grid.getHeight();
        int[] component = new int[w * h];
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue();
        int next = 1;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (component[idx] != 0 || !grid.isFloor(x, y) || reachability.contains(x, y)) continue;
                int id = next++;
                component[idx] = id;
                queue.enqueue(idx);
                while (!queue.isEmpty()) {
                    int cur = queue.dequeueInt();
                    int cx = cur % w;
                    int cy = cur / w;
                    for (int d = 0; d < 4; d++) {
                        int nx = cx + ReachableFrontierAnalyzer.DX[d];
                        int ny = cy + ReachableFrontierAnalyzer.DY[d];
                        if (!grid.inBounds(nx, ny)) continue;
                        int n = ny * w + nx;
                        if (component[n] == 0 && grid.isFloor(nx, ny) && !reachability.contains(nx, ny)) {
                            component[n] = id;
                            queue.enqueue(n);
                        }
                    }
                }
            }
        }
        return component;
    }

    private static int[] componentAreas(int[] component) {
        int max = Arrays.stream(component).max().orElse(0);
        int[] areas = new int[max + 1];
        for (int c : component) {
            if (c > 0) areas[c]++;
        }
        return areas;
    }
}
