package org.spelunk.runtime.analysis;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spelunk.runtime.internal.services.SeededRandomProvider;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.model.TestGrids;
import org.spelunk.runtime.worldgen.CellularAutomaton;
import org.spelunk.runtime.worldgen.GridSeeder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PhysicsAwareReachabilityAnalyzerTest {

    private final PhysicsAwareReachabilityAnalyzer analyzer =
        new PhysicsAwareReachabilityAnalyzer(JumpPhysics.defaults());

    /** A one-cell step in the middle of the room. */
    private static final CaveGrid STEP = TestGrids.parse(
        "##########",
        "#........#",
        "#........#",
        "#........#",
        "#........#",
        "#........#",
        "#....#...#",
        "##########");

    /** A five-cell column that is taller than a jump. */
    private static final CaveGrid TOWER = TestGrids.parse(
        "##########",
        "#........#",
        "#....#...#",
        "#....#...#",
        "#....#...#",
        "#....#...#",
        "#....#...#",
        "##########");

    /** A shelf the player can walk off. */
    private static final CaveGrid SHELF = TestGrids.parse(
        "########",
        "#......#",
        "#......#",
        "####...#",
        "#......#",
        "#......#",
        "#......#",
        "########");

    @Test
    @DisplayName("Start is always reachable")
    void startIncluded() {
        ReachabilityResult result = analyzer.analyze(STEP, new Point(1, 6));
        assertThat(result.contains(new Point(1, 6))).isTrue();
        assertThat(result.movesTo(new Point(1, 6))).isZero();
        assertThat(result.start()).isEqualTo(new Point(1, 6));
    }

    @Test
    @DisplayName("A one-cell step can be jumped onto and passed")
    void jumpsOntoLowStep() {
        ReachabilityResult result = analyzer.analyze(STEP, new Point(1, 6));
        assertThat(result.isStanding(new Point(5, 5))).isTrue();
        assertThat(result.contains(new Point(8, 6))).isTrue();
    }

    @Test
    @DisplayName("A column taller than the jump height blocks the way")
    void towerBlocks() {
        ReachabilityResult result = analyzer.analyze(TOWER, new Point(1, 6));
        assertThat(result.contains(new Point(4, 6))).isTrue();
        assertThat(result.contains(new Point(1, 3))).isTrue();
        assertThat(result.contains(new Point(1, 2))).isFalse();
        assertThat(result.contains(new Point(5, 1))).isFalse();
        assertThat(result.contains(new Point(6, 6))).isFalse();
    }

    @Test
    @DisplayName("Walking off a ledge falls to the ground below")
    void fallsOffLedge() {
        ReachabilityResult result = analyzer.analyze(SHELF, new Point(1, 2));
        assertThat(result.contains(new Point(4, 2))).isTrue();
        assertThat(result.isStanding(new Point(4, 6))).isTrue();
        assertThat(result.contains(new Point(1, 6))).isTrue();
    }

    @Test
    @DisplayName("Walking alone cannot climb a step")
    void walkingOnly() {
        ReachabilityResult walking = analyzer.reachableByWalking(STEP, new Point(1, 6));
        assertThat(walking.contains(new Point(4, 6))).isTrue();
        assertThat(walking.contains(new Point(5, 5))).isFalse();
        assertThat(walking.contains(new Point(8, 6))).isFalse();

        ReachabilityResult down = analyzer.reachableByWalking(SHELF, new Point(1, 2));
        assertThat(down.contains(new Point(6, 6))).isTrue();
    }

    @Test
    @DisplayName("A limited search is a subset of the unlimited one")
    void budgetSubset() {
        CellularAutomaton automaton = new CellularAutomaton();
        CaveGrid cave = automaton.sealBorder(automaton.applyRules(
            new GridSeeder().initializeGrid(40, 30, 0.45, SeededRandomProvider.fromSeed("budget")), 4, 5, 4));
        Point start = firstStandingCell(cave);

        ReachabilityResult unlimited = analyzer.analyze(cave, start, null);
        for (int k = 0; k <= 4; k++) {
            ReachabilityResult limited = analyzer.analyze(cave, start, k);
            assertThat(limited.contains(start)).isTrue();
            for (Point p : limited.points()) {
                assertThat(unlimited.contains(p)).as("budget %d, cell %s", k, p).isTrue();
                assertThat(limited.movesTo(p)).isLessThanOrEqualTo(k);
            }
        }
    }

    @Test
    @DisplayName("Zero moves reach only the start when standing")
    void zeroBudget() {
        ReachabilityResult result = analyzer.analyze(STEP, new Point(1, 6), 0);
        assertThat(result.points()).containsExactly(new Point(1, 6));
    }

    @Test
    @DisplayName("Blocked cells are never entered")
    void blockedCells() {
        IntSet hazard = new IntOpenHashSet();
        hazard.add(STEP.index(3, 6));
        ReachabilityResult result = analyzer.analyze(STEP, new Point(1, 6), null, hazard);
        assertThat(result.contains(new Point(3, 6))).isFalse();
        assertThat(result.contains(new Point(8, 6))).isTrue();

        IntSet wall = new IntOpenHashSet();
        for (int y = 1; y <= 6; y++) {
            wall.add(STEP.index(3, y));
        }
        ReachabilityResult walled = analyzer.analyze(STEP, new Point(1, 6), null, wall);
        assertThat(walled.contains(new Point(4, 6))).isFalse();
    }

    @Test
    @DisplayName("Expanding drops cells that became walls")
    void expandDropsStampedCells() {
        ReachabilityResult base = analyzer.analyze(STEP, new Point(1, 6));
        CaveGrid stamped = STEP.withWalls(List.of(new Point(8, 6)));

        ReachabilityResult expanded = analyzer.expand(stamped, base, List.of());

        assertThat(expanded.contains(new Point(8, 6))).isFalse();
        assertThat(expanded.contains(new Point(7, 6))).isTrue();
        assertThat(expanded.size()).isEqualTo(base.size() - 1);
    }

    @Test
    @DisplayName("Expanding from the original positions reproduces the base search")
    void expandWithoutChanges() {
        ReachabilityResult base = analyzer.analyze(STEP, new Point(1, 6));
        ReachabilityResult expanded = analyzer.expand(STEP, base, base.standingPositions());
        assertThat(expanded.points()).containsExactlyElementsOf(base.points());
    }

    @Test
    @DisplayName("Reachable ratio counts only floor cells")
    void floorRatio() {
        ReachabilityResult result = analyzer.analyze(TOWER, new Point(1, 6));
        assertThat(result.reachableFloorCount(TOWER)).isEqualTo(result.size());
        assertThat(result.reachableFloorRatio(TOWER)).isGreaterThan(0.0).isLessThan(1.0);
    }

    @Test
    @DisplayName("Invalid start cells and budgets are rejected")
    void rejectsInvalidInput() {
        assertThatThrownBy(() -> analyzer.analyze(STEP, new Point(0, 0))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.analyze(STEP, new Point(20, 3))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> analyzer.analyze(STEP, new Point(1, 6), -1)).isInstanceOf(IllegalArgumentException.class);
    }

    static Point firstStandingCell(CaveGrid grid) {
        for (int y = 0; y < grid.getHeight(); y++) {
            for (int x = 0; x < grid.getWidth(); x++) {
                if (grid.hasFooting(x, y)) return new Point(x, y);
            }
        }
        throw new IllegalStateException("no standing cell");
    }
}
