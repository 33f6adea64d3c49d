package org.spelunk.runtime.analysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spelunk.runtime.internal.services.SeededRandomProvider;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.model.RegionMap;
import org.spelunk.runtime.spi.IRandomProvider;
import org.spelunk.runtime.worldgen.CellularAutomaton;
import org.spelunk.runtime.worldgen.GridSeeder;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

@Tag("unit")
class CorridorCarverTest {

    private final RegionDetector detector = new RegionDetector();
    private final CorridorCarver carver = new CorridorCarver();

    @Test
    @DisplayName("Two regions split by a wall column become one")
    void joinsSplitGrid() {
        CaveGrid grid = CaveGrid.fromRows(new int[][]{
            {0, 1, 0, 0, 0},
            {0, 1, 0, 0, 0},
            {0, 1, 0, 0, 0},
            {0, 1, 0, 0, 0},
            {0, 1, 0, 0, 0}});
        RegionMap before = detector.detectRegions(grid);
        assertThat(before.regionCount()).isEqualTo(2);

        CaveGrid carved = carver.carveCorridors(grid, before, SeededRandomProvider.fromSeed("carve"));

        assertThat(detector.detectRegions(carved).regionCount()).isEqualTo(1);
        assertThat(grid.isWall(1, 0)).isTrue();
    }

    @Test
    @DisplayName("Single-region grid is returned as an unchanged copy without drawing")
    void singleRegionIsNoOp() {
        CaveGrid grid = CaveGrid.fromRows(new int[][]{
            {0, 0, 1, 1, 0, 0},
            {0, 0, 1, 1, 0, 0},
            {0, 0, 0, 0, 0, 0},
            {0, 0, 1, 1, 0, 0},
            {0, 0, 1, 1, 0, 0}});
        IRandomProvider rng = mock(IRandomProvider.class);

        CaveGrid carved = carver.carveCorridors(grid, detector.detectRegions(grid), rng);

        assertThat(carved).isEqualTo(grid).isNotSameAs(grid);
        verifyNoInteractions(rng);
    }

    @Test
    @DisplayName("Carving any multi-region cave yields one region")
    void carvedCavesAreConnected() {
        CellularAutomaton automaton = new CellularAutomaton();
        for (String seed : List.of("a", "b", "c", "d")) {
            CaveGrid cave = automaton.applyRules(
                new GridSeeder().initializeGrid(50, 40, 0.5, SeededRandomProvider.fromSeed(seed)), 5, 5, 4);
            RegionMap regions = detector.detectRegions(cave);
            if (regions.regionCount() < 2) continue;

            CaveGrid carved = carver.carveCorridors(cave, regions, SeededRandomProvider.fromSeed(seed));

            assertThat(detector.detectRegions(carved).regionCount()).as("seed %s", seed).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("Closest pair uses Manhattan distance and keeps the first pair on ties")
    void closestPair() {
        CorridorCarver.ClosestPair pair = carver.findClosestPair(
            List.of(new Point(0, 0), new Point(0, 4)),
            List.of(new Point(3, 0), new Point(3, 4)));
        assertThat(pair.from()).isEqualTo(new Point(0, 0));
        assertThat(pair.to()).isEqualTo(new Point(3, 0));
        assertThat(pair.distance()).isEqualTo(3);
    }

    @Test
    @DisplayName("L-shaped corridor is two cells thick and clamped to the grid")
    void lShapedCorridor() {
        CaveGrid grid = CaveGrid.fromRows(new int[][]{
            {1, 1, 1, 1},
            {1, 1, 1, 1},
            {1, 1, 1, 1},
            {1, 1, 1, 1}});

        carver.carveLShapedCorridor(grid, new Point(0, 0), new Point(3, 3), true);

        assertThat(grid.toRows()).isEqualTo(new int[][]{
            {0, 0, 0, 0},
            {0, 0, 0, 0},
            {1, 1, 1, 0},
            {1, 1, 1, 0}});
    }

    @Test
    @DisplayName("Empty region map is an invariant violation")
    void emptyMapThrows() {
        CaveGrid walls = CaveGrid.fromRows(new int[][]{{1, 1}});
        assertThatThrownBy(() -> carver.carveCorridors(walls, detector.detectRegions(walls),
            SeededRandomProvider.fromSeed("x")))
            .isInstanceOf(IllegalStateException.class);
    }
}
