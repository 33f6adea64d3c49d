package org.spelunk.runtime.worldgen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spelunk.runtime.internal.services.SeededRandomProvider;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.spi.IRandomProvider;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GraphGridSeederTest {

    @Test
    @DisplayName("Main points stay inside the margin and every corridor joins two of them")
    void layoutShape() {
        GraphGridSeeder seeder = new GraphGridSeeder(4, 0.7, 0.5, 0);

        GraphGridSeeder.Layout layout = seeder.layout(60, 40, SeededRandomProvider.fromSeed("graph"));

        assertThat(layout.mainPoints()).hasSizeBetween(GraphGridSeeder.MIN_MAIN_POINTS, GraphGridSeeder.MAX_MAIN_POINTS);
        assertThat(layout.mainPoints()).allSatisfy(p -> {
            assertThat(p.x()).isBetween(3, 57);
            assertThat(p.y()).isBetween(3, 37);
        });
        assertThat(layout.corridors()).isNotEmpty().allSatisfy(c -> {
            assertThat(layout.mainPoints()).contains(c.from(), c.to());
        });
        Set<Double> levels = new HashSet<>();
        for (double t : layout.thresholds()) levels.add(t);
        assertThat(levels).containsAnyOf(0.7).isSubsetOf(0.5, 0.7, 1.0);
        for (Point p : layout.mainPoints()) {
            assertThat(layout.threshold(p.x(), p.y())).isEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Rooms around main points are fully open")
    void roomsAreOpen() {
        GraphGridSeeder seeder = new GraphGridSeeder(8, 0.7, 0.5, 5);
        List<Point> mainPoints = seeder.layout(80, 50, SeededRandomProvider.fromSeed("rooms")).mainPoints();

        CaveGrid grid = seeder.initializeGrid(80, 50, 0.45, SeededRandomProvider.fromSeed("rooms"));

        for (Point p : mainPoints) {
            for (int dy = -5; dy <= 5; dy++) {
                for (int dx = -5; dx <= 5; dx++) {
                    int x = p.x() + dx;
                    int y = p.y() + dy;
                    if (dx * dx + dy * dy <= 25 && grid.inBounds(x, y)) {
                        assertThat(grid.isFloor(x, y)).as("cell (%d,%d)", x, y).isTrue();
                    }
                }
            }
        }
    }

    @Test
    @DisplayName("With closed corridors and background only the main points stay open")
    void closedThresholds() {
        GraphGridSeeder seeder = new GraphGridSeeder(3, 0.0, 0.0, 0);
        List<Point> mainPoints = seeder.layout(30, 20, SeededRandomProvider.fromSeed("closed")).mainPoints();

        CaveGrid grid = seeder.initializeGrid(30, 20, 0.45, SeededRandomProvider.fromSeed("closed"));

        assertThat(grid.countFloor()).isEqualTo(new HashSet<>(mainPoints).size());
        assertThat(mainPoints).allMatch(grid::isFloor);
    }

    @Test
    @DisplayName("Nearest main points come first and the point itself is skipped")
    void closestNeighbours() {
        List<Point> points = List.of(new Point(0, 0), new Point(10, 0), new Point(3, 4), new Point(1, 1));

        assertThat(GraphGridSeeder.closest(points, 0, 2)).containsExactly(new Point(1, 1), new Point(3, 4));
        assertThat(GraphGridSeeder.closest(points, 1, 5)).hasSize(3).first().isEqualTo(new Point(3, 4));
    }

    @Test
    @DisplayName("Same seed reproduces the same grid")
    void reproducible() {
        GraphGridSeeder seeder = new GraphGridSeeder(8, 0.7, 0.5, 5);
        assertThat(seeder.initializeGrid(50, 30, 0.45, SeededRandomProvider.fromSeed("same")))
            .isEqualTo(seeder.initializeGrid(50, 30, 0.45, SeededRandomProvider.fromSeed("same")));
    }

    @Test
    @DisplayName("Invalid parameters are rejected")
    void rejectsInvalidParameters() {
        IRandomProvider rng = SeededRandomProvider.fromSeed("x");
        assertThatThrownBy(() -> new GraphGridSeeder(0, 0.7, 0.5, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GraphGridSeeder(8, 1.5, 0.5, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GraphGridSeeder(8, 0.7, -0.1, 5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GraphGridSeeder(8, 0.7, 0.5, -1)).isInstanceOf(IllegalArgumentException.class);
        GraphGridSeeder seeder = new GraphGridSeeder(8, 0.7, 0.5, 5);
        assertThatThrownBy(() -> seeder.initializeGrid(6, 20, 0.45, rng))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("at least 7 cells");
        assertThatThrownBy(() -> seeder.initializeGrid(20, 20, 0.45, null)).isInstanceOf(IllegalArgumentException.class);
    }
}
