package org.spelunk.runtime.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class CaveGridTest {

    @Test
    @DisplayName("Footing requires floor with an in-bounds wall directly below")
    void footing() {
        CaveGrid grid = TestGrids.parse(
            "..",
            ".#",
            "..");
        assertThat(grid.hasFooting(1, 0)).isTrue();
        assertThat(grid.hasFooting(0, 0)).isFalse();
        assertThat(grid.hasFooting(0, 2)).isFalse();
        assertThat(grid.hasFooting(1, 1)).isFalse();
    }

    @Test
    @DisplayName("Reading outside the grid yields wall")
    void outOfBounds() {
        CaveGrid grid = new CaveGrid(2, 2);
        assertThat(grid.getOrWall(-1, 0)).isEqualTo((byte) 1);
        assertThat(grid.getOrWall(1, 1)).isEqualTo((byte) 0);
        assertThat(grid.isFloor(new Point(5, 5))).isFalse();
    }

    @Test
    @DisplayName("withWalls stamps a copy and leaves the original alone")
    void withWalls() {
        CaveGrid grid = new CaveGrid(3, 3);
        CaveGrid stamped = grid.withWalls(List.of(new Point(1, 1), new Point(9, 9)));
        assertThat(stamped.isWall(1, 1)).isTrue();
        assertThat(stamped.countWalls()).isEqualTo(1);
        assertThat(grid.countWalls()).isZero();
    }

    @Test
    @DisplayName("Rows round-trip and render as ASCII")
    void rowsAndRendering() {
        int[][] rows = {{1, 0}, {0, 1}};
        CaveGrid grid = CaveGrid.fromRows(rows);
        assertThat(grid.toRows()).isEqualTo(rows);
        assertThat(grid.toString()).isEqualTo("#.\n.#\n");
    }

    @Test
    @DisplayName("Malformed rows are rejected")
    void rejectsMalformedRows() {
        assertThatThrownBy(() -> CaveGrid.fromRows(new int[][]{{0, 1}, {0}})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CaveGrid.fromRows(new int[][]{{0, 2}})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CaveGrid(0, 3)).isInstanceOf(IllegalArgumentException.class);
    }
}
