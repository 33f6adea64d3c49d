package org.spelunk.runtime.placement;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.spelunk.junit.extensions.logging.ExpectLog;
import org.spelunk.junit.extensions.logging.LogLevel;
import org.spelunk.junit.extensions.logging.LogWatchExtension;
import org.spelunk.runtime.analysis.JumpPhysics;
import org.spelunk.runtime.analysis.PhysicsAwareReachabilityAnalyzer;
import org.spelunk.runtime.internal.services.SeededRandomProvider;
import org.spelunk.runtime.model.CaveGrid;
import org.spelunk.runtime.model.Point;
import org.spelunk.runtime.model.TestGrids;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PlayerSpawnPlacerTest {

    private static final PhysicsAwareReachabilityAnalyzer ANALYZER =
        new PhysicsAwareReachabilityAnalyzer(JumpPhysics.defaults());

    /** Ground only on the right; the left half drops out of the map. */
    private static final CaveGrid RIGHT_LEDGE = TestGrids.parse(
        "############",
        "#..........#",
        "#..........#",
        "#.....######",
        "#.....######");

    @Test
    @DisplayName("Spawn lands on safe ground left of the boundary")
    void placesOnLeft() {
        PlacementContext context = new PlacementContext(TestGrids.flatRoom(20, 6), ANALYZER);
        PlayerSpawnPlacer placer = new PlayerSpawnPlacer(100, 1, 0.5, true);

        PlacementResult<SpawnPlacement> result = placer.place(context, SeededRandomProvider.fromSeed("spawn"));

        assertThat(result.success()).isTrue();
        Point spawn = result.value().position();
        assertThat(spawn.y()).isEqualTo(4);
        assertThat(spawn.x()).isBetween(2, 9);
        assertThat(result.value().fallbackUsed()).isFalse();
        assertThat(placer.validate(context, result.value())).isTrue();
    }

    @Test
    @DisplayName("Same seed gives the same spawn")
    void deterministic() {
        PlacementContext context = new PlacementContext(TestGrids.flatRoom(30, 6), ANALYZER);
        PlayerSpawnPlacer placer = new PlayerSpawnPlacer(100, 1, 0.3, true);
        assertThat(placer.place(context, SeededRandomProvider.fromSeed("s")).value())
            .isEqualTo(placer.place(context, SeededRandomProvider.fromSeed("s")).value());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No safe spawn left of x=6.*")
    @DisplayName("Falls back to the whole map when the left side has no ground")
    void fallsBack() {
        PlacementContext context = new PlacementContext(RIGHT_LEDGE, ANALYZER);

        PlacementResult<SpawnPlacement> result = new PlayerSpawnPlacer(100, 1, 0.5, true)
            .place(context, SeededRandomProvider.fromSeed("fallback"));

        assertThat(result.success()).isTrue();
        assertThat(result.value().fallbackUsed()).isTrue();
        assertThat(result.value().position().y()).isEqualTo(2);
        assertThat(result.value().position().x()).isBetween(7, 9);
    }

    @Test
    @DisplayName("Without fallback an unsatisfiable side constraint fails")
    void failsWithoutFallback() {
        PlacementResult<SpawnPlacement> result = new PlayerSpawnPlacer(100, 1, 0.5, false)
            .place(new PlacementContext(RIGHT_LEDGE, ANALYZER), SeededRandomProvider.fromSeed("x"));

        assertThat(result.success()).isFalse();
        assertThat(result.value()).isNull();
        assertThat(result.error()).startsWith("No valid spawn position");
    }

    @Test
    @DisplayName("Safety check requires headroom and solid ground around the spawn")
    void safety() {
        PlayerSpawnPlacer placer = new PlayerSpawnPlacer(10, 1, 1.0, false);
        CaveGrid room = TestGrids.flatRoom(10, 6);
        assertThat(placer.isSafe(room, new Point(4, 4))).isTrue();
        assertThat(placer.isSafe(room, new Point(1, 4))).isFalse();
        assertThat(placer.isSafe(room, new Point(4, 3))).isFalse();
        assertThat(placer.isSafe(RIGHT_LEDGE, new Point(6, 2))).isFalse();
    }

    @Test
    @DisplayName("Out-of-range settings are rejected")
    void rejectsSettings() {
        assertThatThrownBy(() -> new PlayerSpawnPlacer(0, 1, 0.5, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlayerSpawnPlacer(10, -1, 0.5, true)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PlayerSpawnPlacer(10, 1, 0.0, true)).isInstanceOf(IllegalArgumentException.class);
    }
}
