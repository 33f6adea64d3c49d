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
class GoalPlacerTest {

    private static final PhysicsAwareReachabilityAnalyzer ANALYZER =
        new PhysicsAwareReachabilityAnalyzer(JumpPhysics.defaults());

    private static final CaveGrid STEP = TestGrids.parse(
        "##########",
        "#........#",
        "#........#",
        "#........#",
        "#........#",
        "#........#",
        "#....#...#",
        "##########");

    private final PlacementContext context = new PlacementContext(STEP, ANALYZER).withSpawn(new Point(1, 6));

    @Test
    @DisplayName("Before platforms the goal is the farthest cell walking cannot reach")
    void beforePlatforms() {
        GoalPlacer placer = new GoalPlacer(GoalMode.BEFORE_PLATFORMS, 3, 0.5, 20);

        PlacementResult<GoalPlacement> result = placer.place(context, SeededRandomProvider.fromSeed("goal"));

        assertThat(result.success()).isTrue();
        assertThat(result.value().position()).isEqualTo(new Point(8, 6));
        assertThat(result.value().reachableByWalking()).isFalse();
        assertThat(result.value().mode()).isEqualTo(GoalMode.BEFORE_PLATFORMS);
        assertThat(placer.validate(context, result.value())).isTrue();
    }

    @Test
    @DisplayName("After platforms the goal is a reachable right-most cell")
    void afterPlatforms() {
        GoalPlacer placer = new GoalPlacer(GoalMode.AFTER_PLATFORMS, 3, 0.5, 1);

        PlacementResult<GoalPlacement> result = placer.place(context, SeededRandomProvider.fromSeed("goal"));

        assertThat(result.success()).isTrue();
        assertThat(result.value().position()).isEqualTo(new Point(8, 6));
        assertThat(result.value().visible()).isTrue();
        assertThat(result.value().distance()).isEqualTo(7.0);
        assertThat(placer.validate(context, result.value())).isTrue();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "No goal candidate right of x=9.*")
    @DisplayName("An empty right side falls back to the whole map")
    void fallsBack() {
        PlacementResult<GoalPlacement> result = new GoalPlacer(GoalMode.AFTER_PLATFORMS, 3, 0.95, 1)
            .place(context, SeededRandomProvider.fromSeed("goal"));

        assertThat(result.success()).isTrue();
        assertThat(result.value().fallbackUsed()).isTrue();
        assertThat(result.value().position()).isEqualTo(new Point(8, 6));
    }

    @Test
    @DisplayName("Before platforms fails when walking reaches everything")
    void beforePlatformsFailsOnFlatRoom() {
        PlacementContext flat = new PlacementContext(TestGrids.flatRoom(12, 5), ANALYZER).withSpawn(new Point(1, 3));

        PlacementResult<GoalPlacement> result = new GoalPlacer(GoalMode.BEFORE_PLATFORMS, 3, 0.5, 20)
            .place(flat, SeededRandomProvider.fromSeed("goal"));

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("not reachable by walking");
    }

    @Test
    @DisplayName("Goal placement needs a spawn")
    void requiresSpawn() {
        GoalPlacer placer = new GoalPlacer(GoalMode.AFTER_PLATFORMS, 3, 0.5, 1);
        PlacementContext noSpawn = new PlacementContext(STEP, ANALYZER);
        assertThatThrownBy(() -> placer.place(noSpawn, SeededRandomProvider.fromSeed("x")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Visibility needs an open neighbour")
    void visibility() {
        CaveGrid grid = TestGrids.parse(
            "###",
            "#.#",
            "###");
        assertThat(GoalPlacer.isVisible(grid, new Point(1, 1))).isFalse();
        assertThat(GoalPlacer.isVisible(STEP, new Point(4, 6))).isTrue();
    }

    @Test
    @DisplayName("Goal modes parse from configuration strings")
    void parseMode() {
        assertThat(GoalMode.parse("before-platforms")).isEqualTo(GoalMode.BEFORE_PLATFORMS);
        assertThat(GoalMode.parse(" After_Platforms ")).isEqualTo(GoalMode.AFTER_PLATFORMS);
        assertThatThrownBy(() -> GoalMode.parse("sideways")).isInstanceOf(IllegalArgumentException.class);
    }
}
