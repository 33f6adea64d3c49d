package org.spelunk.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.spelunk.runtime.placement.GoalMode;
import org.spelunk.runtime.worldgen.SeederMode;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GenerationSettingsTest {

    private static GenerationSettings withOverride(String hocon) {
        Config config = ConfigFactory.parseString(hocon).withFallback(ConfigLoader.loadResource("test-generation.conf")).resolve();
        return GenerationSettings.fromConfig(config);
    }

    @Test
    @DisplayName("Defaults come from reference.conf")
    void defaults() {
        GenerationSettings settings = GenerationSettings.defaults();

        assertThat(settings.seed().width()).isEqualTo(100);
        assertThat(settings.seed().height()).isEqualTo(60);
        assertThat(settings.seed().initialWallRatio()).isEqualTo(0.45);
        assertThat(settings.automaton().simulationSteps()).isEqualTo(4);
        assertThat(settings.automaton().birthThreshold()).isEqualTo(5);
        assertThat(settings.automaton().survivalThreshold()).isEqualTo(4);
        assertThat(settings.connectivity().minConnectivityScore()).isEqualTo(1.0);
        assertThat(settings.physics().maxRiseTiles()).isEqualTo(3);
        assertThat(settings.goal().mode()).isEqualTo(GoalMode.AFTER_PLATFORMS);
        assertThat(settings.coins().reachableOnly()).isTrue();
        assertThat(settings.enemies().type()).isEqualTo("loophound");
        assertThat(settings.seeder().mode()).isEqualTo(SeederMode.NOISE);
        assertThat(settings.seeder().corridorHeight()).isEqualTo(8);
        assertThat(settings.seeder().corridorThreshold()).isEqualTo(0.7);
        assertThat(settings.seeder().nonCorridorThreshold()).isEqualTo(0.5);
        assertThat(settings.quality().maxWallIslands()).isEqualTo(5);
    }

    @Test
    @DisplayName("Seeder and quality blocks are validated like the rest")
    void seederAndQuality() {
        assertThat(withOverride("spelunk.generation.seeder = GRAPH").seeder().mode()).isEqualTo(SeederMode.GRAPH);
        assertThatThrownBy(() -> withOverride("spelunk.generation.seeder = perlin"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("perlin");
        assertThatThrownBy(() -> withOverride("spelunk.generation.graph.corridor-height = 0"))
            .hasMessage("spelunk.generation.graph.corridor-height must be between 1 and 100, got 0");
        assertThatThrownBy(() -> withOverride("spelunk.quality { min-floor-ratio = 0.8, max-floor-ratio = 0.2 }"))
            .hasMessageContaining("min-floor-ratio");
    }

    @Test
    @DisplayName("Resource layer overrides the defaults it names")
    void resourceLayer() {
        GenerationSettings settings = GenerationSettings.fromConfig(ConfigLoader.loadResource("test-generation.conf"));
        assertThat(settings.seed().seed()).isEqualTo("test-cave");
        assertThat(settings.seed().width()).isEqualTo(48);
        assertThat(settings.coins().count()).isEqualTo(6);
        assertThat(settings.coins().deadEndWeight()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("Out-of-range values name the offending key")
    void rangeErrors() {
        assertThatThrownBy(() -> withOverride("spelunk.generation.width = 5"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("spelunk.generation.width must be between 10 and 1000, got 5");
        assertThatThrownBy(() -> withOverride("spelunk.generation.initial-wall-ratio = 1.2"))
            .hasMessageStartingWith("spelunk.generation.initial-wall-ratio");
        assertThatThrownBy(() -> withOverride("spelunk.generation.birth-threshold = 9"))
            .hasMessageStartingWith("spelunk.generation.birth-threshold");
        assertThatThrownBy(() -> withOverride("spelunk.spawn.left-side-boundary = 0"))
            .hasMessageStartingWith("spelunk.spawn.left-side-boundary");
    }

    @Test
    @DisplayName("Cross-field rules are enforced")
    void crossFieldRules() {
        assertThatThrownBy(() -> withOverride("spelunk.coins.dead-end-weight = 0.9"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("weights must sum to 1.0");
        assertThatThrownBy(() -> withOverride("spelunk.platforms { min-size = 4, max-size = 3 }"))
            .hasMessageContaining("max-size");
        assertThatThrownBy(() -> withOverride("spelunk.enemies.type = dragon"))
            .hasMessageContaining("dragon");
        assertThatThrownBy(() -> withOverride("spelunk.goal.mode = sideways"))
            .hasMessageContaining("sideways");
        assertThatThrownBy(() -> withOverride("spelunk.generation.seed = \"  \""))
            .hasMessageContaining("seed");
    }

    @Test
    @DisplayName("Missing or mistyped values are reported as invalid configuration")
    void missingValues() {
        assertThatThrownBy(() -> GenerationSettings.fromConfig(ConfigFactory.parseString("spelunk {}")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid spelunk configuration");
        assertThatThrownBy(() -> withOverride("spelunk.generation.width = wide"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageStartingWith("Invalid spelunk configuration");
    }

    @Test
    @DisplayName("Seed and size can be overridden after loading")
    void overrides() {
        GenerationSettings settings = GenerationSettings.defaults().withSeed("other").withSize(30, 20);
        assertThat(settings.seed().seed()).isEqualTo("other");
        assertThat(settings.seed().width()).isEqualTo(30);
        assertThat(settings.seed().height()).isEqualTo(20);
        assertThat(settings.seed().initialWallRatio()).isEqualTo(0.45);
        assertThatThrownBy(() -> settings.withSize(9, 20)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> settings.withSeed(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}
