package org.gridsnake.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.gridsnake.runtime.model.Direction;
import org.gridsnake.runtime.model.GridPosition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GameConfigurationTest {

    private static Config withDefaults(String hocon) {
        return ConfigFactory.parseString(hocon)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }

    @Test
    void defaults_matchCanonicalGame() {
        GameConfiguration configuration = GameConfiguration.fromConfig(withDefaults(""));

        assertThat(configuration.arena().getWidth()).isEqualTo(10);
        assertThat(configuration.arena().getHeight()).isEqualTo(10);
        assertThat(configuration.start().headPosition()).isEqualTo(new GridPosition(3, 3));
        assertThat(configuration.start().segmentPosition()).isEqualTo(new GridPosition(3, 2));
        assertThat(configuration.start().direction()).isEqualTo(Direction.UP);
        assertThat(configuration.movementPeriod()).isEqualTo(Duration.ofMillis(150));
        assertThat(configuration.foodSpawnPeriod()).isEqualTo(Duration.ofSeconds(1));
        assertThat(configuration.foodSeed()).isEqualTo(42L);
        assertThat(configuration.foodMaxItems()).isZero();
        assertThat(configuration.framePeriod()).isEqualTo(Duration.ofNanos(1_000_000_000L / 64));
    }

    @Test
    void customStart_isApplied() {
        GameConfiguration configuration = GameConfiguration.fromConfig(withDefaults(
            "gridsnake.snake { start { x = 1, y = 5 }, start-direction = RIGHT }"));

        assertThat(configuration.start().headPosition()).isEqualTo(new GridPosition(1, 5));
        assertThat(configuration.start().segmentPosition()).isEqualTo(new GridPosition(0, 5));
    }

    @Test
    void nonPositiveWidth_isRejected() {
        assertThatThrownBy(() -> GameConfiguration.fromConfig(withDefaults("gridsnake.arena.width = 0")))
            .isInstanceOf(ConfigException.BadValue.class)
            .hasMessageContaining("gridsnake.arena");
    }

    @Test
    void startOutsideArena_isRejected() {
        assertThatThrownBy(() -> GameConfiguration.fromConfig(withDefaults("gridsnake.snake.start.x = 10")))
            .isInstanceOf(ConfigException.BadValue.class);
    }

    @Test
    void segmentOutsideArena_isRejected() {
        // heading RIGHT from x = 0 puts the first segment at x = -1
        assertThatThrownBy(() -> GameConfiguration.fromConfig(withDefaults(
            "gridsnake.snake { start.x = 0, start-direction = RIGHT }")))
            .isInstanceOf(ConfigException.BadValue.class)
            .hasMessageContaining("does not fit");
    }

    @Test
    void unknownDirection_isRejected() {
        assertThatThrownBy(() -> GameConfiguration.fromConfig(withDefaults("gridsnake.snake.start-direction = NORTH")))
            .isInstanceOf(ConfigException.class);
    }

    @Test
    void zeroMovementPeriod_isRejected() {
        assertThatThrownBy(() -> GameConfiguration.fromConfig(withDefaults("gridsnake.snake.movement-period = 0ms")))
            .isInstanceOf(ConfigException.BadValue.class);
    }
}
