package org.gridsnake.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.gridsnake.runtime.model.ArenaProperties;
import org.gridsnake.runtime.model.Direction;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.model.SnakeStart;

import java.time.Duration;

/**
 * Typed view of the {@code gridsnake} configuration block.
 *
 * @param arena          arena bounds
 * @param start          canonical start configuration
 * @param movementPeriod period of the movement clock
 * @param foodSpawnPeriod period of the food spawner
 * @param foodSeed       seed of the food placement random stream
 * @param foodMaxItems   cap on lying food items, 0 for no limit
 * @param frameRate      fixed update frequency of the engine in Hz
 */
public record GameConfiguration(ArenaProperties arena,
                                SnakeStart start,
                                Duration movementPeriod,
                                Duration foodSpawnPeriod,
                                long foodSeed,
                                int foodMaxItems,
                                int frameRate) {

    private static final String ROOT = "gridsnake";

    /**
     * Reads and validates the {@code gridsnake} block.
     *
     * @param config the resolved application configuration
     * @return the typed configuration
     * @throws ConfigException if a key is missing or has an invalid value
     */
    public static GameConfiguration fromConfig(final Config config) {
        final Config root = config.getConfig(ROOT);

        final int width = root.getInt("arena.width");
        final int height = root.getInt("arena.height");
        if (width <= 0 || height <= 0) {
            throw new ConfigException.BadValue(ROOT + ".arena", "dimensions must be positive, got " + width + "x" + height);
        }
        final ArenaProperties arena = new ArenaProperties(width, height);

        final Direction direction = root.getEnum(Direction.class, "snake.start-direction");
        final SnakeStart start = new SnakeStart(
            new GridPosition(root.getInt("snake.start.x"), root.getInt("snake.start.y")), direction);
        if (!arena.contains(start.headPosition()) || !arena.contains(start.segmentPosition())) {
            throw new ConfigException.BadValue(ROOT + ".snake.start",
                "snake at " + start.headPosition() + " heading " + direction + " does not fit arena " + arena);
        }

        final Duration movementPeriod = positive(root, "snake.movement-period");
        final Duration foodSpawnPeriod = positive(root, "food.spawn-period");

        final int maxItems = root.getInt("food.max-items");
        if (maxItems < 0) {
            throw new ConfigException.BadValue(ROOT + ".food.max-items", "must not be negative");
        }
        final int frameRate = root.getInt("engine.frame-rate");
        if (frameRate <= 0) {
            throw new ConfigException.BadValue(ROOT + ".engine.frame-rate", "must be positive");
        }

        return new GameConfiguration(arena, start, movementPeriod, foodSpawnPeriod,
            root.getLong("food.seed"), maxItems, frameRate);
    }

    /**
     * @return the duration of one engine frame
     */
    public Duration framePeriod() {
        return Duration.ofNanos(1_000_000_000L / frameRate);
    }

    private static Duration positive(final Config root, final String path) {
        final Duration value = root.getDuration(path);
        if (value.isZero() || value.isNegative()) {
            throw new ConfigException.BadValue(ROOT + "." + path, "must be positive, got " + value);
        }
        return value;
    }
}
