package org.gridsnake.engine;

import org.gridsnake.node.config.GameConfiguration;
import org.gridsnake.runtime.Game;
import org.gridsnake.runtime.food.FoodSpawner;
import org.gridsnake.runtime.food.InMemoryFoodSource;
import org.gridsnake.runtime.input.KeyBindings;
import org.gridsnake.runtime.internal.services.SeededRandomProvider;
import org.gridsnake.runtime.spi.IInputSource;
import org.gridsnake.runtime.spi.IRandomProvider;

/**
 * Builds fully wired games from configuration.
 */
public final class GameFactory {

    private GameFactory() {
    }

    /**
     * Creates a game with an in-memory food source and a seeded food spawner.
     *
     * @param configuration the game configuration
     * @param input         the key state the game reads
     * @return the new game
     */
    public static Game create(GameConfiguration configuration, IInputSource input) {
        return create(configuration, input, true);
    }

    /**
     * @param withFoodSpawner false to leave food placement to the caller
     */
    public static Game create(GameConfiguration configuration, IInputSource input, boolean withFoodSpawner) {
        InMemoryFoodSource food = new InMemoryFoodSource();
        Game game = new Game(configuration.arena(), configuration.start(), configuration.movementPeriod(),
            food, input, KeyBindings.defaults());
        if (withFoodSpawner) {
            IRandomProvider random = new SeededRandomProvider(configuration.foodSeed()).deriveFor("food", 0L);
            game.addPlugin(new FoodSpawner(food, configuration.arena(), random,
                configuration.foodSpawnPeriod(), configuration.foodMaxItems()));
        }
        return game;
    }
}
