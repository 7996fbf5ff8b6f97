package org.gridsnake.runtime.food;

import org.gridsnake.runtime.Game;
import org.gridsnake.runtime.model.ArenaProperties;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.model.MovementClock;
import org.gridsnake.runtime.spi.IFramePlugin;
import org.gridsnake.runtime.spi.IRandomProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Drops one food item on a random cell every spawn period.
 * <p>
 * Cells are drawn uniformly from the whole arena; food may land on the snake or on another food
 * item. With a positive item cap, no food is spawned while the cap is reached.
 * </p>
 * <p>
 * The spawn period is measured with a {@link MovementClock}, the same fire-once repeating timer
 * that gates snake movement: a frame spanning several periods spawns at most one item.
 * </p>
 */
public class FoodSpawner implements IFramePlugin {

    private static final Logger LOG = LoggerFactory.getLogger(FoodSpawner.class);

    private final InMemoryFoodSource food;
    private final ArenaProperties arena;
    private final IRandomProvider random;
    private final MovementClock spawnTimer;
    private final int maxItems;

    /**
     * @param food        where spawned items go
     * @param arena       the arena to spawn in
     * @param random      source of cell coordinates
     * @param spawnPeriod time between two spawns
     * @param maxItems    maximum number of items lying around at once, 0 for no limit
     */
    public FoodSpawner(InMemoryFoodSource food, ArenaProperties arena, IRandomProvider random,
                       Duration spawnPeriod, int maxItems) {
        if (food == null || arena == null || random == null) {
            throw new NullPointerException("food, arena and random must not be null");
        }
        if (maxItems < 0) {
            throw new IllegalArgumentException("maxItems must not be negative: " + maxItems);
        }
        this.food = food;
        this.arena = arena;
        this.random = random;
        this.spawnTimer = new MovementClock(spawnPeriod);
        this.maxItems = maxItems;
    }

    @Override
    public void execute(Game game, Duration elapsed) {
        update(elapsed);
    }

    /**
     * Advances the spawn timer.
     *
     * @param elapsed time since the previous frame
     * @return true if an item was spawned
     */
    public boolean update(Duration elapsed) {
        if (!spawnTimer.tick(elapsed)) {
            return false;
        }
        if (maxItems > 0 && food.size() >= maxItems) {
            return false;
        }
        GridPosition position = new GridPosition(random.nextInt(arena.getWidth()), random.nextInt(arena.getHeight()));
        food.addFood(position);
        LOG.debug("Spawned food at {}", position);
        return true;
    }
}
