package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.spi.IFoodSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Lets the head eat whatever food lies on its cell. Every item eaten is removed from the food
 * source and queues one growth event.
 */
public class FoodConsumptionSystem {

    private static final Logger LOG = LoggerFactory.getLogger(FoodConsumptionSystem.class);

    /**
     * @param state the game state
     * @param food  the food source
     * @return the number of items eaten
     */
    public int detect(GameState state, IFoodSource food) {
        Optional<GridPosition> headPosition = state.getHeadPosition();
        if (headPosition.isEmpty()) {
            return 0;
        }
        GridPosition head = headPosition.get();
        int eaten = 0;
        List<GridPosition> foodPositions = food.getFoodPositions();
        for (GridPosition position : foodPositions) {
            if (position.equals(head) && food.removeFood(position)) {
                state.getEvents().queueGrowth();
                state.incrementFoodEaten();
                eaten++;
            }
        }
        if (eaten > 0) {
            LOG.debug("Ate {} food item(s) at {}", eaten, head);
        }
        return eaten;
    }
}
