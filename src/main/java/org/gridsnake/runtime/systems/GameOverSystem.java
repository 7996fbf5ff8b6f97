package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.FrameEvents;
import org.gridsnake.runtime.model.GameState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes the game-over event and resets the snake within the same frame.
 */
public class GameOverSystem {

    private static final Logger LOG = LoggerFactory.getLogger(GameOverSystem.class);

    /**
     * @param state the game state
     * @return true if a reset was performed
     */
    public boolean apply(GameState state) {
        FrameEvents events = state.getEvents();
        if (!events.isGameOver()) {
            return false;
        }
        LOG.info("Game over at tick {}: {} collision with length {}",
            state.getTickCount(), events.getCollision(), state.getChain().size());
        SnakeSpawner.reset(state);
        return true;
    }
}
