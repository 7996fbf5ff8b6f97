package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.EntityHandle;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.GridPosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Appends one segment at the pending tail position for every queued growth event.
 */
public class GrowthSystem {

    private static final Logger LOG = LoggerFactory.getLogger(GrowthSystem.class);

    /**
     * @param state the game state
     * @return the number of segments appended
     */
    public int apply(GameState state) {
        int growth = state.getEvents().drainGrowth();
        if (growth == 0) {
            return 0;
        }
        Optional<GridPosition> tail = state.getPendingTailPosition();
        if (tail.isEmpty()) {
            LOG.warn("Dropped {} growth event(s): no pending tail position", growth);
            return 0;
        }
        for (int i = 0; i < growth; i++) {
            EntityHandle segment = SnakeSpawner.spawnSegment(state.getEntities(), tail.get());
            state.getChain().append(segment);
        }
        LOG.debug("Grew by {} to length {}", growth, state.getChain().size());
        return growth;
    }
}
