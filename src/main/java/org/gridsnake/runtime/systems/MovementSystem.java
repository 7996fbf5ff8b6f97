package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.BodyChain;
import org.gridsnake.runtime.model.EntityStore;
import org.gridsnake.runtime.model.FrameEvents;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.model.SnakeHead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Advances the snake by one cell whenever the movement clock fires.
 * <p>
 * A tick snapshots all chain positions before touching anything, moves the head one cell along
 * its heading, checks collisions, then moves every segment into the snapshot position of its
 * predecessor. The tail's snapshot position is kept as the spawn point for growth.
 * </p>
 */
public class MovementSystem {

    private static final Logger LOG = LoggerFactory.getLogger(MovementSystem.class);

    /**
     * Ticks the clock and, if it fires, moves the snake.
     *
     * @param state   the game state
     * @param elapsed time since the previous frame
     * @return true if the clock fired this frame
     */
    public boolean update(GameState state, Duration elapsed) {
        if (!state.getClock().tick(elapsed)) {
            return false;
        }
        FrameEvents events = state.getEvents();
        events.markTickFired();
        if (!move(state)) {
            events.markTickAborted();
            state.incrementAbortedTicks();
        } else {
            state.incrementTickCount();
        }
        return true;
    }

    /**
     * Performs one movement step.
     *
     * @param state the game state
     * @return false if the tick was aborted without any mutation
     */
    boolean move(GameState state) {
        Optional<SnakeHead> maybeHead = state.getHead();
        BodyChain chain = state.getChain();
        if (maybeHead.isEmpty() || chain.isEmpty()) {
            LOG.warn("Tick skipped: no snake present (chain length {})", chain.size());
            return false;
        }
        SnakeHead head = maybeHead.get();
        EntityStore entities = state.getEntities();

        List<GridPosition> snapshot = state.resolveChainPositions();
        if (snapshot.size() != chain.size()) {
            LOG.warn("Tick aborted: resolved {} positions for a chain of length {}", snapshot.size(), chain.size());
            return false;
        }

        GridPosition newHead = state.getArena().getNextPosition(snapshot.get(0), head.getDirection());
        CollisionDetector.detect(state.getArena(), snapshot, newHead, state.getEvents());

        entities.setPosition(chain.head(), newHead);
        for (int i = 1; i < chain.size(); i++) {
            entities.setPosition(chain.get(i), snapshot.get(i - 1));
        }
        state.setPendingTailPosition(snapshot.get(snapshot.size() - 1));

        if (LOG.isDebugEnabled()) {
            LOG.debug("Tick={} head {} -> {} heading {} length {}",
                state.getTickCount(), snapshot.get(0), newHead, head.getDirection(), chain.size());
        }
        return true;
    }
}
