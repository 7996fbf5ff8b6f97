package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.BodyChain;
import org.gridsnake.runtime.model.EntityHandle;
import org.gridsnake.runtime.model.EntityKind;
import org.gridsnake.runtime.model.EntityStore;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.model.SnakeHead;
import org.gridsnake.runtime.model.SnakeStart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Creates and destroys the snake's entities.
 * <p>
 * Spawning builds the canonical start configuration: a head at the start cell and one segment
 * trailing it. Resetting destroys every chain entity and the head first, so a reset snake is
 * indistinguishable from a freshly spawned one.
 * </p>
 */
public final class SnakeSpawner {

    private static final Logger LOG = LoggerFactory.getLogger(SnakeSpawner.class);

    private SnakeSpawner() {
        // utility class
    }

    /**
     * Spawns the canonical snake into an empty state.
     *
     * @param state the game state; its chain must be empty
     */
    public static void spawn(GameState state) {
        if (!state.getChain().isEmpty()) {
            throw new IllegalStateException("Snake already spawned, chain length " + state.getChain().size());
        }
        SnakeStart start = state.getStart();
        EntityStore entities = state.getEntities();
        BodyChain chain = state.getChain();

        EntityHandle headEntity = entities.spawn(EntityKind.SNAKE_HEAD, start.headPosition());
        chain.append(headEntity);
        chain.append(spawnSegment(entities, start.segmentPosition()));
        state.setHead(new SnakeHead(headEntity, start.direction()));
        LOG.debug("Spawned snake at {} heading {}", start.headPosition(), start.direction());
    }

    /**
     * Destroys the current snake and spawns the canonical one. Pending growth and the pending
     * tail position are discarded.
     *
     * @param state the game state
     */
    public static void reset(GameState state) {
        EntityStore entities = state.getEntities();
        List<EntityHandle> handles = new ArrayList<>(state.getChain().handles());
        for (EntityHandle handle : handles) {
            entities.destroy(handle);
        }
        state.getHead().ifPresent(head -> entities.destroy(head.getEntity()));
        state.getChain().clear();
        state.setHead(null);
        state.setPendingTailPosition(null);
        state.getEvents().drainGrowth();
        state.incrementResetCount();
        spawn(state);
    }

    /**
     * Creates a body segment entity.
     *
     * @param entities the entity store
     * @param position where the segment appears
     * @return the new segment's handle
     */
    public static EntityHandle spawnSegment(EntityStore entities, GridPosition position) {
        return entities.spawn(EntityKind.SNAKE_SEGMENT, position);
    }
}
