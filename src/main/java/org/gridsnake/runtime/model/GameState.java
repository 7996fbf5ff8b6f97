package org.gridsnake.runtime.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * All mutable state of one game, passed explicitly to each frame system.
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Mutated by exactly one system at a time on the
 * game thread, in the fixed frame order.
 * </p>
 */
public class GameState {
    private final ArenaProperties arena;
    private final SnakeStart start;
    private final EntityStore entities = new EntityStore();
    private final BodyChain chain = new BodyChain();
    private final MovementClock clock;
    private final FrameEvents events = new FrameEvents();

    private SnakeHead head;
    private GridPosition pendingTailPosition;

    private long tickCount = 0L;
    private long frameCount = 0L;
    private int resetCount = 0;
    private long abortedTicks = 0L;
    private long foodEaten = 0L;

    /**
     * Creates an empty game state. The snake is spawned separately.
     *
     * @param arena          the arena bounds
     * @param start          the canonical start configuration
     * @param movementPeriod the movement clock period
     */
    public GameState(ArenaProperties arena, SnakeStart start, Duration movementPeriod) {
        if (arena == null || start == null) {
            throw new NullPointerException("arena and start must not be null");
        }
        if (!arena.contains(start.headPosition()) || !arena.contains(start.segmentPosition())) {
            throw new IllegalArgumentException("Start configuration " + start + " does not fit arena " + arena);
        }
        this.arena = arena;
        this.start = start;
        this.clock = new MovementClock(movementPeriod);
    }

    public ArenaProperties getArena() {
        return arena;
    }

    public SnakeStart getStart() {
        return start;
    }

    public EntityStore getEntities() {
        return entities;
    }

    public BodyChain getChain() {
        return chain;
    }

    public MovementClock getClock() {
        return clock;
    }

    public FrameEvents getEvents() {
        return events;
    }

    public Optional<SnakeHead> getHead() {
        return Optional.ofNullable(head);
    }

    public void setHead(SnakeHead head) {
        this.head = head;
    }

    public Optional<GridPosition> getPendingTailPosition() {
        return Optional.ofNullable(pendingTailPosition);
    }

    public void setPendingTailPosition(GridPosition pendingTailPosition) {
        this.pendingTailPosition = pendingTailPosition;
    }

    /**
     * Resolves the current chain positions in chain order. Stale handles are skipped, so the
     * result may be shorter than the chain.
     *
     * @return the resolvable positions, head first
     */
    public List<GridPosition> resolveChainPositions() {
        List<GridPosition> positions = new ArrayList<>(chain.size());
        for (EntityHandle handle : chain.handles()) {
            entities.getPosition(handle).ifPresent(positions::add);
        }
        return positions;
    }

    /**
     * @return the head position, or empty if there is no head
     */
    public Optional<GridPosition> getHeadPosition() {
        return getHead().flatMap(h -> entities.getPosition(h.getEntity()));
    }

    public long getTickCount() {
        return tickCount;
    }

    public void incrementTickCount() {
        tickCount++;
    }

    public long getFrameCount() {
        return frameCount;
    }

    public void incrementFrameCount() {
        frameCount++;
    }

    public int getResetCount() {
        return resetCount;
    }

    public void incrementResetCount() {
        resetCount++;
    }

    public long getAbortedTicks() {
        return abortedTicks;
    }

    public void incrementAbortedTicks() {
        abortedTicks++;
    }

    public long getFoodEaten() {
        return foodEaten;
    }

    public void incrementFoodEaten() {
        foodEaten++;
    }
}
