package org.gridsnake.runtime.model;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Generational slot store for the snake's entities.
 * <p>
 * Each entity is a position plus an {@link EntityKind}. Entities are addressed by
 * {@link EntityHandle}s; destroying an entity bumps the generation of its slot so that any
 * handle still pointing at it resolves to nothing instead of to a newer occupant.
 * </p>
 * <p>
 * <strong>Thread Safety:</strong> Not thread-safe. Owned by the single game thread.
 * </p>
 */
public class EntityStore {

    private static final class Slot {
        int generation;
        boolean alive;
        EntityKind kind;
        GridPosition position;
    }

    private final List<Slot> slots = new ArrayList<>();
    private final NavigableSet<Integer> freeSlots = new TreeSet<>();
    private int liveCount = 0;

    /**
     * Creates a new entity.
     *
     * @param kind     the kind of entity
     * @param position its initial position
     * @return a handle to the new entity
     */
    public EntityHandle spawn(EntityKind kind, GridPosition position) {
        if (kind == null || position == null) {
            throw new NullPointerException("kind and position must not be null");
        }
        final int index;
        final Slot slot;
        if (freeSlots.isEmpty()) {
            index = slots.size();
            slot = new Slot();
            slots.add(slot);
        } else {
            // Lowest freed slot first, independent of destroy order.
            index = freeSlots.pollFirst();
            slot = slots.get(index);
        }
        slot.alive = true;
        slot.kind = kind;
        slot.position = position;
        liveCount++;
        return new EntityHandle(index, slot.generation);
    }

    /**
     * Resolves the position of an entity.
     *
     * @param handle the entity handle
     * @return the position, or empty if the handle is stale or unknown
     */
    public Optional<GridPosition> getPosition(EntityHandle handle) {
        Slot slot = resolve(handle);
        return slot == null ? Optional.empty() : Optional.of(slot.position);
    }

    /**
     * Resolves the kind of an entity.
     *
     * @param handle the entity handle
     * @return the kind, or empty if the handle is stale or unknown
     */
    public Optional<EntityKind> getKind(EntityHandle handle) {
        Slot slot = resolve(handle);
        return slot == null ? Optional.empty() : Optional.of(slot.kind);
    }

    /**
     * Moves an entity.
     *
     * @param handle   the entity handle
     * @param position the new position
     * @return true if the entity exists and was updated
     */
    public boolean setPosition(EntityHandle handle, GridPosition position) {
        Slot slot = resolve(handle);
        if (slot == null) {
            return false;
        }
        slot.position = position;
        return true;
    }

    /**
     * Destroys an entity. Destroying a stale handle has no effect.
     *
     * @param handle the entity handle
     * @return true if a live entity was destroyed
     */
    public boolean destroy(EntityHandle handle) {
        Slot slot = resolve(handle);
        if (slot == null) {
            return false;
        }
        slot.alive = false;
        slot.position = null;
        slot.kind = null;
        slot.generation++;
        liveCount--;
        freeSlots.add(handle.index());
        return true;
    }

    public boolean isAlive(EntityHandle handle) {
        return resolve(handle) != null;
    }

    /**
     * @return the number of live entities
     */
    public int size() {
        return liveCount;
    }

    private Slot resolve(EntityHandle handle) {
        if (handle == null || handle.index() < 0 || handle.index() >= slots.size()) {
            return null;
        }
        Slot slot = slots.get(handle.index());
        if (!slot.alive || slot.generation != handle.generation()) {
            return null;
        }
        return slot;
    }
}
