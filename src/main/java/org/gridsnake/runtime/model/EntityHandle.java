package org.gridsnake.runtime.model;

/**
 * Addresses an entity in an {@link EntityStore}. A handle becomes stale once its entity is
 * destroyed; the slot may be reused later under a higher generation.
 *
 * @param index      slot index in the store
 * @param generation generation of the slot at the time the entity was spawned
 */
public record EntityHandle(int index, int generation) {

    @Override
    public String toString() {
        return "#" + index + "v" + generation;
    }
}
