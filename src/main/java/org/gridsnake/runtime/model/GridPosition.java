package org.gridsnake.runtime.model;

/**
 * Immutable grid-cell coordinate. Values are not clamped and may lie outside the arena.
 */
public record GridPosition(int x, int y) {

    public static GridPosition of(int x, int y) {
        return new GridPosition(x, y);
    }

    /**
     * Returns the neighbouring cell one step away in the given direction.
     *
     * @param direction the heading to step in
     * @return the adjacent position
     */
    public GridPosition step(Direction direction) {
        return new GridPosition(x + direction.dx(), y + direction.dy());
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
