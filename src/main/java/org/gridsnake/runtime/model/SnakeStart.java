package org.gridsnake.runtime.model;

/**
 * Canonical start configuration of the snake, used at first spawn and after every reset.
 * The single body segment trails the head by one cell, opposite to the start direction.
 *
 * @param headPosition where the head spawns
 * @param direction    the initial heading
 */
public record SnakeStart(GridPosition headPosition, Direction direction) {

    /**
     * Head at (3,3) moving up, segment at (3,2).
     */
    public static final SnakeStart DEFAULT = new SnakeStart(new GridPosition(3, 3), Direction.UP);

    public SnakeStart {
        if (headPosition == null || direction == null) {
            throw new NullPointerException("headPosition and direction must not be null");
        }
    }

    /**
     * @return the spawn position of the first body segment
     */
    public GridPosition segmentPosition() {
        return headPosition.step(direction.opposite());
    }
}
