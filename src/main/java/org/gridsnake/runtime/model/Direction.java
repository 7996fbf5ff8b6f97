package org.gridsnake.runtime.model;

/**
 * The four headings a snake can move in. The vertical axis points up: {@link #UP} increases y.
 */
public enum Direction {
    LEFT(-1, 0),
    UP(0, 1),
    RIGHT(1, 0),
    DOWN(0, -1);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    /**
     * @return the horizontal component of one step in this direction
     */
    public int dx() {
        return dx;
    }

    /**
     * @return the vertical component of one step in this direction
     */
    public int dy() {
        return dy;
    }

    /**
     * Returns the direction pointing the other way.
     *
     * @return LEFT for RIGHT, UP for DOWN and vice versa
     */
    public Direction opposite() {
        return switch (this) {
            case LEFT -> RIGHT;
            case UP -> DOWN;
            case RIGHT -> LEFT;
            case DOWN -> UP;
        };
    }
}
