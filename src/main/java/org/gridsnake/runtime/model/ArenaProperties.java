package org.gridsnake.runtime.model;

/**
 * Represents the fixed bounds of the playing field.
 * The arena spans the cells {@code [0, width) x [0, height)} and does not wrap around at its edges.
 */
public class ArenaProperties {
    private final int width;
    private final int height;

    /**
     * Creates new arena properties.
     *
     * @param width  The number of columns, must be positive
     * @param height The number of rows, must be positive
     */
    public ArenaProperties(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Arena dimensions must be positive: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * Checks whether a position lies inside the arena.
     *
     * @param position The position to check
     * @return true if {@code 0 <= x < width} and {@code 0 <= y < height}
     */
    public boolean contains(GridPosition position) {
        return position.x() >= 0 && position.y() >= 0
            && position.x() < width && position.y() < height;
    }

    /**
     * Calculates the next position from a current position and a heading.
     * The result is not clamped, so it may lie outside the arena.
     *
     * @param currentPos The current position
     * @param direction  The heading to move in
     * @return The next position
     */
    public GridPosition getNextPosition(GridPosition currentPos, Direction direction) {
        return currentPos.step(direction);
    }

    /**
     * @return the total number of cells
     */
    public int getCellCount() {
        return width * height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
