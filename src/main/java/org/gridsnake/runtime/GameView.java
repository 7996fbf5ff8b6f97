package org.gridsnake.runtime;

import org.gridsnake.runtime.model.Direction;
import org.gridsnake.runtime.model.GridPosition;

import java.util.List;

/**
 * Immutable snapshot of a game for presentation.
 *
 * @param width       arena width in cells
 * @param height      arena height in cells
 * @param chain       chain positions, head first
 * @param headPresent whether a head exists
 * @param direction   the head's heading, or null without a head
 * @param food        food positions
 * @param tick        number of committed movement ticks
 * @param frame       number of frames run
 * @param resets      number of resets after game-over
 */
public record GameView(int width,
                       int height,
                       List<GridPosition> chain,
                       boolean headPresent,
                       Direction direction,
                       List<GridPosition> food,
                       long tick,
                       long frame,
                       int resets) {

    public GameView {
        chain = List.copyOf(chain);
        food = List.copyOf(food);
    }

    /**
     * @return the snake's length, which doubles as the score
     */
    public int length() {
        return chain.size();
    }
}
