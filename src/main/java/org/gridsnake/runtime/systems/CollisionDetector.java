package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.model.ArenaProperties;
import org.gridsnake.runtime.model.FrameEvents;
import org.gridsnake.runtime.model.FrameEvents.CollisionKind;
import org.gridsnake.runtime.model.GridPosition;

import java.util.List;

/**
 * Checks a new head position against the arena bounds and the pre-shift body.
 */
public final class CollisionDetector {

    private CollisionDetector() {
        // utility class
    }

    public static boolean isOutOfBounds(ArenaProperties arena, GridPosition newHead) {
        return !arena.contains(newHead);
    }

    /**
     * The whole pre-shift snapshot counts, head and tail included.
     */
    public static boolean hitsBody(List<GridPosition> preShiftSnapshot, GridPosition newHead) {
        return preShiftSnapshot.contains(newHead);
    }

    /**
     * Runs both checks and signals game-over for each one that hits.
     *
     * @return true if any collision was detected
     */
    public static boolean detect(ArenaProperties arena, List<GridPosition> preShiftSnapshot,
                                 GridPosition newHead, FrameEvents events) {
        boolean collided = false;
        if (isOutOfBounds(arena, newHead)) {
            events.signalGameOver(CollisionKind.BOUNDARY);
            collided = true;
        }
        if (hitsBody(preShiftSnapshot, newHead)) {
            events.signalGameOver(CollisionKind.SELF);
            collided = true;
        }
        return collided;
    }
}
