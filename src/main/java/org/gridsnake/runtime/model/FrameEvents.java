package org.gridsnake.runtime.model;

/**
 * Events produced and drained within a single frame. Producers always run before consumers.
 */
public class FrameEvents {
    private boolean tickFired;
    private boolean tickAborted;
    private boolean gameOver;
    private CollisionKind collision;
    private int pendingGrowth;

    public void clear() {
        tickFired = false;
        tickAborted = false;
        gameOver = false;
        collision = null;
        pendingGrowth = 0;
    }

    public void markTickFired() {
        tickFired = true;
    }

    public void markTickAborted() {
        tickAborted = true;
    }

    /**
     * Signals game-over. Repeated signals within one frame have the same effect as one; the
     * first collision kind is kept.
     *
     * @param kind what the head ran into
     */
    public void signalGameOver(CollisionKind kind) {
        if (!gameOver) {
            gameOver = true;
            collision = kind;
        }
    }

    public void queueGrowth() {
        pendingGrowth++;
    }

    /**
     * Drains the queued growth events.
     *
     * @return the number of events that were queued
     */
    public int drainGrowth() {
        int n = pendingGrowth;
        pendingGrowth = 0;
        return n;
    }

    public boolean isTickFired() {
        return tickFired;
    }

    public boolean isTickAborted() {
        return tickAborted;
    }

    /**
     * @return true if the clock fired and the tick was applied
     */
    public boolean isTickCommitted() {
        return tickFired && !tickAborted;
    }

    public boolean isGameOver() {
        return gameOver;
    }

    public CollisionKind getCollision() {
        return collision;
    }

    public int getPendingGrowth() {
        return pendingGrowth;
    }

    public enum CollisionKind {
        BOUNDARY,
        SELF
    }
}
