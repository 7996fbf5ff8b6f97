package org.gridsnake.runtime.spi;

import org.gridsnake.runtime.GameView;

/**
 * Receives a read-only view of the game once per frame, after all systems have run.
 * There is no feedback path from a listener into the game.
 */
@FunctionalInterface
public interface IFrameListener {

    void onFrame(GameView view);
}
