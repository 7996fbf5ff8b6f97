package org.gridsnake.runtime.spi;

import org.gridsnake.runtime.Game;

import java.time.Duration;

/**
 * Interface for plugins that execute once per frame.
 * <p>
 * Frame plugins run at the beginning of each frame, before input handling and movement. They
 * typically manage collaborators of the snake core, such as placing food. Plugins are executed
 * sequentially in registration order on the game thread.
 * </p>
 */
public interface IFramePlugin {

    /**
     * Executes the plugin logic for the current frame.
     *
     * @param game    the game being advanced
     * @param elapsed the time since the previous frame
     */
    void execute(Game game, Duration elapsed);
}
