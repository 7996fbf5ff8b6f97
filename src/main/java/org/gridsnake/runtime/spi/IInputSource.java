package org.gridsnake.runtime.spi;

import org.gridsnake.runtime.input.KeyCode;

/**
 * Reports which physical keys are currently held.
 */
public interface IInputSource {

    /**
     * @param key the key to query
     * @return true if the key is held during the current frame
     */
    boolean isPressed(KeyCode key);

    /**
     * Called once at the end of every frame. Sources that latch short key taps release them here.
     */
    default void frameCompleted() {
    }

    /**
     * An input source with no keys held.
     */
    IInputSource NONE = key -> false;
}
