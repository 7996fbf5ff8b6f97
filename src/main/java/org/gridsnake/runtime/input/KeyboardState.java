package org.gridsnake.runtime.input;

import org.gridsnake.runtime.spi.IInputSource;

import java.util.EnumSet;
import java.util.Set;

/**
 * Thread-safe key state written by an input reader and read by the game thread.
 * <p>
 * Keys can be held ({@link #press}/{@link #release}) or tapped. A tap counts as held until it has
 * been read by an input pass and the frame has completed, which lets event-based inputs such as a
 * terminal drive the held-key model. Taps arriving mid-frame are kept for the next frame.
 * </p>
 */
public class KeyboardState implements IInputSource {

    private final Set<KeyCode> held = EnumSet.noneOf(KeyCode.class);
    private final Set<KeyCode> tapped = EnumSet.noneOf(KeyCode.class);
    private final Set<KeyCode> consumedTaps = EnumSet.noneOf(KeyCode.class);

    /**
     * Holds a key down until {@link #release} is called. Inputs that report key-down and key-up
     * separately use this pair; the held key is seen by every input pass in between.
     *
     * @param key the key going down
     */
    public synchronized void press(KeyCode key) {
        held.add(key);
    }

    /**
     * @param key the key going up
     */
    public synchronized void release(KeyCode key) {
        held.remove(key);
    }

    /**
     * Marks a key as held until the input pass that reads it has finished.
     *
     * @param key the tapped key
     */
    public synchronized void tap(KeyCode key) {
        tapped.add(key);
    }

    public synchronized void releaseAll() {
        held.clear();
        tapped.clear();
        consumedTaps.clear();
    }

    @Override
    public synchronized boolean isPressed(KeyCode key) {
        if (held.contains(key)) {
            return true;
        }
        if (tapped.contains(key)) {
            consumedTaps.add(key);
            return true;
        }
        return false;
    }

    @Override
    public synchronized void frameCompleted() {
        tapped.removeAll(consumedTaps);
        consumedTaps.clear();
    }
}
