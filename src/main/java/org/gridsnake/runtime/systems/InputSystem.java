package org.gridsnake.runtime.systems;

import org.gridsnake.runtime.input.KeyBindings;
import org.gridsnake.runtime.input.KeyCode;
import org.gridsnake.runtime.model.Direction;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.SnakeHead;
import org.gridsnake.runtime.spi.IInputSource;

import java.util.List;
import java.util.Optional;

/**
 * Turns held keys into a new heading for the snake.
 * <p>
 * Only the highest-priority held key is considered per pass. Its direction is applied unless it
 * points exactly opposite to the current heading, which would make the head run into the first
 * segment.
 * </p>
 */
public class InputSystem {

    private final List<KeyCode> keysInPriorityOrder;
    private final KeyBindings bindings;

    public InputSystem(KeyBindings bindings) {
        if (bindings == null) {
            throw new NullPointerException("bindings must not be null");
        }
        this.bindings = bindings;
        this.keysInPriorityOrder = bindings.keysInPriorityOrder();
    }

    /**
     * Runs one input pass.
     *
     * @param state the game state
     * @param input the key state for this frame
     */
    public void handleInput(GameState state, IInputSource input) {
        Optional<SnakeHead> maybeHead = state.getHead();
        if (maybeHead.isEmpty()) {
            return;
        }
        SnakeHead head = maybeHead.get();
        Optional<Direction> candidate = firstPressedDirection(input);
        if (candidate.isPresent() && candidate.get() != head.getDirection().opposite()) {
            head.setDirection(candidate.get());
        }
    }

    private Optional<Direction> firstPressedDirection(IInputSource input) {
        for (KeyCode key : keysInPriorityOrder) {
            if (input.isPressed(key)) {
                return bindings.directionFor(key);
            }
        }
        return Optional.empty();
    }
}
