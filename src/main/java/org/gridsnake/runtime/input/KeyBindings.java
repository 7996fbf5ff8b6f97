package org.gridsnake.runtime.input;

import org.gridsnake.runtime.model.Direction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Priority-ordered mapping of physical keys to directions.
 * When several bound keys are held, the one registered first wins.
 */
public final class KeyBindings {

    private final Map<KeyCode, Direction> bindings;

    private KeyBindings(Map<KeyCode, Direction> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    /**
     * Arrow keys first (left, right, down, up), then WASD in the same order.
     *
     * @return the default bindings
     */
    public static KeyBindings defaults() {
        Map<KeyCode, Direction> map = new LinkedHashMap<>();
        map.put(KeyCode.ARROW_LEFT, Direction.LEFT);
        map.put(KeyCode.ARROW_RIGHT, Direction.RIGHT);
        map.put(KeyCode.ARROW_DOWN, Direction.DOWN);
        map.put(KeyCode.ARROW_UP, Direction.UP);
        map.put(KeyCode.KEY_A, Direction.LEFT);
        map.put(KeyCode.KEY_D, Direction.RIGHT);
        map.put(KeyCode.KEY_S, Direction.DOWN);
        map.put(KeyCode.KEY_W, Direction.UP);
        return new KeyBindings(map);
    }

    /**
     * @return the bound keys in priority order
     */
    public List<KeyCode> keysInPriorityOrder() {
        return List.copyOf(bindings.keySet());
    }

    public Optional<Direction> directionFor(KeyCode key) {
        return Optional.ofNullable(bindings.get(key));
    }

    /**
     * Returns the first bound key of a direction, e.g. for scripted input.
     *
     * @param direction the direction
     * @return the highest-priority key bound to it
     */
    public KeyCode primaryKeyFor(Direction direction) {
        for (Map.Entry<KeyCode, Direction> entry : bindings.entrySet()) {
            if (entry.getValue() == direction) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("No key bound to " + direction);
    }
}
