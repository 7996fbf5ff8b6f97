package org.gridsnake.runtime.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered handles of the snake's entities. Index 0 is the head, the remaining entries are the
 * body segments from head to tail. The order defines which cell each segment follows into.
 */
public class BodyChain {
    private final List<EntityHandle> entities = new ArrayList<>();

    public void append(EntityHandle handle) {
        if (handle == null) {
            throw new NullPointerException("handle must not be null");
        }
        entities.add(handle);
    }

    public EntityHandle get(int index) {
        return entities.get(index);
    }

    public EntityHandle head() {
        return entities.get(0);
    }

    public int size() {
        return entities.size();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }

    public void clear() {
        entities.clear();
    }

    /**
     * @return an unmodifiable view of the handles in chain order
     */
    public List<EntityHandle> handles() {
        return Collections.unmodifiableList(entities);
    }
}
