package org.gridsnake.runtime.food;

import org.gridsnake.runtime.model.GridPosition;
import org.gridsnake.runtime.spi.IFoodSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps food items in insertion order. Several items may share a cell.
 * <p>
 * <strong>Thread Safety:</strong> All methods are synchronized so that a renderer on another
 * thread can take snapshots while the game thread adds and removes food.
 * </p>
 */
public class InMemoryFoodSource implements IFoodSource {

    private final List<GridPosition> items = new ArrayList<>();

    public synchronized void addFood(GridPosition position) {
        if (position == null) {
            throw new NullPointerException("position must not be null");
        }
        items.add(position);
    }

    @Override
    public synchronized List<GridPosition> getFoodPositions() {
        return List.copyOf(items);
    }

    @Override
    public synchronized boolean removeFood(GridPosition position) {
        return items.remove(position);
    }

    public synchronized int size() {
        return items.size();
    }

    public synchronized void clear() {
        items.clear();
    }
}
