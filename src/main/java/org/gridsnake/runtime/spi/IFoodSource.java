package org.gridsnake.runtime.spi;

import org.gridsnake.runtime.model.GridPosition;

import java.util.List;

/**
 * Provides the food currently lying in the arena.
 * <p>
 * The snake core only reads the food positions and asks for an item to be removed once it has
 * been eaten. Placement and lifetime of food are up to the implementation.
 * </p>
 */
public interface IFoodSource {

    /**
     * Returns the positions of all food items in a stable order. Several items may share a cell.
     *
     * @return a snapshot of the food positions
     */
    List<GridPosition> getFoodPositions();

    /**
     * Removes one food item at the given position.
     *
     * @param position the cell to remove food from
     * @return true if an item was removed
     */
    boolean removeFood(GridPosition position);
}
