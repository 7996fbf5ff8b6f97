package org.gridsnake.runtime.model;

/**
 * The snake's head: the entity at chain index 0 plus the heading it moves in.
 */
public class SnakeHead {
    private final EntityHandle entity;
    private Direction direction;

    public SnakeHead(EntityHandle entity, Direction direction) {
        if (entity == null || direction == null) {
            throw new NullPointerException("entity and direction must not be null");
        }
        this.entity = entity;
        this.direction = direction;
    }

    public EntityHandle getEntity() {
        return entity;
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        if (direction == null) {
            throw new NullPointerException("direction must not be null");
        }
        this.direction = direction;
    }
}
