package org.gridsnake.runtime.model;

/**
 * Kind of entity held in the {@link EntityStore}.
 */
public enum EntityKind {
    SNAKE_HEAD,
    SNAKE_SEGMENT
}
