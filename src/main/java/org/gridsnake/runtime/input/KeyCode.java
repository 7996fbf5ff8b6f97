package org.gridsnake.runtime.input;

/**
 * Physical keys the game listens to.
 */
public enum KeyCode {
    ARROW_LEFT,
    ARROW_RIGHT,
    ARROW_DOWN,
    ARROW_UP,
    KEY_A,
    KEY_D,
    KEY_S,
    KEY_W
}
