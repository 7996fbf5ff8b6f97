package org.gridsnake.cli.terminal;

import org.gridsnake.runtime.input.KeyCode;

import java.util.Optional;

/**
 * Decodes raw terminal input into game keys.
 * <p>
 * Arrow keys arrive as the escape sequences {@code ESC [ A..D} (or {@code ESC O A..D} in
 * application cursor mode); WASD arrive as plain characters in either case. The decoder is fed one
 * character at a time and keeps the partial escape sequence between calls.
 * </p>
 */
public class TerminalKeyDecoder {

    private static final int ESC = 27;

    private int state = 0;

    /**
     * Feeds one character.
     *
     * @param c the character read from the terminal
     * @return the decoded key, if this character completed one
     */
    public Optional<KeyCode> feed(int c) {
        switch (state) {
            case 1 -> {
                state = (c == '[' || c == 'O') ? 2 : 0;
                return Optional.empty();
            }
            case 2 -> {
                state = 0;
                return switch (c) {
                    case 'A' -> Optional.of(KeyCode.ARROW_UP);
                    case 'B' -> Optional.of(KeyCode.ARROW_DOWN);
                    case 'C' -> Optional.of(KeyCode.ARROW_RIGHT);
                    case 'D' -> Optional.of(KeyCode.ARROW_LEFT);
                    default -> Optional.empty();
                };
            }
            default -> {
                if (c == ESC) {
                    state = 1;
                    return Optional.empty();
                }
                return switch (Character.toLowerCase((char) c)) {
                    case 'w' -> Optional.of(KeyCode.KEY_W);
                    case 'a' -> Optional.of(KeyCode.KEY_A);
                    case 's' -> Optional.of(KeyCode.KEY_S);
                    case 'd' -> Optional.of(KeyCode.KEY_D);
                    default -> Optional.empty();
                };
            }
        }
    }

    /**
     * @param c a character read from the terminal
     * @return true if it asks to quit the game
     */
    public boolean isQuit(int c) {
        return state == 0 && (c == 'q' || c == 'Q' || c == 3);
    }
}
