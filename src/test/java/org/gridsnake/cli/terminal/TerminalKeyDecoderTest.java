package org.gridsnake.cli.terminal;

import org.gridsnake.runtime.input.KeyCode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TerminalKeyDecoderTest {

    private final TerminalKeyDecoder decoder = new TerminalKeyDecoder();

    private List<KeyCode> feedAll(String input) {
        List<KeyCode> keys = new ArrayList<>();
        for (char c : input.toCharArray()) {
            decoder.feed(c).ifPresent(keys::add);
        }
        return keys;
    }

    @Test
    void arrowEscapeSequences_decodeToArrowKeys() {
        assertThat(feedAll("\u001b[A\u001b[B\u001b[C\u001b[D"))
            .containsExactly(KeyCode.ARROW_UP, KeyCode.ARROW_DOWN, KeyCode.ARROW_RIGHT, KeyCode.ARROW_LEFT);
    }

    @Test
    void applicationCursorMode_isSupported() {
        assertThat(feedAll("\u001bOA")).containsExactly(KeyCode.ARROW_UP);
    }

    @Test
    void wasd_decodesInEitherCase() {
        assertThat(feedAll("wAsD")).containsExactly(KeyCode.KEY_W, KeyCode.KEY_A, KeyCode.KEY_S, KeyCode.KEY_D);
    }

    @Test
    void unknownInput_isIgnored() {
        assertThat(feedAll("x1 \u001bZ")).isEmpty();
    }

    @Test
    void quit_isRecognizedOutsideEscapeSequences() {
        assertThat(decoder.isQuit('q')).isTrue();
        assertThat(decoder.isQuit(3)).isTrue();

        Optional<KeyCode> partial = decoder.feed(27);
        assertThat(partial).isEmpty();
        assertThat(decoder.isQuit('q')).isFalse();
    }
}
