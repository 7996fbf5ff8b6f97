package org.gridsnake.cli.rendering;

import org.gridsnake.runtime.GameView;
import org.gridsnake.runtime.model.Direction;
import org.gridsnake.runtime.model.GridPosition;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AsciiArenaRendererTest {

    private final AsciiArenaRenderer renderer = new AsciiArenaRenderer();

    @Test
    void render_drawsTopRowFirst() {
        GameView view = new GameView(4, 3,
            List.of(new GridPosition(1, 2), new GridPosition(1, 1), new GridPosition(1, 0)),
            true, Direction.UP, List.of(new GridPosition(3, 0)), 5, 9, 0);

        assertThat(renderer.render(view)).isEqualTo(
            "######\n"
                + "#.@..#\n"
                + "#.o..#\n"
                + "#.o.*#\n"
                + "######\n");
    }

    @Test
    void render_snakeCoversFood() {
        GameView view = new GameView(3, 1,
            List.of(new GridPosition(0, 0), new GridPosition(1, 0)),
            true, Direction.LEFT, List.of(new GridPosition(0, 0), new GridPosition(1, 0)), 0, 0, 0);

        assertThat(renderer.render(view)).contains("#@o.#");
    }

    @Test
    void render_skipsCellsOutsideTheArena() {
        GameView view = new GameView(2, 1,
            List.of(new GridPosition(2, 0), new GridPosition(1, 0)),
            true, Direction.RIGHT, List.of(), 0, 0, 0);

        assertThat(renderer.render(view)).contains("#.o#");
    }

    @Test
    void renderStatus_summarizesView() {
        GameView view = new GameView(10, 10,
            List.of(new GridPosition(3, 3), new GridPosition(3, 2), new GridPosition(3, 1)),
            true, Direction.DOWN, List.of(new GridPosition(0, 0)), 42, 100, 2);

        assertThat(renderer.renderStatus(view)).isEqualTo("length:3 tick:42 resets:2 heading:DOWN food:1");
    }
}
