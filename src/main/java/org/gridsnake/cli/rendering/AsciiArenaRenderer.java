package org.gridsnake.cli.rendering;

import org.gridsnake.runtime.GameView;
import org.gridsnake.runtime.model.GridPosition;

import java.util.Arrays;
import java.util.List;

/**
 * Renders a {@link GameView} as a framed block of text.
 * <p>
 * The top row is y = height - 1 because moving up increases y. Cells hold {@code @} for the
 * head, {@code o} for a body segment, {@code *} for food and {@code .} when empty. Snake cells
 * are drawn over food, and the head over the body.
 * </p>
 */
public class AsciiArenaRenderer {

    public static final char HEAD = '@';
    public static final char SEGMENT = 'o';
    public static final char FOOD = '*';
    public static final char EMPTY = '.';
    public static final char BORDER = '#';

    /**
     * @param view the view to draw
     * @return the board, one line per row, lines separated by {@code \n}
     */
    public String render(GameView view) {
        final int width = view.width();
        final int height = view.height();
        final char[][] cells = new char[height][width];
        for (char[] row : cells) {
            Arrays.fill(row, EMPTY);
        }

        for (GridPosition food : view.food()) {
            put(cells, food, FOOD);
        }
        final List<GridPosition> chain = view.chain();
        for (int i = chain.size() - 1; i >= 1; i--) {
            put(cells, chain.get(i), SEGMENT);
        }
        if (view.headPresent() && !chain.isEmpty()) {
            put(cells, chain.get(0), HEAD);
        }

        final StringBuilder sb = new StringBuilder((width + 3) * (height + 2));
        appendBorder(sb, width);
        for (int y = height - 1; y >= 0; y--) {
            sb.append(BORDER).append(cells[y]).append(BORDER).append('\n');
        }
        appendBorder(sb, width);
        return sb.toString();
    }

    /**
     * @param view the view to summarize
     * @return a one-line status such as {@code length:3 tick:42 resets:1 heading:UP food:2}
     */
    public String renderStatus(GameView view) {
        return String.format("length:%d tick:%d resets:%d heading:%s food:%d",
            view.length(), view.tick(), view.resets(), view.direction(), view.food().size());
    }

    private static void put(char[][] cells, GridPosition position, char c) {
        // Out-of-arena positions only exist transiently and are not drawn.
        if (position.y() >= 0 && position.y() < cells.length
            && position.x() >= 0 && position.x() < cells[position.y()].length) {
            cells[position.y()][position.x()] = c;
        }
    }

    private static void appendBorder(StringBuilder sb, int width) {
        for (int i = 0; i < width + 2; i++) {
            sb.append(BORDER);
        }
        sb.append('\n');
    }
}
