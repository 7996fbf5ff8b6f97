package org.gridsnake.cli.commands;

import org.gridsnake.cli.CommandLineInterface;
import org.gridsnake.cli.rendering.AsciiArenaRenderer;
import org.gridsnake.cli.terminal.TerminalKeyDecoder;
import org.gridsnake.engine.GameEngine;
import org.gridsnake.engine.GameFactory;
import org.gridsnake.node.config.GameConfiguration;
import org.gridsnake.runtime.Game;
import org.gridsnake.runtime.input.KeyboardState;
import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.NonBlockingReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.io.PrintWriter;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Interactive game in the terminal. Arrow keys or WASD steer, {@code q} quits.
 */
@Command(
    name = "play",
    mixinStandardHelpOptions = true,
    description = "Plays the game in the terminal (arrow keys or WASD, q to quit)."
)
public class PlayCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlayCommand.class);

    private static final String CLEAR_SCREEN = "\033[H\033[2J";
    private static final long READ_TIMEOUT_MILLIS = 50L;

    @ParentCommand
    private CommandLineInterface parent;

    @Override
    public Integer call() throws Exception {
        final GameConfiguration configuration = parent.getGameConfiguration();
        final KeyboardState keyboard = new KeyboardState();
        final Game game = GameFactory.create(configuration, keyboard);
        final AsciiArenaRenderer renderer = new AsciiArenaRenderer();
        final TerminalKeyDecoder decoder = new TerminalKeyDecoder();

        try (Terminal terminal = TerminalBuilder.builder().system(true).build()) {
            final Attributes original = terminal.enterRawMode();
            final PrintWriter writer = terminal.writer();
            game.addFrameListener(view -> {
                // Only redraw on ticks; frames without movement leave the board unchanged.
                if (view.frame() == 1 || game.getState().getEvents().isTickFired()) {
                    writer.print(CLEAR_SCREEN);
                    writer.print(renderer.render(view).replace("\n", "\r\n"));
                    writer.print(renderer.renderStatus(view) + "\r\n");
                    writer.flush();
                }
            });

            final GameEngine engine = new GameEngine(game, configuration.framePeriod());
            engine.start();
            try {
                final NonBlockingReader reader = terminal.reader();
                while (engine.isRunning()) {
                    final int c = reader.read(READ_TIMEOUT_MILLIS);
                    if (c == NonBlockingReader.READ_EXPIRED) {
                        continue;
                    }
                    if (c < 0 || decoder.isQuit(c)) {
                        break;
                    }
                    decoder.feed(c).ifPresent(keyboard::tap);
                }
            } finally {
                engine.shutdown();
                engine.awaitTermination(Duration.ofSeconds(2));
                terminal.setAttributes(original);
                writer.flush();
            }
            log.info("Game ended: {}", engine.getStatus());
        }
        return 0;
    }
}
