package org.gridsnake.cli.commands;

import org.gridsnake.cli.CommandLineInterface;
import org.gridsnake.cli.rendering.AsciiArenaRenderer;
import org.gridsnake.engine.GameFactory;
import org.gridsnake.node.config.GameConfiguration;
import org.gridsnake.runtime.Game;
import org.gridsnake.runtime.GameView;
import org.gridsnake.runtime.input.KeyBindings;
import org.gridsnake.runtime.input.KeyboardState;
import org.gridsnake.runtime.model.Direction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Runs a game headless and deterministically: every frame advances exactly one movement period,
 * so every frame is one tick. Moves are given as one letter per tick.
 */
@Command(
    name = "simulate",
    mixinStandardHelpOptions = true,
    description = "Runs a scripted game without a terminal and prints the final board."
)
public class SimulateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SimulateCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Option(names = {"-t", "--ticks"}, defaultValue = "20",
        description = "Number of ticks to run (default: ${DEFAULT-VALUE})")
    private int ticks;

    @Option(names = {"-m", "--moves"}, defaultValue = "",
        description = "One key per tick: L, U, R, D or '.' for no input. Ticks beyond the script get no input.")
    private String moves;

    @Option(names = "--seed", description = "Overrides gridsnake.food.seed")
    private Long seed;

    @Option(names = "--no-food", description = "Disables the food spawner")
    private boolean noFood;

    @Option(names = "--every-tick", description = "Prints the board after every tick instead of only at the end")
    private boolean everyTick;

    @Override
    public Integer call() {
        if (ticks < 0) {
            throw new ParameterException(spec.commandLine(), "--ticks must not be negative: " + ticks);
        }
        GameConfiguration configuration = parent.getGameConfiguration();
        if (seed != null) {
            configuration = new GameConfiguration(configuration.arena(), configuration.start(),
                configuration.movementPeriod(), configuration.foodSpawnPeriod(), seed,
                configuration.foodMaxItems(), configuration.frameRate());
        }

        final KeyboardState keyboard = new KeyboardState();
        final KeyBindings bindings = KeyBindings.defaults();
        final Game game = GameFactory.create(configuration, keyboard, !noFood);
        final AsciiArenaRenderer renderer = new AsciiArenaRenderer();
        final PrintWriter out = spec.commandLine().getOut();

        log.info("Simulating {} ticks on arena {}", ticks, configuration.arena());
        GameView view = game.getLastView();
        for (int i = 0; i < ticks; i++) {
            if (i < moves.length()) {
                Direction direction = parseMove(moves.charAt(i), i);
                if (direction != null) {
                    keyboard.tap(bindings.primaryKeyFor(direction));
                }
            }
            view = game.frame(configuration.movementPeriod());
            if (everyTick) {
                out.print(renderer.render(view));
                out.println(renderer.renderStatus(view));
            }
        }
        if (!everyTick) {
            out.print(renderer.render(view));
            out.println(renderer.renderStatus(view));
        }
        out.flush();
        return 0;
    }

    private Direction parseMove(char c, int index) {
        return switch (Character.toUpperCase(c)) {
            case 'L' -> Direction.LEFT;
            case 'U' -> Direction.UP;
            case 'R' -> Direction.RIGHT;
            case 'D' -> Direction.DOWN;
            case '.' -> null;
            default -> throw new ParameterException(spec.commandLine(),
                "Invalid move '" + c + "' at position " + index + "; expected L, U, R, D or '.'");
        };
    }
}
