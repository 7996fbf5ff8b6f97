package org.gridsnake.runtime;

import org.gridsnake.runtime.input.KeyBindings;
import org.gridsnake.runtime.model.ArenaProperties;
import org.gridsnake.runtime.model.FrameEvents;
import org.gridsnake.runtime.model.GameState;
import org.gridsnake.runtime.model.SnakeHead;
import org.gridsnake.runtime.model.SnakeStart;
import org.gridsnake.runtime.spi.IFoodSource;
import org.gridsnake.runtime.spi.IFrameListener;
import org.gridsnake.runtime.spi.IFramePlugin;
import org.gridsnake.runtime.spi.IInputSource;
import org.gridsnake.runtime.systems.FoodConsumptionSystem;
import org.gridsnake.runtime.systems.GameOverSystem;
import org.gridsnake.runtime.systems.GrowthSystem;
import org.gridsnake.runtime.systems.InputSystem;
import org.gridsnake.runtime.systems.MovementSystem;
import org.gridsnake.runtime.systems.SnakeSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the snake game frame by frame.
 * <p>
 * Every frame executes the same fixed sequence on the calling thread: frame plugins, input
 * handling, movement (gated by the movement clock), game-over handling, food detection and
 * growth. Producers of frame events always run before their consumers. After the systems have
 * settled, a {@link GameView} is published to all frame listeners.
 * </p>
 */
public class Game {
    private static final Logger LOG = LoggerFactory.getLogger(Game.class);

    private final GameState state;
    private final IFoodSource foodSource;
    private final IInputSource input;
    private final List<IFramePlugin> plugins = new ArrayList<>();
    private final List<IFrameListener> listeners = new CopyOnWriteArrayList<>();

    private final InputSystem inputSystem;
    private final MovementSystem movementSystem = new MovementSystem();
    private final GameOverSystem gameOverSystem = new GameOverSystem();
    private final FoodConsumptionSystem foodSystem = new FoodConsumptionSystem();
    private final GrowthSystem growthSystem = new GrowthSystem();

    private volatile GameView lastView;

    /**
     * Creates a game and spawns the snake in its canonical start state.
     *
     * @param arena          the arena bounds
     * @param start          the canonical start configuration
     * @param movementPeriod the period of the movement clock
     * @param foodSource     where food is read from and removed
     * @param input          the key state
     * @param bindings       key to direction mapping
     */
    public Game(ArenaProperties arena, SnakeStart start, Duration movementPeriod,
                IFoodSource foodSource, IInputSource input, KeyBindings bindings) {
        if (foodSource == null || input == null) {
            throw new NullPointerException("foodSource and input must not be null");
        }
        this.state = new GameState(arena, start, movementPeriod);
        this.foodSource = foodSource;
        this.input = input;
        this.inputSystem = new InputSystem(bindings);
        SnakeSpawner.spawn(state);
        this.lastView = createView();
        LOG.debug("Game created: arena {} start {} period {}", arena, start, movementPeriod);
    }

    /**
     * Registers a plugin that runs at the beginning of every frame.
     *
     * @param plugin the plugin to add
     */
    public void addPlugin(IFramePlugin plugin) {
        plugins.add(plugin);
    }

    public void addFrameListener(IFrameListener listener) {
        listeners.add(listener);
    }

    public void removeFrameListener(IFrameListener listener) {
        listeners.remove(listener);
    }

    /**
     * Executes a single frame.
     *
     * @param elapsed the time since the previous frame
     * @return the view published at the end of the frame
     */
    public GameView frame(Duration elapsed) {
        state.incrementFrameCount();
        FrameEvents events = state.getEvents();
        events.clear();

        for (IFramePlugin plugin : plugins) {
            plugin.execute(this, elapsed);
        }

        inputSystem.handleInput(state, input);
        movementSystem.update(state, elapsed);

        if (events.isTickCommitted()) {
            boolean wasReset = gameOverSystem.apply(state);
            if (wasReset) {
                events.drainGrowth();
            } else {
                foodSystem.detect(state, foodSource);
                growthSystem.apply(state);
            }
        }

        input.frameCompleted();

        GameView view = createView();
        lastView = view;
        for (IFrameListener listener : listeners) {
            listener.onFrame(view);
        }
        return view;
    }

    /**
     * Destroys the snake and respawns it in the canonical start state.
     */
    public void reset() {
        SnakeSpawner.reset(state);
        state.getClock().reset();
        lastView = createView();
    }

    private GameView createView() {
        return new GameView(
            state.getArena().getWidth(),
            state.getArena().getHeight(),
            state.resolveChainPositions(),
            state.getHead().isPresent(),
            state.getHead().map(SnakeHead::getDirection).orElse(null),
            foodSource.getFoodPositions(),
            state.getTickCount(),
            state.getFrameCount(),
            state.getResetCount());
    }

    /**
     * @return the view published by the most recent frame; safe to read from any thread
     */
    public GameView getLastView() {
        return lastView;
    }

    public GameState getState() {
        return state;
    }

    public IFoodSource getFoodSource() {
        return foodSource;
    }
}
