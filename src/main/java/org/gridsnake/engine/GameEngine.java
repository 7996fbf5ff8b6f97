package org.gridsnake.engine;

import org.gridsnake.runtime.Game;
import org.gridsnake.runtime.GameView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Drives a {@link Game} at a fixed frame rate on its own thread.
 * <p>
 * Each loop iteration measures the real time since the previous frame with a monotonic clock and
 * hands it to {@link Game#frame(Duration)}. While paused no frames run and the paused time is not
 * counted as elapsed. The engine stops on {@link #shutdown()} or after an optional frame limit.
 * </p>
 */
public class GameEngine implements IControllable, Runnable {

    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    private final Game game;
    private final Duration framePeriod;
    private final LongSupplier nanoClock;
    private final Thread thread;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final AtomicLong framesRun = new AtomicLong(0L);
    private volatile Long maxFrames = null;
    private volatile RuntimeException failure;
    private long startTime = 0L;

    /**
     * @param game        the game to drive
     * @param framePeriod the target duration of one frame
     */
    public GameEngine(Game game, Duration framePeriod) {
        this(game, framePeriod, System::nanoTime);
    }

    /**
     * @param nanoClock monotonic clock in nanoseconds, replaceable in tests
     */
    public GameEngine(Game game, Duration framePeriod, LongSupplier nanoClock) {
        if (game == null || nanoClock == null) {
            throw new NullPointerException("game and nanoClock must not be null");
        }
        if (framePeriod == null || framePeriod.isZero() || framePeriod.isNegative()) {
            throw new IllegalArgumentException("Frame period must be positive: " + framePeriod);
        }
        this.game = game;
        this.framePeriod = framePeriod;
        this.nanoClock = nanoClock;
        this.thread = new Thread(this, "GameEngine");
        this.thread.setDaemon(true);
    }

    /**
     * Sets the maximum number of frames to run before stopping.
     * @param maxFrames Maximum number of frames, or null to run until shut down
     */
    public void setMaxFrames(Long maxFrames) {
        this.maxFrames = maxFrames;
        if (maxFrames != null) {
            log.info("Maximum frames configured: {}", maxFrames);
        }
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            startTime = System.currentTimeMillis();
            GameView view = game.getLastView();
            log.info("GameEngine: arena [{}, {}] frame period {}", view.width(), view.height(), framePeriod);
            thread.start();
        }
    }

    @Override
    public void pause() {
        paused.set(true);
    }

    @Override
    public void resume() {
        paused.set(false);
    }

    @Override
    public void shutdown() {
        if (running.compareAndSet(true, false)) {
            thread.interrupt();
        }
    }

    /**
     * Waits for the engine thread to finish.
     *
     * @param timeout maximum time to wait
     * @return true if the thread has terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        thread.join(timeout.toMillis());
        return !thread.isAlive();
    }

    @Override
    public boolean isRunning() { return running.get(); }

    @Override
    public boolean isPaused() { return paused.get(); }

    public long getFramesRun() {
        return framesRun.get();
    }

    /**
     * @return the exception that stopped the engine, or null
     */
    public RuntimeException getFailure() {
        return failure;
    }

    public String getStatus() {
        if (!running.get() && framesRun.get() == 0) {
            return "NOT_STARTED";
        }
        GameView view = game.getLastView();
        String state = !running.get() ? "stopped" : paused.get() ? "paused" : "started";
        return String.format("%-8s frame:%d tick:%d length:%d resets:%d fps:%.2f",
            state, framesRun.get(), view.tick(), view.length(), view.resets(), calculateFps());
    }

    private double calculateFps() {
        long totalTime = System.currentTimeMillis() - startTime;
        if (framesRun.get() <= 0 || startTime <= 0 || totalTime <= 0) {
            return 0.0;
        }
        return framesRun.get() / (totalTime / 1000.0);
    }

    @Override
    public void run() {
        final long periodNanos = framePeriod.toNanos();
        long last = nanoClock.getAsLong();
        try {
            while (running.get() && !Thread.currentThread().isInterrupted()) {
                if (paused.get()) {
                    TimeUnit.MILLISECONDS.sleep(10);
                    last = nanoClock.getAsLong();
                    continue;
                }
                final long frameStart = nanoClock.getAsLong();
                game.frame(Duration.ofNanos(Math.max(0L, frameStart - last)));
                last = frameStart;

                final long frames = framesRun.incrementAndGet();
                final Long limit = maxFrames;
                if (limit != null && frames >= limit) {
                    log.info("GameEngine: reached maximum of {} frames", limit);
                    break;
                }

                final long remaining = periodNanos - (nanoClock.getAsLong() - frameStart);
                if (remaining > 0) {
                    TimeUnit.NANOSECONDS.sleep(remaining);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            failure = e;
            log.error("GameEngine: frame {} failed", framesRun.get(), e);
        } finally {
            running.set(false);
            log.info("GameEngine: stopped after {} frames, {} ticks, fps {}",
                framesRun.get(), game.getLastView().tick(), String.format("%.2f", calculateFps()));
        }
    }
}
