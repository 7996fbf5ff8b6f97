package org.gridsnake.runtime.model;

import java.time.Duration;

/**
 * Repeating countdown that gates snake movement.
 * <p>
 * Elapsed time is accumulated per update. When the accumulator reaches the period the clock
 * fires and keeps only the remainder modulo the period, so one update fires at most once no
 * matter how much time has passed.
 * </p>
 */
public class MovementClock {
    private final long periodNanos;
    private long accumulatedNanos = 0L;

    /**
     * @param period the firing period, must be positive
     */
    public MovementClock(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Movement period must be positive: " + period);
        }
        this.periodNanos = period.toNanos();
    }

    /**
     * Advances the clock.
     *
     * @param elapsed the time since the previous update, must not be negative
     * @return true if the clock fired during this update
     */
    public boolean tick(Duration elapsed) {
        if (elapsed.isNegative()) {
            throw new IllegalArgumentException("Elapsed time must not be negative: " + elapsed);
        }
        accumulatedNanos += elapsed.toNanos();
        if (accumulatedNanos < periodNanos) {
            return false;
        }
        accumulatedNanos %= periodNanos;
        return true;
    }

    public Duration getPeriod() {
        return Duration.ofNanos(periodNanos);
    }

    public Duration getAccumulated() {
        return Duration.ofNanos(accumulatedNanos);
    }

    public void reset() {
        accumulatedNanos = 0L;
    }
}
