package org.netpreserve.newsagger.util;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Blocking pause used for rate limiting, backoff and cooling-off waits. Tests substitute a sleeper that advances
 * a fake clock instead of blocking.
 */
@FunctionalInterface
public interface Sleeper {
    /**
     * Longest single pause taken by {@link #sleepUnless}, and so the most a stop request waits to be noticed.
     */
    Duration STOP_CHECK_INTERVAL = Duration.ofSeconds(1);

    Sleeper SYSTEM = duration -> {
        if (!duration.isNegative() && !duration.isZero()) Thread.sleep(duration.toMillis());
    };

    void sleep(Duration duration) throws InterruptedException;

    /**
     * Sleeps for the given duration in short slices, giving up as soon as {@code stopRequested} turns true.
     *
     * @return true if the full duration passed, false if stopped early
     */
    default boolean sleepUnless(BooleanSupplier stopRequested, Duration duration) throws InterruptedException {
        Duration left = duration;
        while (left.compareTo(Duration.ZERO) > 0) {
            if (stopRequested.getAsBoolean()) return false;
            Duration slice = left.compareTo(STOP_CHECK_INTERVAL) < 0 ? left : STOP_CHECK_INTERVAL;
            sleep(slice);
            left = left.minus(slice);
        }
        return !stopRequested.getAsBoolean();
    }
}
