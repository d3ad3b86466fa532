package org.netpreserve.newsagger.api;

import org.netpreserve.newsagger.NewsaggerException;
import org.netpreserve.newsagger.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff applied explicitly around a single call site. The delay before retry {@code n} (0-based) is
 * {@code min(baseDelay * multiplier^n, maxDelay)}. Exceptions the predicate rejects are rethrown at once.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelay   delay after the first failure
 * @param multiplier  growth factor per attempt
 * @param maxDelay    cap on any single delay
 * @param retryable   which failures are worth another attempt
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, double multiplier, Duration maxDelay,
                          Predicate<Exception> retryable) {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
    }

    /**
     * Connection resets, timeouts, truncated bodies and 5xx responses.
     */
    public static RetryPolicy network(int maxAttempts, Duration baseDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, 2.0, Duration.ofMinutes(5),
                e -> e instanceof IOException);
    }

    /**
     * HTTP 429 responses.
     */
    public static RetryPolicy rateLimit(int maxAttempts, Duration baseDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, baseDelay, 2.0, maxDelay, e -> e instanceof RateLimitedException);
    }

    public Duration delayFor(int attempt) {
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt);
        if (millis >= maxDelay.toMillis()) return maxDelay;
        return Duration.ofMillis((long) millis);
    }

    public <T> T execute(String description, Sleeper sleeper, Attempt<T> action)
            throws NewsaggerException, IOException, InterruptedException {
        for (int attempt = 0; ; attempt++) {
            try {
                return action.run(attempt);
            } catch (NewsaggerException | IOException e) {
                if (!retryable.test(e) || attempt + 1 >= maxAttempts) throw e;
                Duration delay = delayFor(attempt);
                log.warn("{} failed (attempt {}/{}): {}. Retrying in {}s", description, attempt + 1, maxAttempts,
                        e.getMessage(), delay.toSeconds());
                sleeper.sleep(delay);
            }
        }
    }

    @FunctionalInterface
    public interface Attempt<T> {
        T run(int attempt) throws NewsaggerException, IOException, InterruptedException;
    }
}
