package com.streamfirst.scenesearch.adapters.catalog;

import com.streamfirst.scenesearch.domain.SceneSearchException;
import com.streamfirst.scenesearch.domain.TransientCatalogException;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Retries an action with a fixed delay between attempts.
 *
 * <p>Errors accepted by the transient predicate are retried until {@code maxAttempts} attempts
 * have been made in total; the last transient error is then re-thrown. Any other error propagates
 * on the first occurrence.
 */
@Slf4j
@Getter
public final class FixedBackoffRetry {

    public static final int DEFAULT_MAX_ATTEMPTS = 300;
    public static final Duration DEFAULT_DELAY = Duration.ofSeconds(1);

    /** Blocks the calling thread between attempts. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final int maxAttempts;
    private final Duration delay;
    private final Predicate<Throwable> transientError;
    private final Sleeper sleeper;

    public FixedBackoffRetry(
            int maxAttempts, Duration delay, Predicate<Throwable> transientError, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1: " + maxAttempts);
        }
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative: " + delay);
        }
        this.maxAttempts = maxAttempts;
        this.delay = delay;
        this.transientError = transientError;
        this.sleeper = sleeper;
    }

    /** Retries {@link TransientCatalogException}s, sleeping on the calling thread. */
    public FixedBackoffRetry(int maxAttempts, Duration delay) {
        this(
                maxAttempts,
                delay,
                TransientCatalogException.class::isInstance,
                d -> Thread.sleep(d.toMillis()));
    }

    /** 300 attempts, one second apart. */
    public static FixedBackoffRetry defaults() {
        return new FixedBackoffRetry(DEFAULT_MAX_ATTEMPTS, DEFAULT_DELAY);
    }

    /**
     * Runs the action until it succeeds, fails with a non-transient error or runs out of attempts.
     *
     * @param operation short description used in log messages
     * @param action the call to make
     * @return the action's result
     */
    public <T> T call(String operation, Supplier<T> action) {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!transientError.test(e)) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("{} failed at try {}/{}, giving up", operation, attempt, maxAttempts);
                    throw e;
                }
                log.warn("{} failed at try {}/{}: {}", operation, attempt, maxAttempts, e.getMessage());
                attempt++;
                pause(operation);
            }
        }
    }

    public void run(String operation, Runnable action) {
        call(
                operation,
                () -> {
                    action.run();
                    return null;
                });
    }

    private void pause(String operation) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SceneSearchException("interrupted while waiting to retry " + operation, e);
        }
    }
}
