package com.zzf.codesync.client;

import com.zzf.codesync.model.TransientNetworkException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for {@link TransientNetworkException}. Any other failure is
 * rethrown at once. When the attempts run out the last transient failure is rethrown.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final int maxAttempts;
    private final long initialDelayMs;
    private final double backoffFactor;
    private final long maxDelayMs;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, long initialDelayMs, double backoffFactor, long maxDelayMs) {
        this(maxAttempts, initialDelayMs, backoffFactor, maxDelayMs, Thread::sleep);
    }

    public RetryPolicy(int maxAttempts, long initialDelayMs, double backoffFactor, long maxDelayMs, Sleeper sleeper) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.initialDelayMs = Math.max(0, initialDelayMs);
        this.backoffFactor = backoffFactor < 1.0 ? 1.0 : backoffFactor;
        this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
        this.sleeper = sleeper;
    }

    public static RetryPolicy none() {
        return new RetryPolicy(1, 0, 1.0, 0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before retry number {@code attempt} (1-based).
     */
    public long delayFor(int attempt) {
        return (long) Math.min(initialDelayMs * Math.pow(backoffFactor, attempt - 1), maxDelayMs);
    }

    public <T> T execute(String operation, Supplier<T> call) {
        TransientNetworkException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return call.get();
            } catch (TransientNetworkException e) {
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                long delay = delayFor(attempt);
                logger.warn("retry op={} attempt={}/{} delayMs={} err={}", operation, attempt, maxAttempts, delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("interrupted while backing off op=" + operation);
                }
            }
        }
        logger.warn("retry.exhausted op={} attempts={} err={}", operation, maxAttempts, last.getMessage());
        throw last;
    }
}
