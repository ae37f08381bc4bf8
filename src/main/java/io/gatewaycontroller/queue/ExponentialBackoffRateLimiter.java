package io.gatewaycontroller.queue;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-item exponential backoff: base, 2*base, 4*base ... capped at max.
 * Backoff for an item only drops back to base after {@link #forget}.
 */
public class ExponentialBackoffRateLimiter<T> implements RateLimiter<T> {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private final ConcurrentMap<T, Integer> failures = new ConcurrentHashMap<>();

    public ExponentialBackoffRateLimiter(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive: " + baseDelay);
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is below base delay " + baseDelay);
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    @Override
    public Duration when(T item) {
        int exponent = failures.merge(item, 1, Integer::sum) - 1;
        // Past 62 doublings the shift overflows; the cap applies long before that anyway
        if (exponent >= 62) {
            return maxDelay;
        }
        long multiplier = 1L << exponent;
        long baseNanos = baseDelay.toNanos();
        if (baseNanos > maxDelay.toNanos() / multiplier) {
            return maxDelay;
        }
        return Duration.ofNanos(baseNanos * multiplier);
    }

    @Override
    public void forget(T item) {
        failures.remove(item);
    }

    @Override
    public int numRequeues(T item) {
        return failures.getOrDefault(item, 0);
    }
}
