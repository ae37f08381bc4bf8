package io.gatewaycontroller.queue;

import java.time.Duration;

/**
 * Decides how long an item must wait before it is retried.
 */
public interface RateLimiter<T> {

    /**
     * Delay before the next retry of this item; each call counts as one retry.
     */
    Duration when(T item);

    /**
     * Reset the item's retry history.
     */
    void forget(T item);

    int numRequeues(T item);
}
