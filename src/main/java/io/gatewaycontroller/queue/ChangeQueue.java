package io.gatewaycontroller.queue;

import java.time.Duration;
import java.util.Optional;

/**
 * Deduplicating work queue of object identities with per-item retry backoff.
 * <p>
 * An item is pending from {@link #add} until a worker takes it with {@link #get}; adding a
 * pending item again is a no-op. An item added while it is being processed is queued
 * again once the worker calls {@link #done}, so one item is never processed by two
 * workers at once.
 *
 * @param <T> item type, compared by equals/hashCode
 */
public interface ChangeQueue<T> {

    /**
     * Enqueue an item unless it is already pending. Ignored after shutdown.
     */
    void add(T item);

    /**
     * Enqueue an item once the delay has elapsed.
     */
    void addAfter(T item, Duration delay);

    /**
     * Enqueue an item after the backoff the rate limiter assigns to it.
     */
    void addRateLimited(T item);

    /**
     * Block until an item is available or the queue shuts down.
     *
     * @return the next item, or empty once the queue is shutting down
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    Optional<T> get() throws InterruptedException;

    /**
     * Mark an item returned by {@link #get} as processed.
     */
    void done(T item);

    /**
     * Clear retry backoff for an item after it was processed successfully.
     */
    void forget(T item);

    /**
     * Number of rate-limited requeues since the item was last forgotten.
     */
    int numRequeues(T item);

    /**
     * Number of items waiting to be taken.
     */
    int len();

    /**
     * Release all current and future {@link #get} callers with the shutdown flag. Idempotent.
     */
    void shutDown();

    boolean isShuttingDown();
}
