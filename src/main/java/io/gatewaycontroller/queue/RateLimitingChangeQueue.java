package io.gatewaycontroller.queue;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ChangeQueue} backed by a FIFO plus dirty/processing sets.
 * <p>
 * dirty holds every item that needs processing (queued or waiting for its current
 * processing to finish); processing holds items handed out by {@link #get} and not
 * yet {@link #done}. Delayed adds run on a single scheduler thread.
 */
@Slf4j
public class RateLimitingChangeQueue<T> implements ChangeQueue<T> {

    private final RateLimiter<T> rateLimiter;
    private final String name;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Deque<T> queue = new ArrayDeque<>();
    private final Set<T> dirty = new HashSet<>();
    private final Set<T> processing = new HashSet<>();
    private boolean shuttingDown = false;

    private final ScheduledExecutorService delayScheduler;

    public RateLimitingChangeQueue(String name, RateLimiter<T> rateLimiter) {
        this.name = name;
        this.rateLimiter = rateLimiter;
        this.delayScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, name + "-delay");
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public void add(T item) {
        lock.lock();
        try {
            if (shuttingDown || dirty.contains(item)) {
                return;
            }
            dirty.add(item);
            if (processing.contains(item)) {
                return;
            }
            queue.addLast(item);
            notEmpty.signal();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addAfter(T item, Duration delay) {
        if (isShuttingDown()) {
            return;
        }
        if (delay.isZero() || delay.isNegative()) {
            add(item);
            return;
        }
        try {
            delayScheduler.schedule(() -> add(item), delay.toNanos(), TimeUnit.NANOSECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("[{}] Queue shut down, dropping delayed add of {}", name, item);
        }
    }

    @Override
    public void addRateLimited(T item) {
        Duration delay = rateLimiter.when(item);
        log.debug("[{}] Requeueing {} after {}ms", name, item, delay.toMillis());
        addAfter(item, delay);
    }

    @Override
    public Optional<T> get() throws InterruptedException {
        lock.lock();
        try {
            while (queue.isEmpty() && !shuttingDown) {
                notEmpty.await();
            }
            if (shuttingDown) {
                return Optional.empty();
            }
            T item = queue.pollFirst();
            processing.add(item);
            dirty.remove(item);
            return Optional.of(item);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void done(T item) {
        lock.lock();
        try {
            processing.remove(item);
            if (dirty.contains(item) && !shuttingDown) {
                queue.addLast(item);
                notEmpty.signal();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void forget(T item) {
        rateLimiter.forget(item);
    }

    @Override
    public int numRequeues(T item) {
        return rateLimiter.numRequeues(item);
    }

    @Override
    public int len() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void shutDown() {
        lock.lock();
        try {
            if (shuttingDown) {
                return;
            }
            shuttingDown = true;
            notEmpty.signalAll();
        } finally {
            lock.unlock();
        }
        delayScheduler.shutdownNow();
        log.info("[{}] Change queue shut down", name);
    }

    @Override
    public boolean isShuttingDown() {
        lock.lock();
        try {
            return shuttingDown;
        } finally {
            lock.unlock();
        }
    }
}
