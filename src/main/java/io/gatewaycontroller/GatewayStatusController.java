package io.gatewaycontroller;

import io.gatewaycontroller.enums.ControllerState;
import io.gatewaycontroller.metrics.GatewayMetrics;
import io.gatewaycontroller.models.GatewayObject;
import io.gatewaycontroller.models.Tombstone;
import io.gatewaycontroller.queue.ChangeQueue;
import io.gatewaycontroller.reconcile.GatewayStatusReconciler;
import io.gatewaycontroller.reconcile.LastKnownStateCache;
import io.gatewaycontroller.table.ClusterReachability;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.watch.GatewayEventHandler;
import io.gatewaycontroller.watch.WatchSource;
import io.gatewaycontroller.watch.WatchSourceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Watch-and-reconcile loop for gateway status objects.
 * <p>
 * Add and update notifications only enqueue the gateway's identity; a single worker
 * thread drains the queue, reads the current object from the watch source's cache and
 * hands it to the {@link GatewayStatusReconciler}. Deletions bypass the queue because the
 * object can no longer be looked up; they are resolved against the last known state.
 * <p>
 * Lifecycle: CREATED → STARTED → RUNNING → STOPPED. A stopped controller cannot be
 * restarted; build a new one.
 */
@Slf4j
public class GatewayStatusController implements GatewayEventHandler, ClusterReachability {

    private final WatchSource watchSource;
    private final ChangeQueue<String> queue;
    private final GatewayStatusReconciler reconciler;
    private final GatewayStatusTable table;
    private final LastKnownStateCache lastKnownState;
    private final GatewayMetrics metrics;

    private final AtomicReference<ControllerState> state = new AtomicReference<>(ControllerState.CREATED);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile Thread worker;

    public GatewayStatusController(WatchSource watchSource,
                                   ChangeQueue<String> queue,
                                   GatewayStatusReconciler reconciler,
                                   GatewayStatusTable table,
                                   LastKnownStateCache lastKnownState,
                                   GatewayMetrics metrics) {
        this.watchSource = watchSource;
        this.queue = queue;
        this.reconciler = reconciler;
        this.table = table;
        this.lastKnownState = lastKnownState;
        this.metrics = metrics;
    }

    /**
     * Start watching gateways and processing changes.
     *
     * @throws WatchSourceException if the gateway collection cannot be listed; the controller is then stopped
     * @throws IllegalStateException if the controller was already started or stopped
     */
    public void start() throws WatchSourceException {
        if (!state.compareAndSet(ControllerState.CREATED, ControllerState.STARTED)) {
            throw new IllegalStateException("Gateway status controller cannot start from state " + state.get());
        }
        log.info("Starting Gateways Controller");

        try {
            watchSource.start(this);
        } catch (WatchSourceException | RuntimeException e) {
            log.error("Failed to start gateway watch: {}", e.getMessage(), e);
            stop();
            throw e;
        }

        Thread workerThread = new Thread(this::runWorker, "gateway-status-worker");
        workerThread.setDaemon(true);
        worker = workerThread;
        workerThread.start();

        if (state.compareAndSet(ControllerState.STARTED, ControllerState.RUNNING)) {
            log.info("Gateways Controller running");
        }
    }

    /**
     * Stop the controller. The worker exits on its next wake-up; in-flight work is not
     * cancelled. Safe to call more than once.
     */
    public void stop() {
        ControllerState previous = state.getAndSet(ControllerState.STOPPED);
        if (previous == ControllerState.STOPPED) {
            return;
        }
        stopSignal.countDown();
        queue.shutDown();
        watchSource.close();
        log.info("Gateways Controller stopped");
    }

    /**
     * Wait for the worker thread to exit after {@link #stop()}.
     *
     * @return true if the worker has exited (or never started)
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread current = worker;
        if (current == null) {
            return true;
        }
        current.join(timeout.toMillis());
        return !current.isAlive();
    }

    public boolean isStopped() {
        return stopSignal.getCount() == 0;
    }

    public ControllerState getState() {
        return state.get();
    }

    @Override
    public boolean isReachable(String clusterId) {
        return table.isReachable(clusterId);
    }

    // =================================================================
    // WATCH NOTIFICATIONS
    // =================================================================

    @Override
    public void onAdd(GatewayObject object) {
        log.debug("GatewayStatus {} added", object.getKey());
        lastKnownState.record(object);
        queue.add(object.getKey());
    }

    @Override
    public void onUpdate(GatewayObject oldObject, GatewayObject newObject) {
        log.debug("GatewayStatus {} updated", newObject.getKey());
        lastKnownState.record(newObject);
        queue.add(newObject.getKey());
    }

    @Override
    public void onDelete(GatewayObject object) {
        log.debug("GatewayStatus {} deleted", object.getKey());
        gatewayDeleted(object.getKey(), object);
    }

    @Override
    public void onDelete(Tombstone tombstone) {
        log.debug("GatewayStatus {} deleted, final state unknown", tombstone.getKey());
        gatewayDeleted(tombstone.getKey(), tombstone.getLastKnownObject().orElse(null));
    }

    private void gatewayDeleted(String key, GatewayObject deliveredState) {
        Optional<GatewayObject> recorded = lastKnownState.consume(key);
        GatewayObject resolved = recorded.orElse(deliveredState);
        if (resolved == null) {
            log.error("Could not resolve the last known state of deleted gateway {}", key);
            return;
        }
        reconciler.gatewayDeleted(resolved);
    }

    /**
     * True while the object is still the last state observed for its identity.
     * A deleted identity has no recorded state; a superseded one has a newer revision.
     */
    private boolean isCurrent(GatewayObject object) {
        return lastKnownState.get(object.getKey())
            .map(recorded -> recorded.getRevision() == object.getRevision())
            .orElse(false);
    }

    // =================================================================
    // WORKER
    // =================================================================

    private void runWorker() {
        while (true) {
            Optional<String> next;
            try {
                next = queue.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Gateway status worker interrupted, exiting");
                return;
            }
            if (next.isEmpty()) {
                log.info("Watcher for Gateways stopped");
                return;
            }
            processItem(next.get());
        }
    }

    void processItem(String key) {
        try {
            Optional<GatewayObject> gateway;
            try {
                gateway = watchSource.getByKey(key);
            } catch (WatchSourceException e) {
                log.error("Error retrieving gateway with key {} from the cache: {}", key, e.getMessage(), e);
                metrics.recordRequeue();
                queue.addRateLimited(key);
                return;
            }
            gateway.ifPresent(object -> reconciler.gatewayCreatedOrUpdated(object, this::isCurrent));
            queue.forget(key);
        } catch (RuntimeException e) {
            log.error("Unexpected error reconciling gateway {}", key, e);
            queue.forget(key);
        } finally {
            queue.done(key);
        }
    }
}
