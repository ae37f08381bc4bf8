package io.gatewaycontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

import static io.gatewaycontroller.metrics.MetricsConstants.*;

/*
 * Meters for the watch-and-reconcile loop. Every meter carries the controller's hostname tag.
 */
@Component
@Slf4j
public class GatewayMetrics {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    public static final String OUTCOME_APPLIED = "applied";
    public static final String OUTCOME_UNCHANGED = "unchanged";
    public static final String OUTCOME_IGNORED = "ignored";
    public static final String OUTCOME_STALE = "stale";

    private final MeterRegistry registry;
    private final String hostname;

    private final Counter requeueCounter;
    private final Counter publishCounter;
    private final Counter resetCounter;
    private final Counter skippedConnectionCounter;
    private final AtomicDouble reachableClusters;
    private final Timer reconcileTimer;

    @Autowired
    public GatewayMetrics(
        MeterRegistry registry,
        @Value("${controller.id:gateway-controller}") String controllerId) {
        this.registry = registry;
        this.hostname = controllerId;

        this.requeueCounter = Counter.builder(RECONCILE_REQUEUE_METRIC_NAME)
            .tags(HOST_NAME_TAG, hostname).register(registry);
        this.publishCounter = Counter.builder(TABLE_PUBLISH_METRIC_NAME)
            .tags(HOST_NAME_TAG, hostname).register(registry);
        this.resetCounter = Counter.builder(TABLE_RESET_METRIC_NAME)
            .tags(HOST_NAME_TAG, hostname).register(registry);
        this.skippedConnectionCounter = Counter.builder(SKIPPED_CONNECTION_METRIC_NAME)
            .tags(HOST_NAME_TAG, hostname).register(registry);
        this.reachableClusters = new AtomicDouble(0);
        Gauge.builder(REACHABLE_CLUSTERS_METRIC_NAME, reachableClusters::get)
            .tags(HOST_NAME_TAG, hostname).register(registry);
        this.reconcileTimer = Timer.builder(RECONCILE_LATENCY_METRIC_NAME)
            .tags(HOST_NAME_TAG, hostname)
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);

        log.info("GatewayMetrics initialized for the controller: {}", hostname);
    }

    /**
     * Count one reconcile pass with its outcome (applied, unchanged, ignored, stale).
     */
    public void recordReconcile(String outcome, long elapsedNanos) {
        Counter.builder(RECONCILE_TOTAL_METRIC_NAME)
            .tags(OUTCOME_TAG, outcome, HOST_NAME_TAG, hostname)
            .register(registry)
            .increment();
        reconcileTimer.record(elapsedNanos, TimeUnit.NANOSECONDS);
    }

    public void recordRequeue() {
        requeueCounter.increment();
    }

    public void recordSkippedConnection() {
        skippedConnectionCounter.increment();
    }

    /**
     * Record a table publish and the number of reachable clusters it holds.
     */
    public void recordPublish(int reachable) {
        publishCounter.increment();
        reachableClusters.set(reachable);
    }

    public void recordReset() {
        resetCounter.increment();
        reachableClusters.set(0);
    }
}
