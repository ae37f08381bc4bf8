package io.gatewaycontroller;

import io.gatewaycontroller.enums.AbsentClusterPolicy;
import io.gatewaycontroller.enums.ControllerState;
import io.gatewaycontroller.metrics.GatewayMetrics;
import io.gatewaycontroller.models.GatewayObject;
import io.gatewaycontroller.queue.ExponentialBackoffRateLimiter;
import io.gatewaycontroller.queue.RateLimitingChangeQueue;
import io.gatewaycontroller.reconcile.GatewayStatusParser;
import io.gatewaycontroller.reconcile.GatewayStatusReconciler;
import io.gatewaycontroller.reconcile.LastKnownStateCache;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.watch.WatchSourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static io.gatewaycontroller.GatewayFixtures.connection;
import static io.gatewaycontroller.GatewayFixtures.gateway;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end tests of the watch-and-reconcile loop against an in-memory watch source.
 */
class GatewayStatusControllerTest {

    private static final String GATEWAY_KEY = "submariner-operator/gateway-1";
    private static final String PASSIVE_GATEWAY_KEY = "submariner-operator/gateway-2";

    private FakeWatchSource watchSource;
    private GatewayStatusTable table;
    private GatewayStatusController controller;

    @BeforeEach
    void setUp() {
        watchSource = new FakeWatchSource();
        table = new GatewayStatusTable();
        controller = newController(AbsentClusterPolicy.RETAIN);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        controller.stop();
        controller.awaitTermination(Duration.ofSeconds(5));
    }

    private GatewayStatusController newController(AbsentClusterPolicy policy) {
        GatewayMetrics metrics = new GatewayMetrics(new SimpleMeterRegistry(), "test-controller");
        RateLimitingChangeQueue<String> queue = new RateLimitingChangeQueue<>("test",
            new ExponentialBackoffRateLimiter<>(Duration.ofMillis(1), Duration.ofMillis(50)));
        GatewayStatusReconciler reconciler = new GatewayStatusReconciler(table, new GatewayStatusParser(), policy, metrics);
        return new GatewayStatusController(watchSource, queue, reconciler, table, new LastKnownStateCache(), metrics);
    }

    @Test
    void testScenarioA_ConnectedClusterBecomesReachable() throws Exception {
        // Given
        controller.start();

        // When
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() -> assertThat(controller.isReachable("east")).isTrue());
        assertThat(controller.isReachable("west")).isFalse();
    }

    @Test
    void testScenarioB_DisconnectedClusterStaysUnreachable() throws Exception {
        // Given
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));

        // When
        watchSource.put(gateway(GATEWAY_KEY, 2L, "active",
            connection("connected", "east"),
            connection("disconnected", "west")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> watchSource.lookupCount() >= 2);
        await().during(100, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS).untilAsserted(() -> {
            assertThat(controller.isReachable("east")).isTrue();
            assertThat(controller.isReachable("west")).isFalse();
        });
    }

    @Test
    void testScenarioC_DeletingActiveGatewayResetsTable() throws Exception {
        // Given
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));

        // When
        watchSource.delete(GATEWAY_KEY);

        // Then
        assertThat(controller.isReachable("east")).isFalse();
        assertThat(table.get().isEmpty()).isTrue();
    }

    @Test
    void testScenarioD_PassiveGatewayNeverAffectsTable() throws Exception {
        // Given
        controller.start();

        // When
        watchSource.put(gateway(PASSIVE_GATEWAY_KEY, "passive", connection("connected", "north")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> watchSource.lookupCount() >= 1);

        // Then
        await().during(100, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
            .untilAsserted(() -> assertThat(controller.isReachable("north")).isFalse());
        assertThat(table.get().getVersion()).isZero();

        watchSource.delete(PASSIVE_GATEWAY_KEY);
        assertThat(controller.isReachable("north")).isFalse();
        assertThat(table.get().getVersion()).isZero();
    }

    @Test
    void testDeletingPassiveGatewayKeepsActiveGatewayClusters() throws Exception {
        // Given
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        watchSource.put(gateway(PASSIVE_GATEWAY_KEY, "passive", connection("connected", "north")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));
        long version = table.get().getVersion();

        // When
        watchSource.delete(PASSIVE_GATEWAY_KEY);

        // Then
        assertThat(controller.isReachable("east")).isTrue();
        assertThat(table.get().getVersion()).isEqualTo(version);
    }

    @Test
    void testRedeliveryOfUnchangedGatewayPublishesNoNewVersion() throws Exception {
        // Given
        controller.start();
        GatewayObject active = gateway(GATEWAY_KEY, "active", connection("connected", "east"));
        watchSource.put(active);
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));
        int lookupsBefore = watchSource.lookupCount();

        // When - resync and a no-op update
        watchSource.resync();
        await().atMost(5, TimeUnit.SECONDS).until(() -> watchSource.lookupCount() > lookupsBefore);
        watchSource.put(gateway(GATEWAY_KEY, 2L, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> watchSource.lookupCount() > lookupsBefore + 1);

        // Then
        await().during(100, TimeUnit.MILLISECONDS).atMost(2, TimeUnit.SECONDS)
            .untilAsserted(() -> assertThat(table.get().getVersion()).isEqualTo(1L));
    }

    @Test
    void testClusterAbsentFromLaterListKeepsReachability() throws Exception {
        // Given
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));

        // When
        watchSource.put(gateway(GATEWAY_KEY, 2L, "active", connection("connected", "west")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("west"));
        assertThat(controller.isReachable("east")).isTrue();
    }

    @Test
    void testPrunePolicyDropsClusterAbsentFromLaterList() throws Exception {
        // Given
        controller = newController(AbsentClusterPolicy.PRUNE);
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));

        // When
        watchSource.put(gateway(GATEWAY_KEY, 2L, "active", connection("connected", "west")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("west"));
        assertThat(controller.isReachable("east")).isFalse();
    }

    @Test
    void testTombstoneDeleteResolvesLastKnownActiveState() throws Exception {
        // Given
        controller.start();
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));

        // When - tombstone carries no payload, last known state says active
        watchSource.deleteFinalStateUnknown(GATEWAY_KEY, null);

        // Then
        assertThat(controller.isReachable("east")).isFalse();
    }

    @Test
    void testTombstoneDeleteFallsBackToDeliveredState() throws Exception {
        // Given
        controller.start();
        table.store(Map.of("east", true));

        // When - never observed, tombstone carries an active gateway
        watchSource.deleteFinalStateUnknown(GATEWAY_KEY, gateway(GATEWAY_KEY, "active"));

        // Then
        assertThat(controller.isReachable("east")).isFalse();
    }

    @Test
    void testTransientLookupFailureIsRetried() throws Exception {
        // Given
        controller.start();
        watchSource.failNextLookups(3);

        // When
        watchSource.put(gateway(GATEWAY_KEY, "active", connection("connected", "east")));

        // Then
        await().atMost(5, TimeUnit.SECONDS).until(() -> controller.isReachable("east"));
        assertThat(watchSource.lookupCount()).isGreaterThanOrEqualTo(4);
    }

    @Test
    void testStartFailurePropagatesAndStopsController() {
        // Given
        watchSource.failStartWith(new WatchSourceException("etcd unreachable"));

        // When / Then
        assertThatThrownBy(() -> controller.start())
            .isInstanceOf(WatchSourceException.class)
            .hasMessage("etcd unreachable");
        assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        assertThat(watchSource.isClosed()).isTrue();
    }

    @Test
    void testStoppedControllerCannotRestart() throws Exception {
        // Given
        controller.start();
        controller.stop();

        // When / Then
        assertThatThrownBy(() -> controller.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testStartTwiceFails() throws Exception {
        controller.start();
        assertThat(controller.getState()).isEqualTo(ControllerState.RUNNING);

        assertThatThrownBy(() -> controller.start()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testStopTerminatesWorkerAndIsIdempotent() throws Exception {
        // Given
        controller.start();

        // When
        controller.stop();
        controller.stop();

        // Then
        assertThat(controller.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(controller.getState()).isEqualTo(ControllerState.STOPPED);
        assertThat(controller.isStopped()).isTrue();
        assertThat(watchSource.isClosed()).isTrue();
    }
}
