package io.gatewaycontroller.reconcile;

import io.gatewaycontroller.enums.AbsentClusterPolicy;
import io.gatewaycontroller.metrics.GatewayMetrics;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.table.StatusSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static io.gatewaycontroller.GatewayFixtures.*;
import static io.gatewaycontroller.metrics.GatewayMetrics.*;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GatewayStatusReconcilerTest {

    private static final String GATEWAY = "submariner-operator/gateway-1";

    @Mock
    private GatewayMetrics metrics;

    private GatewayStatusTable table;
    private GatewayStatusReconciler reconciler;

    @BeforeEach
    void setUp() {
        table = new GatewayStatusTable();
        reconciler = new GatewayStatusReconciler(table, new GatewayStatusParser(), AbsentClusterPolicy.RETAIN, metrics);
    }

    @Test
    void testConnectedClusterInserted() {
        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active", connection("connected", "east")));

        // Then
        assertThat(published).isTrue();
        assertThat(table.get().getClusters()).isEqualTo(Map.of("east", true));
        verify(metrics).recordPublish(1);
        verify(metrics).recordReconcile(eq(OUTCOME_APPLIED), anyLong());
    }

    @Test
    void testNonConnectedClusterRemoved() {
        // Given
        table.store(Map.of("east", true, "west", true));

        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active",
            connection("connected", "east"),
            connection("error", "west")));

        // Then
        assertThat(published).isTrue();
        assertThat(table.get().getClusters()).containsOnlyKeys("east");
    }

    @Test
    void testUnchangedStatusPublishesNothing() {
        // Given
        StatusSnapshot before = table.store(Map.of("east", true));

        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active",
            connection("connected", "east"),
            connection("connecting", "west")));

        // Then
        assertThat(published).isFalse();
        assertThat(table.get()).isSameAs(before);
        verify(metrics).recordReconcile(eq(OUTCOME_UNCHANGED), anyLong());
        verify(metrics, never()).recordPublish(anyInt());
    }

    @Test
    void testPassiveGatewayIgnored() {
        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "passive", connection("connected", "north")));

        // Then
        assertThat(published).isFalse();
        assertThat(table.get().getVersion()).isZero();
        verify(metrics).recordReconcile(eq(OUTCOME_IGNORED), anyLong());
    }

    @Test
    void testGatewayWithoutConnectionsIgnored() {
        table.store(Map.of("east", true));

        boolean published = reconciler.gatewayCreatedOrUpdated(
            fromJson(GATEWAY, "{\"status\":{\"haStatus\":\"active\"}}"));

        assertThat(published).isFalse();
        assertThat(table.isReachable("east")).isTrue();
    }

    @Test
    void testMalformedConnectionSkippedOthersApplied() {
        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(fromJson(GATEWAY,
            "{\"status\":{\"haStatus\":\"active\",\"connections\":["
                + "{\"status\":\"connected\",\"endpoint\":{}},"
                + "{\"status\":\"connected\",\"endpoint\":{\"cluster_id\":\"east\"}}]}}"));

        // Then
        assertThat(published).isTrue();
        assertThat(table.get().getClusters()).containsOnlyKeys("east");
        verify(metrics).recordSkippedConnection();
    }

    @Test
    void testLaterEntryOverridesEarlierForSameCluster() {
        reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active",
            connection("connected", "east"),
            connection("error", "east")));

        assertThat(table.isReachable("east")).isFalse();
    }

    @Test
    void testAbsentClusterRetainedByDefault() {
        table.store(Map.of("east", true));

        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active", connection("connected", "west")));

        assertThat(published).isTrue();
        assertThat(table.get().getClusters()).containsOnlyKeys("east", "west");
    }

    @Test
    void testAbsentClusterPrunedUnderPrunePolicy() {
        // Given
        reconciler = new GatewayStatusReconciler(table, new GatewayStatusParser(), AbsentClusterPolicy.PRUNE, metrics);
        table.store(Map.of("east", true, "west", true));

        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active", connection("connected", "west")));

        // Then
        assertThat(published).isTrue();
        assertThat(table.get().getClusters()).containsOnlyKeys("west");
    }

    @Test
    void testPruneWithEmptyConnectionListClearsTable() {
        reconciler = new GatewayStatusReconciler(table, new GatewayStatusParser(), AbsentClusterPolicy.PRUNE, metrics);
        table.store(Map.of("east", true));

        boolean published = reconciler.gatewayCreatedOrUpdated(gateway(GATEWAY, "active"));

        assertThat(published).isTrue();
        assertThat(table.get().isEmpty()).isTrue();
    }

    @Test
    void testDeletingActiveGatewayResetsTable() {
        // Given
        table.store(Map.of("east", true));

        // When
        boolean reset = reconciler.gatewayDeleted(gateway(GATEWAY, "active", connection("connected", "east")));

        // Then
        assertThat(reset).isTrue();
        assertThat(table.get().isEmpty()).isTrue();
        assertThat(table.get().getVersion()).isEqualTo(2L);
        verify(metrics).recordReset();
    }

    @Test
    void testDeletingPassiveGatewayKeepsTable() {
        table.store(Map.of("east", true));

        boolean reset = reconciler.gatewayDeleted(gateway(GATEWAY, "passive"));

        assertThat(reset).isFalse();
        assertThat(table.isReachable("east")).isTrue();
        verify(metrics, never()).recordReset();
    }

    @Test
    void testRepeatedDeleteOfActiveGatewayResetsOnce() {
        // Given
        table.store(Map.of("east", true));
        reconciler.gatewayDeleted(gateway(GATEWAY, "active"));
        StatusSnapshot afterFirstDelete = table.get();

        // When
        boolean reset = reconciler.gatewayDeleted(gateway(GATEWAY, "active"));

        // Then
        assertThat(reset).isFalse();
        assertThat(table.get()).isSameAs(afterFirstDelete);
        verify(metrics, times(1)).recordReset();
    }

    @Test
    void testObjectNoLongerCurrentIsNotApplied() {
        // When
        boolean published = reconciler.gatewayCreatedOrUpdated(
            gateway(GATEWAY, "active", connection("connected", "east")), current -> false);

        // Then
        assertThat(published).isFalse();
        assertThat(table.get().getVersion()).isZero();
        verify(metrics).recordReconcile(eq(OUTCOME_STALE), anyLong());
    }
}
