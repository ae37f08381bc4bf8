package io.gatewaycontroller.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatewaycontroller.enums.AbsentClusterPolicy;
import io.gatewaycontroller.metrics.GatewayMetrics;
import io.gatewaycontroller.models.GatewayConnection;
import io.gatewaycontroller.models.GatewayObject;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.table.StatusSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

import static io.gatewaycontroller.config.Constants.HA_STATUS_ACTIVE;
import static io.gatewaycontroller.metrics.GatewayMetrics.*;

/**
 * Derives cluster reachability from gateway status objects and publishes it to the
 * {@link GatewayStatusTable}.
 * <p>
 * Only a gateway reporting {@code haStatus: active} is authoritative. Each update copies
 * the current snapshot lazily, the first time a change is actually needed, and publishes
 * the result in one swap. Both entry points hold this object's monitor, so the queue
 * worker and the delete path never interleave their writes.
 */
@Slf4j
public class GatewayStatusReconciler {

    private final GatewayStatusTable table;
    private final GatewayStatusParser parser;
    private final AbsentClusterPolicy absentClusterPolicy;
    private final GatewayMetrics metrics;

    public GatewayStatusReconciler(GatewayStatusTable table,
                                   GatewayStatusParser parser,
                                   AbsentClusterPolicy absentClusterPolicy,
                                   GatewayMetrics metrics) {
        this.table = table;
        this.parser = parser;
        this.absentClusterPolicy = absentClusterPolicy;
        this.metrics = metrics;
    }

    /**
     * Apply a created or updated gateway to the table.
     *
     * @return true if a new table version was published
     */
    public synchronized boolean gatewayCreatedOrUpdated(GatewayObject gateway) {
        return gatewayCreatedOrUpdated(gateway, current -> true);
    }

    /**
     * Apply a created or updated gateway, unless {@code isCurrent} reports that the object
     * was superseded or deleted since it was read. The check runs under the same monitor as
     * {@link #gatewayDeleted}, so a delete that won the race is never undone.
     *
     * @return true if a new table version was published
     */
    public synchronized boolean gatewayCreatedOrUpdated(GatewayObject gateway, Predicate<GatewayObject> isCurrent) {
        long startNanos = System.nanoTime();

        if (!isCurrent.test(gateway)) {
            log.debug("Gateway {} at revision {} is no longer current, ignoring", gateway.getKey(), gateway.getRevision());
            metrics.recordReconcile(OUTCOME_STALE, System.nanoTime() - startNanos);
            return false;
        }

        Optional<String> haStatus = parser.extractHaStatus(gateway);
        if (haStatus.isEmpty() || !HA_STATUS_ACTIVE.equals(haStatus.get())) {
            log.debug("Gateway {} is not active ({}), ignoring", gateway.getKey(), haStatus.orElse("unknown"));
            metrics.recordReconcile(OUTCOME_IGNORED, System.nanoTime() - startNanos);
            return false;
        }

        Optional<List<JsonNode>> connections = parser.extractConnections(gateway);
        if (connections.isEmpty()) {
            metrics.recordReconcile(OUTCOME_IGNORED, System.nanoTime() - startNanos);
            return false;
        }

        StatusSnapshot current = table.get();
        Map<String, Boolean> currentClusters = current.getClusters();
        Map<String, Boolean> working = null;
        Set<String> reported = new HashSet<>();

        for (JsonNode entry : connections.get()) {
            Optional<GatewayConnection> parsed = parser.extractConnection(gateway.getKey(), entry);
            if (parsed.isEmpty()) {
                metrics.recordSkippedConnection();
                continue;
            }
            GatewayConnection connection = parsed.get();
            String clusterId = connection.getClusterId();
            reported.add(clusterId);

            Map<String, Boolean> view = working != null ? working : currentClusters;
            if (connection.isConnected()) {
                if (!view.containsKey(clusterId)) {
                    if (working == null) {
                        working = new HashMap<>(currentClusters);
                    }
                    working.put(clusterId, Boolean.TRUE);
                }
            } else if (view.containsKey(clusterId)) {
                if (working == null) {
                    working = new HashMap<>(currentClusters);
                }
                working.remove(clusterId);
            }
        }

        if (absentClusterPolicy == AbsentClusterPolicy.PRUNE) {
            Set<String> absent = new HashSet<>(working != null ? working.keySet() : currentClusters.keySet());
            absent.removeAll(reported);
            if (!absent.isEmpty()) {
                if (working == null) {
                    working = new HashMap<>(currentClusters);
                }
                working.keySet().removeAll(absent);
                log.info("Clusters {} no longer reported by gateway {}, pruning", absent, gateway.getKey());
            }
        }

        if (working == null) {
            metrics.recordReconcile(OUTCOME_UNCHANGED, System.nanoTime() - startNanos);
            return false;
        }

        StatusSnapshot published = table.store(working);
        log.info("Updating the gateway status from gateway {}: version {} {}",
            gateway.getKey(), published.getVersion(), published.getClusters());
        metrics.recordPublish(published.getClusters().size());
        metrics.recordReconcile(OUTCOME_APPLIED, System.nanoTime() - startNanos);
        return true;
    }

    /**
     * Apply the deletion of a gateway, given its last known state.
     * Deleting the active gateway makes every remote cluster unreachable.
     *
     * A table that is already empty is left alone, so redelivered deletes publish nothing.
     *
     * @return true if the table was reset
     */
    public synchronized boolean gatewayDeleted(GatewayObject lastKnown) {
        if (!parser.isActive(lastKnown)) {
            log.debug("Deleted gateway {} was not active, table unchanged", lastKnown.getKey());
            return false;
        }
        if (table.get().isEmpty()) {
            log.debug("Active gateway {} deleted, gateway status already empty", lastKnown.getKey());
            return false;
        }
        StatusSnapshot published = table.reset();
        log.info("Active gateway {} deleted, reset gateway status to empty (version {})",
            lastKnown.getKey(), published.getVersion());
        metrics.recordReset();
        return true;
    }
}
