package io.gatewaycontroller.table;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Copy-on-write store of cluster reachability.
 * <p>
 * Readers get the current {@link StatusSnapshot} with a single volatile read. Writers
 * build a new map and swap it in whole; a published snapshot is never modified.
 * Writes are expected to be serialized by the caller.
 */
@Slf4j
public class GatewayStatusTable implements ClusterReachability {

    private final AtomicReference<StatusSnapshot> current = new AtomicReference<>(StatusSnapshot.EMPTY);

    public StatusSnapshot get() {
        return current.get();
    }

    /**
     * Publish a new table, replacing the current one.
     *
     * @return the published snapshot
     */
    public StatusSnapshot store(Map<String, Boolean> clusters) {
        StatusSnapshot next = current.updateAndGet(previous -> new StatusSnapshot(previous.getVersion() + 1, clusters));
        log.debug("Published gateway status table version {}: {}", next.getVersion(), next.getClusters());
        return next;
    }

    /**
     * Publish an empty table.
     */
    public StatusSnapshot reset() {
        return store(Map.of());
    }

    @Override
    public boolean isReachable(String clusterId) {
        return current.get().isReachable(clusterId);
    }
}
