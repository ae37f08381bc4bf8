package io.gatewaycontroller.table;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Map;

/**
 * One immutable version of the cluster id to reachability table.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StatusSnapshot {

    static final StatusSnapshot EMPTY = new StatusSnapshot(0L, Map.of());

    private final long version;
    private final Map<String, Boolean> clusters;

    StatusSnapshot(long version, Map<String, Boolean> clusters) {
        this.version = version;
        this.clusters = Map.copyOf(clusters);
    }

    public boolean isReachable(String clusterId) {
        return clusterId != null && Boolean.TRUE.equals(clusters.get(clusterId));
    }

    public boolean isEmpty() {
        return clusters.isEmpty();
    }
}
