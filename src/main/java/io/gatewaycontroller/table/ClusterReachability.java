package io.gatewaycontroller.table;

/**
 * Read side used by service discovery to decide whether a remote cluster can be answered for.
 * Safe to call from any thread without coordination; never blocks.
 */
public interface ClusterReachability {

    /**
     * @return true if the active gateway currently reports the cluster as connected
     */
    boolean isReachable(String clusterId);
}
