package io.gatewaycontroller.api.handlers;

import io.gatewaycontroller.GatewayStatusController;
import io.gatewaycontroller.api.models.responses.ClusterReachabilityResponse;
import io.gatewaycontroller.api.models.responses.ErrorResponse;
import io.gatewaycontroller.api.models.responses.GatewayStatusResponse;
import io.gatewaycontroller.table.GatewayStatusTable;
import io.gatewaycontroller.table.StatusSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Read-only REST view of the gateway status table.
 *
 * Supported operations:
 * - GET /_gateway/status - current table version, controller state and reachable clusters
 * - GET /_gateway/clusters/{clusterId} - reachability of one remote cluster
 */
@Slf4j
@RestController
@RequestMapping("/_gateway")
public class GatewayStatusHandler {

    private final GatewayStatusTable table;
    private final GatewayStatusController controller;

    public GatewayStatusHandler(GatewayStatusTable table, GatewayStatusController controller) {
        this.table = table;
        this.controller = controller;
    }

    /**
     * GET /_gateway/status
     */
    @GetMapping("/status")
    public ResponseEntity<Object> getStatus() {
        try {
            StatusSnapshot snapshot = table.get();
            log.debug("Getting gateway status table version {}", snapshot.getVersion());
            return ResponseEntity.ok(GatewayStatusResponse.from(snapshot, controller.getState()));
        } catch (Exception e) {
            log.error("Error getting gateway status: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }

    /**
     * GET /_gateway/clusters/{clusterId}
     */
    @GetMapping("/clusters/{clusterId}")
    public ResponseEntity<Object> getClusterReachability(@PathVariable String clusterId) {
        if (clusterId == null || clusterId.isBlank()) {
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ErrorResponse.badRequest("clusterId cannot be empty"));
        }
        try {
            boolean reachable = table.isReachable(clusterId);
            log.debug("Cluster '{}' reachable: {}", clusterId, reachable);
            return ResponseEntity.ok(new ClusterReachabilityResponse(clusterId, reachable));
        } catch (Exception e) {
            log.error("Error getting reachability for cluster '{}': {}", clusterId, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.internalError(e.getMessage()));
        }
    }
}
