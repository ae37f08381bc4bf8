package io.gatewaycontroller.reconcile;

import com.fasterxml.jackson.databind.JsonNode;
import io.gatewaycontroller.models.GatewayConnection;
import io.gatewaycontroller.models.GatewayObject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.gatewaycontroller.config.Constants.*;

/**
 * Best-effort extraction of the fields the controller consumes from a gateway's
 * unstructured status. Missing or mistyped fields are logged and reported as empty;
 * nothing here throws on bad input.
 */
@Slf4j
public class GatewayStatusParser {

    /**
     * Extract {@code status.haStatus}.
     */
    public Optional<String> extractHaStatus(GatewayObject gateway) {
        Optional<JsonNode> status = extractStatus(gateway);
        if (status.isEmpty()) {
            return Optional.empty();
        }
        JsonNode haStatus = status.get().get(FIELD_HA_STATUS);
        if (haStatus == null || !haStatus.isTextual()) {
            log.error("haStatus field not found in status of gateway {}: {}", gateway.getKey(), status.get());
            return Optional.empty();
        }
        return Optional.of(haStatus.asText());
    }

    public boolean isActive(GatewayObject gateway) {
        return extractHaStatus(gateway).map(HA_STATUS_ACTIVE::equals).orElse(false);
    }

    /**
     * Extract the raw {@code status.connections} entries, in reported order.
     */
    public Optional<List<JsonNode>> extractConnections(GatewayObject gateway) {
        Optional<JsonNode> status = extractStatus(gateway);
        if (status.isEmpty()) {
            return Optional.empty();
        }
        JsonNode connections = status.get().get(FIELD_CONNECTIONS);
        if (connections == null || !connections.isArray()) {
            log.error("connections field not found in status of gateway {}: {}", gateway.getKey(), status.get());
            return Optional.empty();
        }
        List<JsonNode> entries = new ArrayList<>(connections.size());
        connections.forEach(entries::add);
        return Optional.of(entries);
    }

    /**
     * Validate one connection entry: it needs a textual {@code status} and a non-empty
     * {@code endpoint.cluster_id} (or {@code endpoint.clusterId}).
     */
    public Optional<GatewayConnection> extractConnection(String gatewayKey, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            log.error("Connection entry of gateway {} is not an object: {}", gatewayKey, entry);
            return Optional.empty();
        }
        JsonNode status = entry.get(FIELD_STATUS);
        if (status == null || !status.isTextual()) {
            log.error("status field not found in connection of gateway {}: {}", gatewayKey, entry);
            return Optional.empty();
        }
        Optional<String> clusterId = extractClusterId(entry);
        if (clusterId.isEmpty()) {
            log.error("clusterId field not found in connection of gateway {}: {}", gatewayKey, entry);
            return Optional.empty();
        }
        return Optional.of(new GatewayConnection(status.asText(), clusterId.get()));
    }

    private Optional<String> extractClusterId(JsonNode entry) {
        JsonNode endpoint = entry.get(FIELD_ENDPOINT);
        if (endpoint == null || !endpoint.isObject()) {
            return Optional.empty();
        }
        JsonNode clusterId = endpoint.get(FIELD_CLUSTER_ID);
        if (clusterId == null) {
            clusterId = endpoint.get(FIELD_CLUSTER_ID_ALIAS);
        }
        if (clusterId == null || !clusterId.isTextual() || clusterId.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(clusterId.asText());
    }

    private Optional<JsonNode> extractStatus(GatewayObject gateway) {
        JsonNode object = gateway.getObject();
        JsonNode status = object == null ? null : object.get(FIELD_STATUS);
        if (status == null || !status.isObject()) {
            log.error("status field not found in gateway {}", gateway.getKey());
            return Optional.empty();
        }
        return Optional.of(status);
    }
}
