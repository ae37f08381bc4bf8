package io.gatewaycontroller.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import static io.gatewaycontroller.config.Constants.CONNECTION_STATUS_CONNECTED;

/**
 * A validated connection entry from a gateway's status.
 */
@Data
@AllArgsConstructor
public class GatewayConnection {
    private final String status;
    private final String clusterId;

    public boolean isConnected() {
        return CONNECTION_STATUS_CONNECTED.equals(status);
    }
}
