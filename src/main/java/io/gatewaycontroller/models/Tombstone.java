package io.gatewaycontroller.models;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Optional;

/**
 * Delete notification for an object whose final state was not observed,
 * e.g. one that vanished while the watch was down.
 * Carries the last cached copy if there was one.
 */
@Data
@AllArgsConstructor
public class Tombstone {
    private final String key;
    private final GatewayObject lastKnownObject;

    public Optional<GatewayObject> getLastKnownObject() {
        return Optional.ofNullable(lastKnownObject);
    }
}
