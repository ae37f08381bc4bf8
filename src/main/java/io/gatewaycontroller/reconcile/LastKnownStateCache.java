package io.gatewaycontroller.reconcile;

import io.gatewaycontroller.models.GatewayObject;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Most recently observed state per gateway identity.
 * Written on every add/update and consumed once when the gateway is deleted,
 * so the delete path knows the gateway's HA status even when the notification
 * carries no payload.
 */
public class LastKnownStateCache {

    private final ConcurrentMap<String, GatewayObject> states = new ConcurrentHashMap<>();

    public void record(GatewayObject gateway) {
        states.put(gateway.getKey(), gateway);
    }

    public Optional<GatewayObject> get(String key) {
        return Optional.ofNullable(states.get(key));
    }

    /**
     * Remove and return the state recorded for a deleted gateway.
     */
    public Optional<GatewayObject> consume(String key) {
        return Optional.ofNullable(states.remove(key));
    }
}
