package io.gatewaycontroller.watch;

import io.gatewaycontroller.models.GatewayObject;
import io.gatewaycontroller.models.Tombstone;

/**
 * Receives change notifications from a {@link WatchSource}.
 * Callbacks run on the source's delivery thread and must not block.
 * Delivery is at-least-once: resyncs redeliver adds and updates may carry no change.
 */
public interface GatewayEventHandler {

    void onAdd(GatewayObject object);

    void onUpdate(GatewayObject oldObject, GatewayObject newObject);

    /**
     * The object was deleted and its final state is known.
     */
    void onDelete(GatewayObject object);

    /**
     * The object was deleted but only its last cached state, if any, is available.
     */
    void onDelete(Tombstone tombstone);
}
