package io.gatewaycontroller.watch;

import io.gatewaycontroller.models.GatewayObject;

import java.io.Closeable;
import java.util.Optional;

/**
 * Source of gateway status change notifications backed by a local read-through cache.
 */
public interface WatchSource extends Closeable {

    /**
     * Establish the initial listing and begin delivering notifications to the handler.
     *
     * @throws WatchSourceException if the collection cannot be listed
     */
    void start(GatewayEventHandler handler) throws WatchSourceException;

    /**
     * Look up the latest cached state of an object.
     *
     * @return the object, or empty if it is not (or no longer) known
     * @throws WatchSourceException if the cache cannot be consulted right now
     */
    Optional<GatewayObject> getByKey(String key) throws WatchSourceException;

    /**
     * Stop delivering notifications. Safe to call more than once.
     */
    @Override
    void close();
}
