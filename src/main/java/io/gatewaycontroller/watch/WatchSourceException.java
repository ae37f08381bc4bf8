package io.gatewaycontroller.watch;

/**
 * Thrown when the watch source cannot list its collection or consult its cache.
 */
public class WatchSourceException extends Exception {

    public WatchSourceException(String message) {
        super(message);
    }

    public WatchSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
