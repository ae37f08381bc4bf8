package io.gatewaycontroller.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_GATEWAY_ROOT_PATH = "/mesh";
    public static final long DEFAULT_RESYNC_SECONDS = 0L;
    public static final long DEFAULT_QUEUE_BASE_DELAY_MILLIS = 5L;
    public static final long DEFAULT_QUEUE_MAX_DELAY_SECONDS = 1000L;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_GATEWAYS = "gateways";

    // Gateway status field names
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_HA_STATUS = "haStatus";
    public static final String FIELD_CONNECTIONS = "connections";
    public static final String FIELD_ENDPOINT = "endpoint";
    public static final String FIELD_CLUSTER_ID = "cluster_id";
    public static final String FIELD_CLUSTER_ID_ALIAS = "clusterId";

    // Gateway status values
    public static final String HA_STATUS_ACTIVE = "active";
    public static final String CONNECTION_STATUS_CONNECTED = "connected";

    // etcd timeouts
    public static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5L;
    public static final long WATCH_RETRY_DELAY_MILLIS = 1000L;
}
