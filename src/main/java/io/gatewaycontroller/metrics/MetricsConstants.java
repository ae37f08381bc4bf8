package io.gatewaycontroller.metrics;

/**
 * Constants for metrics names and tags used in the Gateway Status Controller.
 */
public class MetricsConstants {
    public final static String RECONCILE_TOTAL_METRIC_NAME = "gateway_reconcile_total";
    public final static String RECONCILE_LATENCY_METRIC_NAME = "gateway_reconcile_latency";
    public final static String RECONCILE_REQUEUE_METRIC_NAME = "gateway_reconcile_requeue_total";
    public final static String TABLE_PUBLISH_METRIC_NAME = "gateway_status_table_publish_total";
    public final static String TABLE_RESET_METRIC_NAME = "gateway_status_table_reset_total";
    public final static String SKIPPED_CONNECTION_METRIC_NAME = "gateway_connection_skipped_total";
    public final static String REACHABLE_CLUSTERS_METRIC_NAME = "gateway_reachable_clusters";
    public final static String OUTCOME_TAG = "outcome";

    private MetricsConstants() {}
}
