package io.computeorchestrator.metrics;

/**
 * Constants for metrics names and tags used by the compute orchestrator.
 */
public class MetricsConstants {
    public final static String PLACEMENT_REQUESTS_METRIC_NAME = "placement_requests_count";
    public final static String RESERVATION_CONFLICTS_METRIC_NAME = "ledger_reservation_conflicts_count";
    public final static String MIGRATIONS_METRIC_NAME = "migrations_count";
    public final static String MIGRATION_DURATION_METRIC_NAME = "migration_duration";
    public final static String NODE_AVAILABLE_VCPUS_METRIC_NAME = "node_available_vcpus";
    public final static String NODE_AVAILABLE_MEMORY_MB_METRIC_NAME = "node_available_memory_mb";
    public final static String NODE_AVAILABLE_DISK_GB_METRIC_NAME = "node_available_disk_gb";
    public final static String NODE_HEALTHY_METRIC_NAME = "node_healthy";
    public final static String CLUSTER_ID_TAG = "clusterId";
    public final static String NODE_ID_TAG = "nodeId";
    public final static String OUTCOME_TAG = "outcome";
    public final static String STRATEGY_TAG = "strategy";
    public final static String MODE_TAG = "mode";

    private MetricsConstants() {}
}
