package io.computeorchestrator.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_CLUSTER_NAME = "default-pool";
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String STORE_TYPE_ETCD = "etcd";
    public static final String STORE_TYPE_MEMORY = "memory";
    public static final String DEFAULT_STORE_TYPE = STORE_TYPE_ETCD;

    // Health monitor
    public static final long DEFAULT_PROBE_INTERVAL_SECONDS = 30L;
    public static final long DEFAULT_PROBE_TIMEOUT_SECONDS = 10L;
    public static final int DEFAULT_HEALTH_FAILURE_THRESHOLD = 3;

    // Placement
    public static final String DEFAULT_PLACEMENT_STRATEGY = "balanced";
    public static final int DEFAULT_MAX_RESERVATION_RETRIES = 5;

    // Migration
    public static final int DEFAULT_MAX_CONCURRENT_MIGRATIONS = 2;
    public static final int DEFAULT_MIGRATION_WORKER_THREADS = 4;
    public static final long DEFAULT_STAGE_TIMEOUT_SECONDS = 600L;
    public static final int DEFAULT_RELEASE_RETRIES = 10;

    // Rebalance
    public static final double DEFAULT_REBALANCE_MIN_IMPROVEMENT = 0.001;
    public static final int DEFAULT_REBALANCE_MAX_MOVES = 10;

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_NODES = "nodes";
    public static final String PATH_WORKLOADS = "workloads";
    public static final String PATH_ALLOCATIONS = "allocations";
    public static final String PATH_MIGRATIONS = "migrations";
    public static final String PATH_ACTIVE_MIGRATIONS = "active-migrations";

    // Cluster health status values
    public static final String CLUSTER_STATUS_HEALTHY = "healthy";
    public static final String CLUSTER_STATUS_DEGRADED = "degraded";
}
