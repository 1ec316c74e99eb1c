package io.computeorchestrator.store;

import java.nio.file.Paths;

import static io.computeorchestrator.config.Constants.*;

/**
 * Centralized etcd path resolver for all orchestrator keys.
 * Every key lives under the pool (cluster) name so several pools can share one etcd.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // COMPUTE NODE PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-name>/nodes
     */
    public String getNodesPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_NODES).toString();
    }

    /**
     * Pattern: /<cluster-name>/nodes/<node-id>
     */
    public String getNodePath(String clusterName, String nodeId) {
        return Paths.get(getNodesPrefix(clusterName), nodeId).toString();
    }

    // =================================================================
    // WORKLOAD PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-name>/workloads
     */
    public String getWorkloadsPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_WORKLOADS).toString();
    }

    /**
     * Pattern: /<cluster-name>/workloads/<workload-id>
     */
    public String getWorkloadPath(String clusterName, String workloadId) {
        return Paths.get(getWorkloadsPrefix(clusterName), workloadId).toString();
    }

    // =================================================================
    // LEDGER PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-name>/allocations/<node-id>
     */
    public String getAllocationPath(String clusterName, String nodeId) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_ALLOCATIONS, nodeId).toString();
    }

    // =================================================================
    // MIGRATION PATHS
    // =================================================================

    /**
     * Pattern: /<cluster-name>/migrations
     */
    public String getMigrationsPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_MIGRATIONS).toString();
    }

    /**
     * Pattern: /<cluster-name>/migrations/<job-id>
     */
    public String getMigrationPath(String clusterName, String jobId) {
        return Paths.get(getMigrationsPrefix(clusterName), jobId).toString();
    }

    /**
     * Per-workload uniqueness key holding the id of the active job.
     * Pattern: /<cluster-name>/active-migrations/<workload-id>
     */
    public String getActiveMigrationPath(String clusterName, String workloadId) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_ACTIVE_MIGRATIONS, workloadId).toString();
    }
}
