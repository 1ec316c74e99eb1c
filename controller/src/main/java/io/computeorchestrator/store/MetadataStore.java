package io.computeorchestrator.store;

import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;

import java.util.List;
import java.util.Optional;

/**
 * Abstraction layer for orchestrator metadata storage supporting different backends (etcd, in-memory).
 * Records that take part in compare-and-commit updates are read together with their version.
 */
public interface MetadataStore {

    // =================================================================
    // COMPUTE NODE OPERATIONS
    // =================================================================

    /**
     * Get all registered compute nodes
     */
    List<ComputeNode> getAllNodes(String clusterId) throws Exception;

    /**
     * Get compute node by id
     */
    Optional<ComputeNode> getNode(String clusterId, String nodeId) throws Exception;

    /**
     * Create or update compute node
     */
    void upsertNode(String clusterId, ComputeNode node) throws Exception;

    /**
     * Delete compute node
     */
    void deleteNode(String clusterId, String nodeId) throws Exception;

    // =================================================================
    // WORKLOAD OPERATIONS
    // =================================================================

    /**
     * Get all workloads
     */
    List<Workload> getAllWorkloads(String clusterId) throws Exception;

    /**
     * Get workload by id
     */
    Optional<Workload> getWorkload(String clusterId, String workloadId) throws Exception;

    /**
     * Get workload with its current version, {@link Versioned#absent()} if it does not exist
     */
    Versioned<Workload> getVersionedWorkload(String clusterId, String workloadId) throws Exception;

    /**
     * Create or update workload unconditionally
     */
    void upsertWorkload(String clusterId, Workload workload) throws Exception;

    /**
     * Write the workload only if its stored version still equals {@code expectedVersion}.
     * @return true if written, false if the record changed in the meantime
     */
    boolean compareAndSetWorkload(String clusterId, Workload workload, long expectedVersion) throws Exception;

    /**
     * Delete a workload record. Deleted workloads normally stay as DELETED records; this removes an
     * unfinished placement claim.
     */
    void deleteWorkload(String clusterId, String workloadId) throws Exception;

    // =================================================================
    // ALLOCATION (LEDGER) OPERATIONS
    // =================================================================

    /**
     * Get the allocation record of a node with its version, {@link Versioned#absent()} if none
     */
    Versioned<NodeAllocation> getAllocation(String clusterId, String nodeId) throws Exception;

    /**
     * Write the allocation record only if its stored version still equals {@code expectedVersion}.
     * Version 0 means "only if no record exists yet".
     */
    boolean compareAndSetAllocation(String clusterId, NodeAllocation allocation, long expectedVersion) throws Exception;

    /**
     * Delete the allocation record of a node
     */
    void deleteAllocation(String clusterId, String nodeId) throws Exception;

    // =================================================================
    // MIGRATION JOB OPERATIONS
    // =================================================================

    /**
     * Get all migration jobs
     */
    List<MigrationJob> getAllMigrationJobs(String clusterId) throws Exception;

    /**
     * Get migration job by id
     */
    Optional<MigrationJob> getMigrationJob(String clusterId, String jobId) throws Exception;

    /**
     * Create or update migration job
     */
    void upsertMigrationJob(String clusterId, MigrationJob job) throws Exception;

    /**
     * Atomically record {@code jobId} as the active migration of a workload.
     * @return false if the workload already has an active migration
     */
    boolean createActiveMigrationIfAbsent(String clusterId, String workloadId, String jobId) throws Exception;

    /**
     * Get the id of the active migration of a workload, if any
     */
    Optional<String> getActiveMigration(String clusterId, String workloadId) throws Exception;

    /**
     * Clear the active migration marker of a workload if it still points at {@code jobId}
     */
    void clearActiveMigration(String clusterId, String workloadId, String jobId) throws Exception;
}
