package io.computeorchestrator.enums;

/**
 * Lifecycle state of a workload (VM deployment).
 */
public enum WorkloadState {
    PROVISIONING,
    RUNNING,
    STOPPED,
    MIGRATING,
    ERROR,
    DELETED
}
