package io.computeorchestrator.enums;

/**
 * Overall result of a node evacuation.
 */
public enum EvacuationStatus {
    COMPLETED,
    // dry run found a workload with no destination; nothing was moved
    PRECHECK_FAILED,
    PARTIAL_FAILURE,
    CANCELLED
}
