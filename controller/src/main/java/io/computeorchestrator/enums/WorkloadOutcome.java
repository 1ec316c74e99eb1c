package io.computeorchestrator.enums;

/**
 * What happened to one workload during an evacuation or a rebalance.
 */
public enum WorkloadOutcome {
    MIGRATED,
    FAILED,
    NOT_ATTEMPTED,
    NO_DESTINATION,
    PLANNED
}
