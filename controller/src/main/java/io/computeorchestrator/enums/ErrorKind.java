package io.computeorchestrator.enums;

/**
 * Error taxonomy surfaced to callers of the orchestrator.
 */
public enum ErrorKind {
    /** No node had enough free capacity for the request. */
    INSUFFICIENT_CAPACITY,
    /** Capacity existed but affinity constraints excluded every candidate. */
    AFFINITY_UNSATISFIABLE,
    /** Every node is unhealthy or in maintenance. */
    ALL_NODES_UNAVAILABLE,
    /** Ledger compare-and-commit kept losing to concurrent writers. */
    RESERVATION_CONFLICT,
    /** The workload already has an active migration job. */
    MIGRATION_CONFLICT,
    /** Source and target are not compatible for live migration. */
    PREFLIGHT_INCOMPATIBLE,
    STAGE_TIMEOUT,
    STAGE_FAILED,
    NOT_FOUND,
    INVALID_REQUEST
}
