package io.computeorchestrator.ledger;

/**
 * Result of a single reservation attempt against a node's allocation record.
 */
public enum ReservationOutcome {
    RESERVED,
    // the workload already holds a reservation on the node
    ALREADY_RESERVED,
    // record changed between read and write; caller may retry
    CONFLICT,
    INSUFFICIENT_CAPACITY,
    UNKNOWN_NODE;

    public boolean isHeld() {
        return this == RESERVED || this == ALREADY_RESERVED;
    }
}
