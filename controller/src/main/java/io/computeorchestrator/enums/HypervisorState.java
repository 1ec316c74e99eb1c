package io.computeorchestrator.enums;

/**
 * Workload state as reported by the hypervisor on a given node.
 */
public enum HypervisorState {
    RUNNING,
    STOPPED,
    PAUSED,
    NOT_FOUND,
    UNKNOWN
}
