package io.computeorchestrator.enums;

/**
 * States a migration job moves through. Which states are visited depends on the
 * {@link MigrationMode}; see {@code MigrationPlan}.
 */
public enum MigrationState {
    PENDING,
    // offline only
    STOPPING_SOURCE,
    COPYING_DISK,
    PROVISIONING_TARGET,
    STARTING_TARGET,
    // live only
    PREFLIGHT_CHECK,
    STREAMING_STATE,
    SWITCHOVER,
    // shared
    VERIFYING,
    UPDATING_OWNERSHIP,
    CLEANING_SOURCE,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
