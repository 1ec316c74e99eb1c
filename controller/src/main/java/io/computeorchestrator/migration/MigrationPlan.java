package io.computeorchestrator.migration;

import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.MigrationState;

import java.util.List;

import static io.computeorchestrator.enums.MigrationState.*;

/**
 * Ordered stages of each migration mode and the position of the ownership commit point.
 *
 * Stages before UPDATING_OWNERSHIP are rolled back on failure. A failed UPDATING_OWNERSHIP is rolled back
 * only if the stored owner is still the source; once ownership has moved, a failure leaves the workload
 * on the target.
 */
public final class MigrationPlan {

    private static final List<MigrationState> OFFLINE_STAGES = List.of(
        STOPPING_SOURCE, COPYING_DISK, PROVISIONING_TARGET, VERIFYING, STARTING_TARGET,
        UPDATING_OWNERSHIP, CLEANING_SOURCE);

    private static final List<MigrationState> LIVE_STAGES = List.of(
        PREFLIGHT_CHECK, STREAMING_STATE, SWITCHOVER, VERIFYING,
        UPDATING_OWNERSHIP, CLEANING_SOURCE);

    private MigrationPlan() {
        // Utility class
    }

    /**
     * Stages executed after PENDING, in order, ending before COMPLETED.
     */
    public static List<MigrationState> stagesFor(MigrationMode mode) {
        return mode == MigrationMode.LIVE ? LIVE_STAGES : OFFLINE_STAGES;
    }

    public static boolean isCommitPoint(MigrationState stage) {
        return stage == UPDATING_OWNERSHIP;
    }

    /**
     * True if a failure in {@code stage} may need rolling back. For the commit point the caller must
     * still check whether the owner already moved.
     */
    public static boolean isBeforeCommit(MigrationState stage) {
        return stage != CLEANING_SOURCE && stage != COMPLETED;
    }
}
