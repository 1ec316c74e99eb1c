package io.computeorchestrator.enums;

/**
 * OFFLINE stops the workload and copies its disk, LIVE streams memory state while it keeps running.
 */
public enum MigrationMode {
    OFFLINE,
    LIVE;

    public static MigrationMode fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim().toUpperCase();
        for (MigrationMode mode : values()) {
            if (mode.name().equals(trimmed)) {
                return mode;
            }
        }
        return null;
    }
}
