package io.computeorchestrator.enums;

/**
 * Node scoring strategies.
 *
 * BALANCED: most free capacity first, PACKED: least free capacity first (bin-packing),
 * SPREAD: fewest workloads first.
 */
public enum PlacementStrategyType {
    BALANCED("balanced"),
    PACKED("packed"),
    SPREAD("spread");

    private final String value;

    PlacementStrategyType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static PlacementStrategyType fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (PlacementStrategyType type : values()) {
            if (type.value.equalsIgnoreCase(trimmed) || type.name().equalsIgnoreCase(trimmed)) {
                return type;
            }
        }
        return null;
    }
}
