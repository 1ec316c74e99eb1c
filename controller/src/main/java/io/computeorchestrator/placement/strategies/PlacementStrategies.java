package io.computeorchestrator.placement.strategies;

import io.computeorchestrator.enums.PlacementStrategyType;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.Map;

/**
 * Lookup of the built-in placement strategies.
 */
@Slf4j
public final class PlacementStrategies {

    private static final Map<PlacementStrategyType, PlacementStrategy> STRATEGIES = new EnumMap<>(PlacementStrategyType.class);

    static {
        STRATEGIES.put(PlacementStrategyType.BALANCED, new BalancedPlacementStrategy());
        STRATEGIES.put(PlacementStrategyType.PACKED, new PackedPlacementStrategy());
        STRATEGIES.put(PlacementStrategyType.SPREAD, new SpreadPlacementStrategy());
    }

    private PlacementStrategies() {
        // Utility class
    }

    public static PlacementStrategy forType(PlacementStrategyType type) {
        return STRATEGIES.get(type != null ? type : PlacementStrategyType.BALANCED);
    }

    /**
     * Resolve a strategy by name. Unknown names fall back to balanced.
     */
    public static PlacementStrategy forName(String name) {
        PlacementStrategyType type = PlacementStrategyType.fromString(name);
        if (type == null) {
            log.warn("Unknown placement strategy '{}', falling back to balanced", name);
            type = PlacementStrategyType.BALANCED;
        }
        return STRATEGIES.get(type);
    }
}
