package io.computeorchestrator.enums;

/**
 * Health status of a compute node as seen by the health monitor.
 *
 * <ul>
 *   <li><strong>UNKNOWN</strong> - Node has not been probed yet</li>
 *   <li><strong>HEALTHY</strong> - Last probe succeeded</li>
 *   <li><strong>UNHEALTHY</strong> - First probe failed, or the failure threshold was reached</li>
 * </ul>
 */
public enum HealthStatus {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY;

    public boolean isHealthy() {
        return this == HEALTHY;
    }
}
