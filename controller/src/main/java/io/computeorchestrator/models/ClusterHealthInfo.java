package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response class for pool health information
 */
@Data
@NoArgsConstructor
public class ClusterHealthInfo {
    @JsonProperty("cluster_name")
    private String clusterName;

    // "healthy" when every node outside maintenance is HEALTHY, otherwise "degraded"
    @JsonProperty("status")
    private String status;

    @JsonProperty("number_of_nodes")
    private int numberOfNodes;

    @JsonProperty("active_nodes")
    private int activeNodes;

    @JsonProperty("healthy_nodes")
    private int healthyNodes;

    @JsonProperty("unhealthy_nodes")
    private int unhealthyNodes;

    @JsonProperty("unknown_nodes")
    private int unknownNodes;

    @JsonProperty("maintenance_nodes")
    private int maintenanceNodes;

    @JsonProperty("number_of_workloads")
    private int numberOfWorkloads;

    @JsonProperty("workloads_by_state")
    private Map<String, Integer> workloadsByState = new LinkedHashMap<>();

    @JsonProperty("active_migrations")
    private int activeMigrations;

    @JsonProperty("resources")
    private Map<String, ResourceUtilization> resources = new LinkedHashMap<>();

    /**
     * Pool-wide totals for one resource dimension.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ResourceUtilization {
        @JsonProperty("total")
        private long total;

        @JsonProperty("allocated")
        private long allocated;

        @JsonProperty("available")
        private long available;

        @JsonProperty("utilization_pct")
        private double utilizationPct;
    }
}
