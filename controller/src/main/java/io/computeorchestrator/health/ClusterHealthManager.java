package io.computeorchestrator.health;

import io.computeorchestrator.enums.HealthStatus;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.models.ClusterHealthInfo;
import io.computeorchestrator.models.ClusterHealthInfo.ResourceUtilization;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

import static io.computeorchestrator.config.Constants.CLUSTER_STATUS_DEGRADED;
import static io.computeorchestrator.config.Constants.CLUSTER_STATUS_HEALTHY;

/**
 * Aggregates node health, workload states and ledger totals into a pool-wide health summary.
 *
 * Resource totals count only nodes outside maintenance and use advertised (overcommitted) capacity.
 * The pool is "healthy" when every node outside maintenance is HEALTHY.
 */
@Slf4j
public class ClusterHealthManager {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final HealthMonitor healthMonitor;
    private final ResourceLedger resourceLedger;

    public ClusterHealthManager(MetadataStore metadataStore, String clusterId,
                                HealthMonitor healthMonitor, ResourceLedger resourceLedger) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.healthMonitor = healthMonitor;
        this.resourceLedger = resourceLedger;
    }

    public ClusterHealthInfo getClusterHealth() throws Exception {
        log.debug("Computing health summary for cluster {}", clusterId);
        List<ComputeNode> nodes = metadataStore.getAllNodes(clusterId);
        List<Workload> workloads = metadataStore.getAllWorkloads(clusterId);
        List<MigrationJob> jobs = metadataStore.getAllMigrationJobs(clusterId);

        ClusterHealthInfo info = new ClusterHealthInfo();
        info.setClusterName(clusterId);
        info.setNumberOfNodes(nodes.size());

        Resources capacity = Resources.ZERO;
        Resources allocated = Resources.ZERO;
        for (ComputeNode node : nodes) {
            HealthStatus status = healthMonitor.getStatus(node.getId());
            switch (status) {
                case HEALTHY -> info.setHealthyNodes(info.getHealthyNodes() + 1);
                case UNHEALTHY -> info.setUnhealthyNodes(info.getUnhealthyNodes() + 1);
                default -> info.setUnknownNodes(info.getUnknownNodes() + 1);
            }
            if (node.isMaintenance()) {
                info.setMaintenanceNodes(info.getMaintenanceNodes() + 1);
                continue;
            }
            info.setActiveNodes(info.getActiveNodes() + 1);
            capacity = capacity.plus(node.getCapacity());
            allocated = allocated.plus(resourceLedger.allocatedCapacity(node.getId()));
        }

        int workloadCount = 0;
        for (WorkloadState state : WorkloadState.values()) {
            info.getWorkloadsByState().put(state.name().toLowerCase(), 0);
        }
        for (Workload workload : workloads) {
            if (workload.getState() == WorkloadState.DELETED) {
                continue;
            }
            workloadCount++;
            String key = workload.getState() != null ? workload.getState().name().toLowerCase() : "unknown";
            info.getWorkloadsByState().merge(key, 1, Integer::sum);
        }
        info.setNumberOfWorkloads(workloadCount);
        info.setActiveMigrations((int) jobs.stream().filter(MigrationJob::isActive).count());

        info.getResources().put("vcpus", utilization(capacity.getVcpus(), allocated.getVcpus()));
        info.getResources().put("memory_mb", utilization(capacity.getMemoryMb(), allocated.getMemoryMb()));
        info.getResources().put("disk_gb", utilization(capacity.getDiskGb(), allocated.getDiskGb()));

        boolean allActiveHealthy = nodes.stream()
            .filter(node -> !node.isMaintenance())
            .allMatch(node -> healthMonitor.getStatus(node.getId()).isHealthy());
        info.setStatus(allActiveHealthy ? CLUSTER_STATUS_HEALTHY : CLUSTER_STATUS_DEGRADED);

        return info;
    }

    private ResourceUtilization utilization(long total, long allocated) {
        long available = Math.max(0L, total - allocated);
        double pct = total > 0 ? (allocated * 100.0) / total : 0.0;
        return new ResourceUtilization(total, allocated, available, pct);
    }
}
