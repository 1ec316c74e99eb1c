package io.computeorchestrator.health;

import io.computeorchestrator.enums.HealthStatus;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Periodically probes every registered node and keeps a cached, flap-resistant health status per node.
 *
 * Transitions: UNKNOWN goes to HEALTHY or UNHEALTHY on the first probe; HEALTHY goes to UNHEALTHY only
 * after {@code failureThreshold} consecutive failures; UNHEALTHY goes back to HEALTHY on one success.
 * A probe that does not answer within {@code probeTimeoutSeconds} counts as a failure.
 *
 * Status reads never probe. The monitor is also the only writer of the maintenance flag, which probing
 * never clears.
 */
@Slf4j
public class HealthMonitor {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final HealthProbe healthProbe;
    private final ResourceLedger resourceLedger;
    private final MetricsProvider metricsProvider;
    private final long probeIntervalSeconds;
    private final long probeTimeoutSeconds;
    private final int failureThreshold;

    private final Map<String, NodeHealthRecord> healthCache = new ConcurrentHashMap<>();
    private final Object nodeRecordLock = new Object();
    private final ScheduledExecutorService scheduler;
    private final ExecutorService probeExecutor;
    private volatile boolean isRunning = false;

    public HealthMonitor(MetadataStore metadataStore, String clusterId, HealthProbe healthProbe,
                         ResourceLedger resourceLedger, MetricsProvider metricsProvider,
                         long probeIntervalSeconds, long probeTimeoutSeconds, int failureThreshold) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.healthProbe = healthProbe;
        this.resourceLedger = resourceLedger;
        this.metricsProvider = metricsProvider;
        this.probeIntervalSeconds = probeIntervalSeconds;
        this.probeTimeoutSeconds = probeTimeoutSeconds;
        this.failureThreshold = failureThreshold;
        this.scheduler = Executors.newScheduledThreadPool(1);
        this.probeExecutor = Executors.newCachedThreadPool();
    }

    public void start() {
        log.info("[Cluster: {}] Starting health monitor, probing every {}s", clusterId, probeIntervalSeconds);
        isRunning = true;
        scheduler.scheduleWithFixedDelay(
                this::probeLoop,
                0,
                probeIntervalSeconds,
                TimeUnit.SECONDS
        );
    }

    public void stop() {
        log.info("[Cluster: {}] Stopping health monitor", clusterId);
        isRunning = false;
        scheduler.shutdown();
        probeExecutor.shutdownNow();
    }

    public boolean isRunning() {
        return isRunning;
    }

    private void probeLoop() {
        try {
            probeAllNodes();
        } catch (Exception e) {
            // keep the schedule alive; next round retries
            log.error("[Cluster: {}] Health probe round failed: {}", clusterId, e.getMessage(), e);
        }
    }

    /**
     * Probe every registered node once, in parallel, and update the cache and node records.
     */
    public void probeAllNodes() throws Exception {
        List<ComputeNode> nodes = metadataStore.getAllNodes(clusterId);
        Map<ComputeNode, Future<Boolean>> probes = new LinkedHashMap<>();
        for (ComputeNode node : nodes) {
            probes.put(node, probeExecutor.submit(() -> healthProbe.probe(node)));
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(probeTimeoutSeconds);
        for (Map.Entry<ComputeNode, Future<Boolean>> entry : probes.entrySet()) {
            String nodeId = entry.getKey().getId();
            boolean healthy;
            String error = null;
            try {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                healthy = Boolean.TRUE.equals(entry.getValue().get(remaining, TimeUnit.NANOSECONDS));
                if (!healthy) {
                    error = "probe reported node unusable";
                }
            } catch (TimeoutException e) {
                entry.getValue().cancel(true);
                healthy = false;
                error = "probe timed out after " + probeTimeoutSeconds + "s";
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw e;
            } catch (Exception e) {
                healthy = false;
                error = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            }
            recordProbeResult(nodeId, healthy, error);
        }

        refreshCapacityGauges(nodes);
    }

    /**
     * Apply one probe result to the node's state machine and persist the node record.
     *
     * @return the node's status after the transition
     */
    public HealthStatus recordProbeResult(String nodeId, boolean success, String error) throws Exception {
        NodeHealthRecord record = healthCache.computeIfAbsent(nodeId, NodeHealthRecord::new);
        HealthStatus previous;
        HealthStatus next;
        OffsetDateTime probedAt = OffsetDateTime.now();
        synchronized (record) {
            previous = record.getStatus();
            if (success) {
                record.setConsecutiveFailures(0);
                record.setLastError(null);
                next = HealthStatus.HEALTHY;
            } else {
                record.setConsecutiveFailures(record.getConsecutiveFailures() + 1);
                record.setLastError(error);
                if (previous == HealthStatus.HEALTHY && record.getConsecutiveFailures() < failureThreshold) {
                    next = HealthStatus.HEALTHY;
                } else {
                    next = HealthStatus.UNHEALTHY;
                }
            }
            record.setStatus(next);
            record.setLastProbeAt(probedAt);
        }

        if (previous != next) {
            log.info("[Cluster: {}] Node {} health changed {} -> {}{}", clusterId, nodeId, previous, next,
                error != null ? " (" + error + ")" : "");
        } else if (!success) {
            log.debug("[Cluster: {}] Node {} probe failed ({} consecutive): {}", clusterId, nodeId,
                record.getConsecutiveFailures(), error);
        }

        persistHealth(nodeId, next, probedAt);
        return next;
    }

    /**
     * Cached status of a node, UNKNOWN if it was never probed.
     */
    public HealthStatus getStatus(String nodeId) {
        NodeHealthRecord record = healthCache.get(nodeId);
        return record != null ? record.getStatus() : HealthStatus.UNKNOWN;
    }

    public NodeHealthRecord getHealthRecord(String nodeId) {
        NodeHealthRecord record = healthCache.get(nodeId);
        if (record == null) {
            return new NodeHealthRecord(nodeId);
        }
        synchronized (record) {
            return new NodeHealthRecord(record.getNodeId(), record.getStatus(), record.getConsecutiveFailures(),
                record.getLastProbeAt(), record.getLastError());
        }
    }

    /**
     * Put a node into or take it out of maintenance. Workloads on the node are not moved.
     */
    public ComputeNode setMaintenance(String nodeId, boolean maintenance) throws Exception {
        synchronized (nodeRecordLock) {
            ComputeNode node = metadataStore.getNode(clusterId, nodeId)
                .orElseThrow(() -> OrchestratorException.notFound("Node " + nodeId));
            if (node.isMaintenance() == maintenance) {
                log.debug("[Cluster: {}] Node {} maintenance already {}", clusterId, nodeId, maintenance);
                return node;
            }
            node.setMaintenance(maintenance);
            metadataStore.upsertNode(clusterId, node);
            log.info("[Cluster: {}] Node {} {} maintenance", clusterId, nodeId, maintenance ? "entered" : "left");
            return node;
        }
    }

    /**
     * Write a node's hardware description. An existing node keeps its maintenance flag and health fields,
     * and may not shrink below what the ledger has already reserved on it. Serialized with maintenance
     * and probe updates of the node records.
     */
    public ComputeNode saveNode(ComputeNode node) throws Exception {
        synchronized (nodeRecordLock) {
            Optional<ComputeNode> existing = metadataStore.getNode(clusterId, node.getId());
            if (existing.isEmpty()) {
                node.setHealthStatus(getStatus(node.getId()));
                metadataStore.upsertNode(clusterId, node);
                log.info("[Cluster: {}] Registered node {} ({}) with capacity {}", clusterId, node.getId(),
                    node.getHostname(), node.getCapacity());
                return node;
            }

            requireRoomFor(node);
            node.setMaintenance(existing.get().isMaintenance());
            node.setHealthStatus(existing.get().getHealthStatus());
            node.setLastProbeAt(existing.get().getLastProbeAt());
            metadataStore.upsertNode(clusterId, node);
            try {
                // a reservation may have committed against the old capacity in the meantime
                requireRoomFor(node);
            } catch (OrchestratorException e) {
                metadataStore.upsertNode(clusterId, existing.get());
                throw e;
            }
            log.info("[Cluster: {}] Updated node {} ({}), capacity {}", clusterId, node.getId(), node.getHostname(),
                node.getCapacity());
            return node;
        }
    }

    private void requireRoomFor(ComputeNode node) throws Exception {
        Resources allocated = resourceLedger.allocatedCapacity(node.getId());
        if (!node.getCapacity().fits(allocated)) {
            throw OrchestratorException.invalid("Node " + node.getId() + " capacity " + node.getCapacity()
                + " is below its reserved " + allocated);
        }
    }

    /**
     * Drop cached state of a node that was removed from the pool.
     */
    public void forget(String nodeId) {
        healthCache.remove(nodeId);
    }

    private void persistHealth(String nodeId, HealthStatus status, OffsetDateTime probedAt) throws Exception {
        synchronized (nodeRecordLock) {
            Optional<ComputeNode> stored = metadataStore.getNode(clusterId, nodeId);
            if (stored.isEmpty()) {
                // removed while the probe was running
                healthCache.remove(nodeId);
                return;
            }
            ComputeNode node = stored.get();
            node.setHealthStatus(status);
            node.setLastProbeAt(probedAt);
            metadataStore.upsertNode(clusterId, node);
        }
    }

    private void refreshCapacityGauges(List<ComputeNode> nodes) {
        for (ComputeNode node : nodes) {
            try {
                metricsProvider.recordNodeCapacity(clusterId, node.getId(),
                    resourceLedger.availableCapacity(node.getId()), getStatus(node.getId()).isHealthy());
            } catch (Exception e) {
                log.warn("[Cluster: {}] Failed to refresh capacity gauges for node {}: {}", clusterId, node.getId(), e.getMessage());
            }
        }
    }
}
