package io.computeorchestrator.health;

import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.HealthStatus;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.store.InMemoryMetadataStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static io.computeorchestrator.metrics.MetricsConstants.NODE_AVAILABLE_VCPUS_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_HEALTHY_METRIC_NAME;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class HealthMonitorTest {

    private static final String CLUSTER = "test-pool";

    @Mock
    private HealthProbe healthProbe;

    private InMemoryMetadataStore store;
    private SimpleMeterRegistry registry;
    private ResourceLedger ledger;
    private HealthMonitor healthMonitor;
    private AutoCloseable mocks;

    @BeforeEach
    void setUp() throws Exception {
        mocks = MockitoAnnotations.openMocks(this);
        store = new InMemoryMetadataStore();
        registry = new SimpleMeterRegistry();
        MetricsProvider metricsProvider = new MetricsProvider(registry, "test");
        ledger = new ResourceLedger(store, CLUSTER, 3, metricsProvider);
        healthMonitor = new HealthMonitor(store, CLUSTER, healthProbe, ledger, metricsProvider, 30, 1, 3);
        store.upsertNode(CLUSTER, node("node-1"));
    }

    @AfterEach
    void tearDown() throws Exception {
        healthMonitor.stop();
        mocks.close();
    }

    private static ComputeNode node(String id) {
        return ComputeNode.builder()
            .id(id)
            .totalVcpus(8)
            .totalMemoryMb(8192)
            .totalDiskGb(100)
            .build();
    }

    @Test
    void testNeverProbedNodeIsUnknown() {
        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(healthMonitor.getHealthRecord("node-1").getConsecutiveFailures()).isZero();
    }

    @Test
    void testFirstProbeDecidesStatus() throws Exception {
        store.upsertNode(CLUSTER, node("node-2"));

        assertThat(healthMonitor.recordProbeResult("node-1", true, null)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthMonitor.recordProbeResult("node-2", false, "refused")).isEqualTo(HealthStatus.UNHEALTHY);
    }

    @Test
    void testHealthyNodeToleratesFailuresBelowThreshold() throws Exception {
        healthMonitor.recordProbeResult("node-1", true, null);

        assertThat(healthMonitor.recordProbeResult("node-1", false, "timeout")).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthMonitor.recordProbeResult("node-1", false, "timeout")).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthMonitor.getHealthRecord("node-1").getConsecutiveFailures()).isEqualTo(2);
        assertThat(healthMonitor.recordProbeResult("node-1", false, "timeout")).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(healthMonitor.getHealthRecord("node-1").getLastError()).isEqualTo("timeout");
    }

    @Test
    void testSuccessResetsFailureCount() throws Exception {
        healthMonitor.recordProbeResult("node-1", true, null);
        healthMonitor.recordProbeResult("node-1", false, "timeout");
        healthMonitor.recordProbeResult("node-1", false, "timeout");
        healthMonitor.recordProbeResult("node-1", true, null);
        healthMonitor.recordProbeResult("node-1", false, "timeout");
        healthMonitor.recordProbeResult("node-1", false, "timeout");

        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    void testUnhealthyNodeRecoversOnOneSuccess() throws Exception {
        healthMonitor.recordProbeResult("node-1", false, "down");
        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.UNHEALTHY);

        assertThat(healthMonitor.recordProbeResult("node-1", true, null)).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthMonitor.getHealthRecord("node-1").getLastError()).isNull();
    }

    @Test
    void testProbeResultIsPersistedOnNodeRecord() throws Exception {
        healthMonitor.recordProbeResult("node-1", false, "down");

        ComputeNode stored = store.getNode(CLUSTER, "node-1").orElseThrow();
        assertThat(stored.getHealthStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(stored.getLastProbeAt()).isNotNull();
    }

    @Test
    void testProbeAllNodesUsesProbeResults() throws Exception {
        store.upsertNode(CLUSTER, node("node-2"));
        store.upsertNode(CLUSTER, node("node-3"));
        when(healthProbe.probe(argThat(n -> n != null && "node-1".equals(n.getId())))).thenReturn(true);
        when(healthProbe.probe(argThat(n -> n != null && "node-2".equals(n.getId())))).thenReturn(false);
        when(healthProbe.probe(argThat(n -> n != null && "node-3".equals(n.getId()))))
            .thenThrow(new RuntimeException("connection refused"));

        healthMonitor.probeAllNodes();

        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.HEALTHY);
        assertThat(healthMonitor.getStatus("node-2")).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(healthMonitor.getStatus("node-3")).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(healthMonitor.getHealthRecord("node-3").getLastError()).contains("connection refused");
    }

    @Test
    void testSlowProbeCountsAsFailure() throws Exception {
        when(healthProbe.probe(any())).thenAnswer(invocation -> {
            Thread.sleep(5000);
            return true;
        });

        healthMonitor.probeAllNodes();

        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(healthMonitor.getHealthRecord("node-1").getLastError()).contains("timed out");
    }

    @Test
    void testProbeRoundRefreshesCapacityGauges() throws Exception {
        when(healthProbe.probe(any())).thenReturn(true);
        ledger.reserve("node-1", "vm-1", Resources.of(4, 1024, 10));

        healthMonitor.probeAllNodes();

        // 8 physical vCPUs at the default 2.0 ratio, 4 reserved
        assertThat(registry.get(NODE_AVAILABLE_VCPUS_METRIC_NAME).tag("nodeId", "node-1").gauge().value())
            .isEqualTo(12.0);
        assertThat(registry.get(NODE_HEALTHY_METRIC_NAME).tag("nodeId", "node-1").gauge().value())
            .isEqualTo(1.0);
    }

    @Test
    void testMaintenanceIsKeptAcrossProbes() throws Exception {
        healthMonitor.setMaintenance("node-1", true);
        healthMonitor.recordProbeResult("node-1", true, null);

        ComputeNode stored = store.getNode(CLUSTER, "node-1").orElseThrow();
        assertThat(stored.isMaintenance()).isTrue();
        assertThat(stored.getHealthStatus()).isEqualTo(HealthStatus.HEALTHY);

        healthMonitor.setMaintenance("node-1", false);
        assertThat(store.getNode(CLUSTER, "node-1").orElseThrow().isMaintenance()).isFalse();
    }

    @Test
    void testMaintenanceOnUnknownNode() {
        assertThatThrownBy(() -> healthMonitor.setMaintenance("missing", true))
            .isInstanceOf(OrchestratorException.class)
            .extracting(e -> ((OrchestratorException) e).getKind())
            .isEqualTo(ErrorKind.NOT_FOUND);
    }

    @Test
    void testProbeOfRemovedNodeDropsCache() throws Exception {
        store.deleteNode(CLUSTER, "node-1");

        healthMonitor.recordProbeResult("node-1", true, null);

        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.UNKNOWN);
    }

    @Test
    void testForget() throws Exception {
        healthMonitor.recordProbeResult("node-1", true, null);

        healthMonitor.forget("node-1");

        assertThat(healthMonitor.getStatus("node-1")).isEqualTo(HealthStatus.UNKNOWN);
    }

    @Test
    void testStartAndStop() throws Exception {
        when(healthProbe.probe(any())).thenReturn(true);

        healthMonitor.start();
        assertThat(healthMonitor.isRunning()).isTrue();
        verify(healthProbe, timeout(5000).atLeastOnce()).probe(any());

        healthMonitor.stop();
        assertThat(healthMonitor.isRunning()).isFalse();
    }
}
