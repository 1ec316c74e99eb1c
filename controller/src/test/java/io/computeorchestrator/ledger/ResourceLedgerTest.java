package io.computeorchestrator.ledger;

import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.store.InMemoryMetadataStore;
import io.computeorchestrator.store.MetadataStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class ResourceLedgerTest {

    private static final String CLUSTER = "test-pool";

    private InMemoryMetadataStore store;
    private ResourceLedger ledger;

    @BeforeEach
    void setUp() throws Exception {
        store = new InMemoryMetadataStore();
        ledger = new ResourceLedger(store, CLUSTER, 3, new MetricsProvider(new SimpleMeterRegistry(), "test"));
        store.upsertNode(CLUSTER, ComputeNode.builder()
            .id("node-1")
            .totalVcpus(8)
            .totalMemoryMb(16384)
            .totalDiskGb(500)
            .build());
    }

    @Test
    void testCapacityAppliesOvercommitRatios() throws Exception {
        // Default ratios: cpu 2.0, memory 1.0, disk 1.0
        assertThat(ledger.totalCapacity("node-1")).isEqualTo(Resources.of(16, 16384, 500));
        assertThat(ledger.availableCapacity("node-1")).isEqualTo(Resources.of(16, 16384, 500));
        assertThat(ledger.allocatedCapacity("node-1")).isEqualTo(Resources.ZERO);
        assertThat(ledger.workloadCount("node-1")).isZero();
    }

    @Test
    void testCapacityRoundsDown() throws Exception {
        store.upsertNode(CLUSTER, ComputeNode.builder()
            .id("node-2")
            .totalVcpus(3)
            .totalMemoryMb(1000)
            .totalDiskGb(10)
            .cpuOvercommitRatio(1.5)
            .memoryOvercommitRatio(1.25)
            .diskOvercommitRatio(1.0)
            .build());

        assertThat(ledger.totalCapacity("node-2")).isEqualTo(Resources.of(4, 1250, 10));
    }

    @Test
    void testReserveAndRelease() throws Exception {
        ReservationOutcome outcome = ledger.reserve("node-1", "vm-1", Resources.of(4, 4096, 50));

        assertThat(outcome).isEqualTo(ReservationOutcome.RESERVED);
        assertThat(ledger.availableCapacity("node-1")).isEqualTo(Resources.of(12, 12288, 450));
        assertThat(ledger.reservations("node-1")).containsOnlyKeys("vm-1");
        assertThat(ledger.workloadCount("node-1")).isEqualTo(1);

        ledger.release("node-1", "vm-1");

        assertThat(ledger.availableCapacity("node-1")).isEqualTo(Resources.of(16, 16384, 500));
        assertThat(ledger.reservations("node-1")).isEmpty();
    }

    @Test
    void testReserveTwiceForSameWorkloadIsHeldOnce() throws Exception {
        ledger.reserve("node-1", "vm-1", Resources.of(4, 4096, 50));

        ReservationOutcome second = ledger.reserve("node-1", "vm-1", Resources.of(4, 4096, 50));

        assertThat(second).isEqualTo(ReservationOutcome.ALREADY_RESERVED);
        assertThat(second.isHeld()).isTrue();
        assertThat(ledger.allocatedCapacity("node-1")).isEqualTo(Resources.of(4, 4096, 50));
    }

    @Test
    void testReserveRejectsWhenAnyDimensionDoesNotFit() throws Exception {
        ReservationOutcome outcome = ledger.reserve("node-1", "vm-1", Resources.of(1, 1024, 501));

        assertThat(outcome).isEqualTo(ReservationOutcome.INSUFFICIENT_CAPACITY);
        assertThat(ledger.allocatedCapacity("node-1")).isEqualTo(Resources.ZERO);
    }

    @Test
    void testReserveExactlyRemainingCapacity() throws Exception {
        assertThat(ledger.tryReserve("node-1", "vm-1", Resources.of(16, 16384, 500))).isTrue();
        assertThat(ledger.availableCapacity("node-1")).isEqualTo(Resources.ZERO);
        assertThat(ledger.tryReserve("node-1", "vm-2", Resources.of(0, 0, 0))).isTrue();
        assertThat(ledger.tryReserve("node-1", "vm-3", Resources.of(1, 0, 0))).isFalse();
    }

    @Test
    void testReserveOnUnknownNode() throws Exception {
        assertThat(ledger.reserve("missing", "vm-1", Resources.of(1, 1, 1))).isEqualTo(ReservationOutcome.UNKNOWN_NODE);
    }

    @Test
    void testReserveRejectsNegativeRequest() {
        assertThatThrownBy(() -> ledger.reserve("node-1", "vm-1", Resources.of(-1, 0, 0)))
            .isInstanceOf(OrchestratorException.class)
            .extracting(e -> ((OrchestratorException) e).getKind())
            .isEqualTo(ErrorKind.INVALID_REQUEST);
    }

    @Test
    void testCapacityQueriesOnUnknownNodeFail() {
        assertThatThrownBy(() -> ledger.availableCapacity("missing"))
            .isInstanceOf(OrchestratorException.class)
            .hasMessageContaining("missing");
    }

    @Test
    void testReleaseOfAbsentReservationIsNoop() throws Exception {
        ledger.release("node-1", "never-reserved");
        ledger.release("unknown-node", "vm-1");

        assertThat(store.getAllocation(CLUSTER, "node-1").isPresent()).isFalse();
    }

    @Test
    void testConcurrentReservationsNeverOvercommit() throws Exception {
        // 16 vCPUs of capacity, 32 workers each asking for 1 vCPU
        int workers = 32;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < workers; i++) {
                String workloadId = "vm-" + i;
                Callable<Boolean> task = () -> {
                    start.await();
                    for (int attempt = 0; attempt < 100; attempt++) {
                        ReservationOutcome outcome = ledger.reserve("node-1", workloadId, Resources.of(1, 256, 10));
                        if (outcome != ReservationOutcome.CONFLICT) {
                            return outcome.isHeld();
                        }
                    }
                    return false;
                };
                results.add(executor.submit(task));
            }
            start.countDown();

            int reserved = 0;
            for (Future<Boolean> result : results) {
                if (result.get(30, TimeUnit.SECONDS)) {
                    reserved++;
                }
            }

            assertThat(reserved).isEqualTo(16);
            assertThat(ledger.workloadCount("node-1")).isEqualTo(16);
            assertThat(ledger.allocatedCapacity("node-1")).isEqualTo(Resources.of(16, 4096, 160));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void testReserveReportsConflictWhenRecordChanged() throws Exception {
        MetadataStore mockStore = mock(MetadataStore.class);
        ResourceLedger mockedLedger = new ResourceLedger(mockStore, CLUSTER, 3,
            new MetricsProvider(new SimpleMeterRegistry(), "test"));
        when(mockStore.getNode(CLUSTER, "node-1")).thenReturn(store.getNode(CLUSTER, "node-1"));
        when(mockStore.getAllocation(CLUSTER, "node-1")).thenReturn(Versioned.absent());
        when(mockStore.compareAndSetAllocation(eq(CLUSTER), any(NodeAllocation.class), anyLong())).thenReturn(false);

        ReservationOutcome outcome = mockedLedger.reserve("node-1", "vm-1", Resources.of(1, 1, 1));

        assertThat(outcome).isEqualTo(ReservationOutcome.CONFLICT);
        verify(mockStore).compareAndSetAllocation(eq(CLUSTER), any(NodeAllocation.class), eq(0L));
    }

    @Test
    void testReleaseGivesUpAfterBoundedConflicts() throws Exception {
        MetadataStore mockStore = mock(MetadataStore.class);
        ResourceLedger mockedLedger = new ResourceLedger(mockStore, CLUSTER, 3,
            new MetricsProvider(new SimpleMeterRegistry(), "test"));
        NodeAllocation allocation = new NodeAllocation("node-1").withReservation("vm-1", Resources.of(1, 1, 1));
        when(mockStore.getAllocation(CLUSTER, "node-1")).thenReturn(new Versioned<>(allocation, 7L));
        when(mockStore.compareAndSetAllocation(eq(CLUSTER), any(NodeAllocation.class), anyLong())).thenReturn(false);

        assertThatThrownBy(() -> mockedLedger.release("node-1", "vm-1"))
            .isInstanceOf(OrchestratorException.class)
            .extracting(e -> ((OrchestratorException) e).getKind())
            .isEqualTo(ErrorKind.RESERVATION_CONFLICT);
        verify(mockStore, times(3)).compareAndSetAllocation(eq(CLUSTER), any(NodeAllocation.class), eq(7L));
    }
}
