package io.computeorchestrator.store;

import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryMetadataStoreTest {

    private static final String CLUSTER = "test-pool";

    private InMemoryMetadataStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryMetadataStore();
    }

    @Test
    void testNodesAreScopedToTheirCluster() throws Exception {
        store.upsertNode(CLUSTER, ComputeNode.builder().id("node-1").totalVcpus(4).build());
        store.upsertNode("other-pool", ComputeNode.builder().id("node-2").totalVcpus(4).build());

        assertThat(store.getAllNodes(CLUSTER)).extracting(ComputeNode::getId).containsExactly("node-1");
        assertThat(store.getNode(CLUSTER, "node-2")).isEmpty();

        store.deleteNode(CLUSTER, "node-1");

        assertThat(store.getAllNodes(CLUSTER)).isEmpty();
    }

    @Test
    void testStoredValuesAreCopies() throws Exception {
        Workload workload = Workload.builder().id("vm-1").state(WorkloadState.RUNNING).build();
        store.upsertWorkload(CLUSTER, workload);

        workload.setState(WorkloadState.STOPPED);

        assertThat(store.getWorkload(CLUSTER, "vm-1").get().getState()).isEqualTo(WorkloadState.RUNNING);
    }

    @Test
    void testCompareAndSetWorkloadChecksVersion() throws Exception {
        Workload workload = Workload.builder().id("vm-1").state(WorkloadState.PROVISIONING).build();
        assertThat(store.getVersionedWorkload(CLUSTER, "vm-1").getVersion()).isZero();
        assertThat(store.compareAndSetWorkload(CLUSTER, workload, 0L)).isTrue();

        Versioned<Workload> current = store.getVersionedWorkload(CLUSTER, "vm-1");
        workload.setState(WorkloadState.RUNNING);

        assertThat(store.compareAndSetWorkload(CLUSTER, workload, current.getVersion())).isTrue();
        assertThat(store.compareAndSetWorkload(CLUSTER, workload, current.getVersion())).isFalse();
        assertThat(store.compareAndSetWorkload(CLUSTER, workload, 0L)).isFalse();
        assertThat(store.getVersionedWorkload(CLUSTER, "vm-1").getVersion()).isGreaterThan(current.getVersion());
    }

    @Test
    void testDeletedWorkloadCanBeCreatedAgain() throws Exception {
        Workload claim = Workload.builder().id("vm-1").state(WorkloadState.PROVISIONING).build();
        assertThat(store.compareAndSetWorkload(CLUSTER, claim, 0L)).isTrue();

        store.deleteWorkload(CLUSTER, "vm-1");

        assertThat(store.getVersionedWorkload(CLUSTER, "vm-1").isPresent()).isFalse();
        assertThat(store.compareAndSetWorkload(CLUSTER, claim, 0L)).isTrue();
    }

    @Test
    void testAllocationRoundTripsReservations() throws Exception {
        NodeAllocation allocation = new NodeAllocation("node-1")
            .withReservation("vm-1", Resources.of(2, 2048, 20))
            .withReservation("vm-2", Resources.of(1, 1024, 10));

        assertThat(store.compareAndSetAllocation(CLUSTER, allocation, 0L)).isTrue();

        Versioned<NodeAllocation> stored = store.getAllocation(CLUSTER, "node-1");
        assertThat(stored.isPresent()).isTrue();
        assertThat(stored.getValue().getAllocated()).isEqualTo(Resources.of(3, 3072, 30));
        assertThat(stored.getValue().getReservations()).containsOnlyKeys("vm-1", "vm-2");

        store.deleteAllocation(CLUSTER, "node-1");

        assertThat(store.getAllocation(CLUSTER, "node-1").isPresent()).isFalse();
    }

    @Test
    void testActiveMigrationMarker() throws Exception {
        assertThat(store.createActiveMigrationIfAbsent(CLUSTER, "vm-1", "job-1")).isTrue();
        assertThat(store.createActiveMigrationIfAbsent(CLUSTER, "vm-1", "job-2")).isFalse();
        assertThat(store.getActiveMigration(CLUSTER, "vm-1")).contains("job-1");

        // Clearing with a stale job id leaves the marker
        store.clearActiveMigration(CLUSTER, "vm-1", "job-2");
        assertThat(store.getActiveMigration(CLUSTER, "vm-1")).contains("job-1");

        store.clearActiveMigration(CLUSTER, "vm-1", "job-1");
        assertThat(store.getActiveMigration(CLUSTER, "vm-1")).isEmpty();
    }

    @Test
    void testMigrationJobs() throws Exception {
        MigrationJob job = MigrationJob.builder().jobId("job-1").workloadId("vm-1").build();
        store.upsertMigrationJob(CLUSTER, job);

        assertThat(store.getMigrationJob(CLUSTER, "job-1")).isPresent();
        assertThat(store.getAllMigrationJobs(CLUSTER)).extracting(MigrationJob::getJobId).containsExactly("job-1");
        // Markers live under a different prefix and are not listed as jobs
        store.createActiveMigrationIfAbsent(CLUSTER, "vm-1", "job-1");
        assertThat(store.getAllMigrationJobs(CLUSTER)).hasSize(1);
    }
}
