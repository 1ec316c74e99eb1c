package io.computeorchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Txn;
import io.etcd.jetcd.kv.DeleteResponse;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.PutResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.options.GetOption;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.lang.reflect.Field;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for EtcdMetadataStore.
 */
public class EtcdMetadataStoreTest {

    private static final String CLUSTER = "test-pool";
    private static final String[] ENDPOINTS = new String[]{"http://localhost:2379"};

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private MockedStatic<Client> clientStaticMock;
    private Client mockEtcdClient;
    private KV mockKv;

    @BeforeEach
    public void setUp() throws Exception {
        // Static mock for Client.builder()
        clientStaticMock = Mockito.mockStatic(Client.class);

        ClientBuilder mockBuilder = mock(ClientBuilder.class);
        clientStaticMock.when(Client::builder).thenReturn(mockBuilder);
        when(mockBuilder.endpoints(any(String[].class))).thenReturn(mockBuilder);

        mockEtcdClient = mock(Client.class);
        mockKv = mock(KV.class);
        when(mockEtcdClient.getKVClient()).thenReturn(mockKv);
        when(mockBuilder.build()).thenReturn(mockEtcdClient);

        resetSingleton();
    }

    @AfterEach
    public void tearDown() throws Exception {
        if (clientStaticMock != null) clientStaticMock.close();
        resetSingleton();
    }

    // ------------------------- helpers -------------------------

    private void resetSingleton() throws Exception {
        Field f = EtcdMetadataStore.class.getDeclaredField("instance");
        f.setAccessible(true);
        f.set(null, null);
    }

    private EtcdMetadataStore newStore() {
        return EtcdMetadataStore.createTestInstance(ENDPOINTS, mockEtcdClient, mockKv);
    }

    private GetResponse mockGetResponse(List<KeyValue> kvs) {
        GetResponse resp = mock(GetResponse.class);
        when(resp.getKvs()).thenReturn(kvs);
        return resp;
    }

    private KeyValue mockKeyValue(String valueUtf8, long modRevision) {
        KeyValue kv = mock(KeyValue.class);
        when(kv.getValue()).thenReturn(ByteSequence.from(valueUtf8, UTF_8));
        when(kv.getModRevision()).thenReturn(modRevision);
        return kv;
    }

    private Txn mockTxn(boolean succeeded) {
        Txn txn = mock(Txn.class);
        TxnResponse txnResponse = mock(TxnResponse.class);
        when(txnResponse.isSucceeded()).thenReturn(succeeded);
        when(txn.If(any())).thenReturn(txn);
        when(txn.Then(any())).thenReturn(txn);
        when(txn.Else(any())).thenReturn(txn);
        when(txn.commit()).thenReturn(CompletableFuture.completedFuture(txnResponse));
        when(mockKv.txn()).thenReturn(txn);
        return txn;
    }

    private String key(ByteSequence bytes) {
        return bytes.toString(UTF_8);
    }

    // ------------------------- singleton tests -------------------------

    @Test
    public void testSingletonGetInstance() {
        EtcdMetadataStore store = newStore();

        assertThat(store).isNotNull();
        assertThat(EtcdMetadataStore.getInstance()).isSameAs(store);
    }

    @Test
    public void testGetInstanceNoArgsThrowsWhenUninitialized() {
        assertThatThrownBy(EtcdMetadataStore::getInstance)
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    public void testGetInstanceWithEndpointsBuildsClient() {
        EtcdMetadataStore store = EtcdMetadataStore.getInstance(ENDPOINTS);

        assertThat(store).isSameAs(EtcdMetadataStore.getInstance(ENDPOINTS));
        verify(mockEtcdClient).getKVClient();
    }

    // ------------------------- nodes -------------------------

    @Test
    public void testGetAllNodesUsesPrefixQuery() throws Exception {
        EtcdMetadataStore store = newStore();
        ComputeNode node = ComputeNode.builder().id("node-1").hostname("node-1.local").totalVcpus(8).build();
        GetResponse response = mockGetResponse(List.of(mockKeyValue(objectMapper.writeValueAsString(node), 3L)));
        when(mockKv.get(any(ByteSequence.class), any(GetOption.class)))
            .thenReturn(CompletableFuture.completedFuture(response));

        List<ComputeNode> nodes = store.getAllNodes(CLUSTER);

        assertThat(nodes).extracting(ComputeNode::getId).containsExactly("node-1");
        ArgumentCaptor<ByteSequence> keyCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).get(keyCaptor.capture(), any(GetOption.class));
        assertThat(key(keyCaptor.getValue())).isEqualTo("/test-pool/nodes/");
    }

    @Test
    public void testGetNodeNotFound() throws Exception {
        EtcdMetadataStore store = newStore();
        GetResponse response = mockGetResponse(Collections.emptyList());
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        Optional<ComputeNode> node = store.getNode(CLUSTER, "missing");

        assertThat(node).isEmpty();
    }

    @Test
    public void testUpsertNodeWritesJson() throws Exception {
        EtcdMetadataStore store = newStore();
        when(mockKv.put(any(ByteSequence.class), any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(PutResponse.class)));

        store.upsertNode(CLUSTER, ComputeNode.builder().id("node-1").totalVcpus(8).build());

        ArgumentCaptor<ByteSequence> keyCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        ArgumentCaptor<ByteSequence> valueCaptor = ArgumentCaptor.forClass(ByteSequence.class);
        verify(mockKv).put(keyCaptor.capture(), valueCaptor.capture());
        assertThat(key(keyCaptor.getValue())).isEqualTo("/test-pool/nodes/node-1");
        assertThat(key(valueCaptor.getValue())).contains("\"total_vcpus\":8");
    }

    @Test
    public void testDeleteNode() throws Exception {
        EtcdMetadataStore store = newStore();
        when(mockKv.delete(any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(DeleteResponse.class)));

        store.deleteNode(CLUSTER, "node-1");

        verify(mockKv).delete(ByteSequence.from("/test-pool/nodes/node-1", UTF_8));
    }

    @Test
    public void testDeleteWorkload() throws Exception {
        EtcdMetadataStore store = newStore();
        when(mockKv.delete(any(ByteSequence.class)))
            .thenReturn(CompletableFuture.completedFuture(mock(DeleteResponse.class)));

        store.deleteWorkload(CLUSTER, "vm-1");

        verify(mockKv).delete(ByteSequence.from("/test-pool/workloads/vm-1", UTF_8));
    }

    @Test
    public void testEtcdFailureIsWrapped() {
        EtcdMetadataStore store = newStore();
        when(mockKv.get(any(ByteSequence.class)))
            .thenReturn(CompletableFuture.failedFuture(new RuntimeException("connection refused")));

        assertThatThrownBy(() -> store.getNode(CLUSTER, "node-1"))
            .hasMessage("Failed to retrieve compute node from etcd")
            .hasRootCauseMessage("connection refused");
    }

    // ------------------------- versioned records -------------------------

    @Test
    public void testVersionedWorkloadCarriesModRevision() throws Exception {
        EtcdMetadataStore store = newStore();
        Workload workload = Workload.builder().id("vm-1").nodeId("node-1").state(WorkloadState.RUNNING).build();
        GetResponse response = mockGetResponse(List.of(mockKeyValue(objectMapper.writeValueAsString(workload), 42L)));
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        Versioned<Workload> versioned = store.getVersionedWorkload(CLUSTER, "vm-1");

        assertThat(versioned.getVersion()).isEqualTo(42L);
        assertThat(versioned.getValue().getNodeId()).isEqualTo("node-1");
        assertThat(versioned.getValue().getState()).isEqualTo(WorkloadState.RUNNING);
    }

    @Test
    public void testMissingAllocationIsAbsent() throws Exception {
        EtcdMetadataStore store = newStore();
        GetResponse response = mockGetResponse(Collections.emptyList());
        when(mockKv.get(any(ByteSequence.class))).thenReturn(CompletableFuture.completedFuture(response));

        Versioned<NodeAllocation> allocation = store.getAllocation(CLUSTER, "node-1");

        assertThat(allocation.isPresent()).isFalse();
        assertThat(allocation.getVersion()).isZero();
    }

    @Test
    public void testCompareAndSetAllocationSucceeded() throws Exception {
        EtcdMetadataStore store = newStore();
        Txn txn = mockTxn(true);
        NodeAllocation allocation = new NodeAllocation("node-1").withReservation("vm-1", Resources.of(1, 1024, 10));

        boolean written = store.compareAndSetAllocation(CLUSTER, allocation, 7L);

        assertThat(written).isTrue();
        verify(mockKv).txn();
        verify(txn).If(any());
        verify(txn).Then(any());
        verify(txn).Else(any());
        verify(txn).commit();
    }

    @Test
    public void testCompareAndSetWorkloadRejected() throws Exception {
        EtcdMetadataStore store = newStore();
        mockTxn(false);

        boolean written = store.compareAndSetWorkload(CLUSTER, Workload.builder().id("vm-1").build(), 7L);

        assertThat(written).isFalse();
    }

    // ------------------------- active migration markers -------------------------

    @Test
    public void testCreateActiveMigrationIfAbsent() throws Exception {
        EtcdMetadataStore store = newStore();
        mockTxn(true);

        assertThat(store.createActiveMigrationIfAbsent(CLUSTER, "vm-1", "job-1")).isTrue();
    }

    @Test
    public void testCreateActiveMigrationWhenAlreadyClaimed() throws Exception {
        EtcdMetadataStore store = newStore();
        mockTxn(false);

        assertThat(store.createActiveMigrationIfAbsent(CLUSTER, "vm-1", "job-2")).isFalse();
    }

    @Test
    public void testGetActiveMigration() throws Exception {
        EtcdMetadataStore store = newStore();
        GetResponse response = mockGetResponse(List.of(mockKeyValue("job-1", 5L)));
        when(mockKv.get(ByteSequence.from("/test-pool/active-migrations/vm-1", UTF_8)))
            .thenReturn(CompletableFuture.completedFuture(response));

        assertThat(store.getActiveMigration(CLUSTER, "vm-1")).contains("job-1");
    }

    @Test
    public void testClearActiveMigrationWithStaleJobDoesNotThrow() throws Exception {
        EtcdMetadataStore store = newStore();
        Txn txn = mockTxn(false);

        assertThatCode(() -> store.clearActiveMigration(CLUSTER, "vm-1", "job-old")).doesNotThrowAnyException();
        verify(txn).commit();
    }

    @Test
    public void testCloseClosesClient() throws Exception {
        EtcdMetadataStore store = newStore();

        store.close();

        verify(mockEtcdClient).close();
    }
}
