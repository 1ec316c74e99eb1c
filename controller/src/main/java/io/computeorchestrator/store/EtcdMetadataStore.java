package io.computeorchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

import static io.computeorchestrator.config.Constants.PATH_DELIMITER;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * etcd-based implementation of MetadataStore.
 * Singleton to ensure single etcd client connection.
 * Record versions are etcd mod revisions; conditional writes are etcd transactions comparing them.
 */
@Slf4j
public class EtcdMetadataStore implements MetadataStore {

    private static final long ETCD_OPERATION_TIMEOUT_SECONDS = 5;

    private static EtcdMetadataStore instance;

    private final String[] etcdEndpoints;
    private final Client etcdClient;
    private final KV kvClient;
    private final EtcdPathResolver pathResolver;
    private final ObjectMapper objectMapper;

    /**
     * Private constructor for singleton pattern
     */
    private EtcdMetadataStore(String[] etcdEndpoints) {
        this(etcdEndpoints, Client.builder().endpoints(etcdEndpoints).build());
    }

    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient) {
        this(etcdEndpoints, etcdClient, etcdClient.getKVClient());
    }

    /**
     * Test constructor with injected dependencies
     */
    private EtcdMetadataStore(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        this.etcdEndpoints = etcdEndpoints;
        this.etcdClient = etcdClient;
        this.kvClient = kvClient;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.pathResolver = EtcdPathResolver.getInstance();

        log.info("EtcdMetadataStore initialized with endpoints: {}", String.join(",", etcdEndpoints));
    }

    // =================================================================
    // SINGLETON MANAGEMENT
    // =================================================================

    /**
     * Get singleton instance
     */
    public static synchronized EtcdMetadataStore getInstance(String[] etcdEndpoints) {
        if (instance == null) {
            instance = new EtcdMetadataStore(etcdEndpoints);
        }
        return instance;
    }

    /**
     * Get existing instance (throws if not initialized)
     */
    public static EtcdMetadataStore getInstance() {
        if (instance == null) {
            throw new IllegalStateException("EtcdMetadataStore not initialized. Call getInstance(etcdEndpoints) first.");
        }
        return instance;
    }

    /**
     * Reset singleton instance (for testing only)
     */
    public static synchronized void resetInstance() {
        instance = null;
    }

    /**
     * Create test instance with mocked dependencies (for testing only)
     */
    public static synchronized EtcdMetadataStore createTestInstance(String[] etcdEndpoints, Client etcdClient, KV kvClient) {
        resetInstance();
        instance = new EtcdMetadataStore(etcdEndpoints, etcdClient, kvClient);
        return instance;
    }

    // =================================================================
    // COMPUTE NODE OPERATIONS
    // =================================================================

    @Override
    public List<ComputeNode> getAllNodes(String clusterId) throws Exception {
        try {
            List<ComputeNode> nodes = getAllObjectsByPrefix(pathResolver.getNodesPrefix(clusterId), ComputeNode.class);
            log.debug("Retrieved {} compute nodes from etcd", nodes.size());
            return nodes;
        } catch (Exception e) {
            log.error("Failed to get compute nodes from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve compute nodes from etcd", e);
        }
    }

    @Override
    public Optional<ComputeNode> getNode(String clusterId, String nodeId) throws Exception {
        try {
            return getObjectByPath(pathResolver.getNodePath(clusterId, nodeId), ComputeNode.class);
        } catch (Exception e) {
            log.error("Failed to get compute node {} from etcd: {}", nodeId, e.getMessage(), e);
            throw new Exception("Failed to retrieve compute node from etcd", e);
        }
    }

    @Override
    public void upsertNode(String clusterId, ComputeNode node) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getNodePath(clusterId, node.getId()), node);
            log.debug("Stored compute node {} in etcd", node.getId());
        } catch (Exception e) {
            log.error("Failed to store compute node {} in etcd: {}", node.getId(), e.getMessage(), e);
            throw new Exception("Failed to store compute node in etcd", e);
        }
    }

    @Override
    public void deleteNode(String clusterId, String nodeId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getNodePath(clusterId, nodeId));
            log.info("Deleted compute node {} from etcd", nodeId);
        } catch (Exception e) {
            log.error("Failed to delete compute node {} from etcd: {}", nodeId, e.getMessage(), e);
            throw new Exception("Failed to delete compute node from etcd", e);
        }
    }

    // =================================================================
    // WORKLOAD OPERATIONS
    // =================================================================

    @Override
    public List<Workload> getAllWorkloads(String clusterId) throws Exception {
        try {
            return getAllObjectsByPrefix(pathResolver.getWorkloadsPrefix(clusterId), Workload.class);
        } catch (Exception e) {
            log.error("Failed to get workloads from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve workloads from etcd", e);
        }
    }

    @Override
    public Optional<Workload> getWorkload(String clusterId, String workloadId) throws Exception {
        return Optional.ofNullable(getVersionedWorkload(clusterId, workloadId).getValue());
    }

    @Override
    public Versioned<Workload> getVersionedWorkload(String clusterId, String workloadId) throws Exception {
        try {
            return getVersionedObject(pathResolver.getWorkloadPath(clusterId, workloadId), Workload.class);
        } catch (Exception e) {
            log.error("Failed to get workload {} from etcd: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to retrieve workload from etcd", e);
        }
    }

    @Override
    public void upsertWorkload(String clusterId, Workload workload) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getWorkloadPath(clusterId, workload.getId()), workload);
            log.debug("Stored workload {} in etcd", workload.getId());
        } catch (Exception e) {
            log.error("Failed to store workload {} in etcd: {}", workload.getId(), e.getMessage(), e);
            throw new Exception("Failed to store workload in etcd", e);
        }
    }

    @Override
    public boolean compareAndSetWorkload(String clusterId, Workload workload, long expectedVersion) throws Exception {
        String path = pathResolver.getWorkloadPath(clusterId, workload.getId());
        try {
            boolean written = compareAndPut(path, objectMapper.writeValueAsString(workload), expectedVersion);
            if (!written) {
                log.debug("Workload {} changed since revision {}, conditional write rejected", workload.getId(), expectedVersion);
            }
            return written;
        } catch (Exception e) {
            log.error("Failed conditional write of workload {}: {}", workload.getId(), e.getMessage(), e);
            throw new Exception("Failed to update workload in etcd", e);
        }
    }

    @Override
    public void deleteWorkload(String clusterId, String workloadId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getWorkloadPath(clusterId, workloadId));
            log.info("Deleted workload {} from etcd", workloadId);
        } catch (Exception e) {
            log.error("Failed to delete workload {} from etcd: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to delete workload from etcd", e);
        }
    }

    // =================================================================
    // ALLOCATION (LEDGER) OPERATIONS
    // =================================================================

    @Override
    public Versioned<NodeAllocation> getAllocation(String clusterId, String nodeId) throws Exception {
        try {
            return getVersionedObject(pathResolver.getAllocationPath(clusterId, nodeId), NodeAllocation.class);
        } catch (Exception e) {
            log.error("Failed to get allocation of node {} from etcd: {}", nodeId, e.getMessage(), e);
            throw new Exception("Failed to retrieve allocation from etcd", e);
        }
    }

    @Override
    public boolean compareAndSetAllocation(String clusterId, NodeAllocation allocation, long expectedVersion) throws Exception {
        String path = pathResolver.getAllocationPath(clusterId, allocation.getNodeId());
        try {
            return compareAndPut(path, objectMapper.writeValueAsString(allocation), expectedVersion);
        } catch (Exception e) {
            log.error("Failed conditional write of allocation for node {}: {}", allocation.getNodeId(), e.getMessage(), e);
            throw new Exception("Failed to update allocation in etcd", e);
        }
    }

    @Override
    public void deleteAllocation(String clusterId, String nodeId) throws Exception {
        try {
            executeEtcdDelete(pathResolver.getAllocationPath(clusterId, nodeId));
        } catch (Exception e) {
            log.error("Failed to delete allocation of node {} from etcd: {}", nodeId, e.getMessage(), e);
            throw new Exception("Failed to delete allocation from etcd", e);
        }
    }

    // =================================================================
    // MIGRATION JOB OPERATIONS
    // =================================================================

    @Override
    public List<MigrationJob> getAllMigrationJobs(String clusterId) throws Exception {
        try {
            return getAllObjectsByPrefix(pathResolver.getMigrationsPrefix(clusterId), MigrationJob.class);
        } catch (Exception e) {
            log.error("Failed to get migration jobs from etcd: {}", e.getMessage(), e);
            throw new Exception("Failed to retrieve migration jobs from etcd", e);
        }
    }

    @Override
    public Optional<MigrationJob> getMigrationJob(String clusterId, String jobId) throws Exception {
        try {
            return getObjectByPath(pathResolver.getMigrationPath(clusterId, jobId), MigrationJob.class);
        } catch (Exception e) {
            log.error("Failed to get migration job {} from etcd: {}", jobId, e.getMessage(), e);
            throw new Exception("Failed to retrieve migration job from etcd", e);
        }
    }

    @Override
    public void upsertMigrationJob(String clusterId, MigrationJob job) throws Exception {
        try {
            storeObjectAsJson(pathResolver.getMigrationPath(clusterId, job.getJobId()), job);
            log.debug("Stored migration job {} in state {}", job.getJobId(), job.getState());
        } catch (Exception e) {
            log.error("Failed to store migration job {} in etcd: {}", job.getJobId(), e.getMessage(), e);
            throw new Exception("Failed to store migration job in etcd", e);
        }
    }

    @Override
    public boolean createActiveMigrationIfAbsent(String clusterId, String workloadId, String jobId) throws Exception {
        String path = pathResolver.getActiveMigrationPath(clusterId, workloadId);
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);
        try {
            // version 0 == key does not exist
            TxnResponse txnResponse = kvClient.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.version(0)))
                .Then(Op.put(keyBytes, ByteSequence.from(jobId, UTF_8), PutOption.DEFAULT))
                .Else(Op.get(keyBytes, GetOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return txnResponse.isSucceeded();
        } catch (Exception e) {
            log.error("Failed to claim active migration for workload {}: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to create active migration marker in etcd", e);
        }
    }

    @Override
    public Optional<String> getActiveMigration(String clusterId, String workloadId) throws Exception {
        try {
            GetResponse response = executeEtcdGet(pathResolver.getActiveMigrationPath(clusterId, workloadId));
            if (response.getKvs().isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(response.getKvs().get(0).getValue().toString(UTF_8));
        } catch (Exception e) {
            log.error("Failed to get active migration for workload {}: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to read active migration marker from etcd", e);
        }
    }

    @Override
    public void clearActiveMigration(String clusterId, String workloadId, String jobId) throws Exception {
        String path = pathResolver.getActiveMigrationPath(clusterId, workloadId);
        ByteSequence keyBytes = ByteSequence.from(path, UTF_8);
        try {
            TxnResponse txnResponse = kvClient.txn()
                .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.value(ByteSequence.from(jobId, UTF_8))))
                .Then(Op.delete(keyBytes, DeleteOption.DEFAULT))
                .Else(Op.get(keyBytes, GetOption.DEFAULT))
                .commit()
                .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!txnResponse.isSucceeded()) {
                log.warn("Active migration marker of workload {} no longer points at job {}, left untouched", workloadId, jobId);
            }
        } catch (Exception e) {
            log.error("Failed to clear active migration for workload {}: {}", workloadId, e.getMessage(), e);
            throw new Exception("Failed to clear active migration marker in etcd", e);
        }
    }

    @PreDestroy
    public void close() throws Exception {
        log.info("Closing etcd metadata store");

        try {
            if (etcdClient != null) {
                etcdClient.close();
                log.info("etcd client closed successfully");
            }
        } catch (Exception e) {
            log.error("Error closing etcd client: {}", e.getMessage(), e);
            throw new Exception("Failed to close etcd client", e);
        }
    }

    /**
     * Get the path resolver for external use
     */
    public EtcdPathResolver getPathResolver() {
        return pathResolver;
    }

    // =================================================================
    // PRIVATE HELPER METHODS FOR ETCD OPERATIONS
    // =================================================================

    /**
     * Executes etcd prefix query to retrieve all keys matching the given prefix
     */
    private GetResponse executeEtcdPrefixQuery(String prefix) throws Exception {
        // Add trailing slash for etcd prefix queries to ensure precise matching
        String prefixWithSlash = prefix + PATH_DELIMITER;
        ByteSequence prefixBytes = ByteSequence.from(prefixWithSlash, StandardCharsets.UTF_8);
        return kvClient.get(
            prefixBytes,
            GetOption.newBuilder().withPrefix(prefixBytes).build()
        ).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd get operation for a single key
     */
    private GetResponse executeEtcdGet(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        return kvClient.get(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd put operation for a key-value pair
     */
    private void executeEtcdPut(String key, String value) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, StandardCharsets.UTF_8);
        kvClient.put(keyBytes, valueBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Executes etcd delete operation for a key
     */
    private void executeEtcdDelete(String key) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, StandardCharsets.UTF_8);
        kvClient.delete(keyBytes).get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    /**
     * Compare-And-Swap on mod revision. Revision 0 only matches a key that does not exist.
     */
    private boolean compareAndPut(String key, String value, long expectedRevision) throws Exception {
        ByteSequence keyBytes = ByteSequence.from(key, UTF_8);
        ByteSequence valueBytes = ByteSequence.from(value, UTF_8);

        TxnResponse txnResponse = kvClient.txn()
            .If(new Cmp(keyBytes, Cmp.Op.EQUAL, CmpTarget.modRevision(expectedRevision)))
            .Then(Op.put(keyBytes, valueBytes, PutOption.DEFAULT))
            .Else(Op.get(keyBytes, GetOption.DEFAULT))
            .commit()
            .get(ETCD_OPERATION_TIMEOUT_SECONDS, TimeUnit.SECONDS);

        return txnResponse.isSucceeded();
    }

    /**
     * Deserializes list of objects from etcd GetResponse
     */
    private <T> List<T> deserializeObjectList(GetResponse response, Class<T> clazz) throws Exception {
        List<T> items = new ArrayList<>();
        for (var kv : response.getKvs()) {
            String json = kv.getValue().toString(StandardCharsets.UTF_8);
            items.add(objectMapper.readValue(json, clazz));
        }
        return items;
    }

    /**
     * Retrieves all objects of a specific type using etcd prefix query
     */
    private <T> List<T> getAllObjectsByPrefix(String prefix, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdPrefixQuery(prefix);
        return deserializeObjectList(response, clazz);
    }

    /**
     * Retrieves single object by etcd path
     */
    private <T> Optional<T> getObjectByPath(String path, Class<T> clazz) throws Exception {
        return Optional.ofNullable(getVersionedObject(path, clazz).getValue());
    }

    /**
     * Retrieves single object together with its mod revision
     */
    private <T> Versioned<T> getVersionedObject(String path, Class<T> clazz) throws Exception {
        GetResponse response = executeEtcdGet(path);
        if (response.getKvs().isEmpty()) {
            return Versioned.absent();
        }
        KeyValue kv = response.getKvs().get(0);
        T item = objectMapper.readValue(kv.getValue().toString(StandardCharsets.UTF_8), clazz);
        return new Versioned<>(item, kv.getModRevision());
    }

    /**
     * Stores object as JSON at the specified etcd path
     */
    private void storeObjectAsJson(String path, Object object) throws Exception {
        String json = objectMapper.writeValueAsString(object);
        executeEtcdPut(path, json);
    }
}
