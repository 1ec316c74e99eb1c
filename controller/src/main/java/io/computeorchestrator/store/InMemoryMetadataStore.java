package io.computeorchestrator.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.NodeAllocation;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static io.computeorchestrator.config.Constants.PATH_DELIMITER;

/**
 * Single-process MetadataStore used for development and tests.
 *
 * Mirrors the etcd layout: values are kept as JSON under the same keys, and every write bumps a
 * store-wide revision that becomes the record's version. Each operation holds the store monitor
 * only for the duration of the map access.
 */
@Slf4j
public class InMemoryMetadataStore implements MetadataStore {

    private final Map<String, Entry> entries = new TreeMap<>();
    private final EtcdPathResolver pathResolver = EtcdPathResolver.getInstance();
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    private long revision = 0;

    private static final class Entry {
        private final String value;
        private final long modRevision;

        private Entry(String value, long modRevision) {
            this.value = value;
            this.modRevision = modRevision;
        }
    }

    // =================================================================
    // COMPUTE NODE OPERATIONS
    // =================================================================

    @Override
    public List<ComputeNode> getAllNodes(String clusterId) throws Exception {
        return getAllByPrefix(pathResolver.getNodesPrefix(clusterId), ComputeNode.class);
    }

    @Override
    public Optional<ComputeNode> getNode(String clusterId, String nodeId) throws Exception {
        return Optional.ofNullable(getVersioned(pathResolver.getNodePath(clusterId, nodeId), ComputeNode.class).getValue());
    }

    @Override
    public void upsertNode(String clusterId, ComputeNode node) throws Exception {
        put(pathResolver.getNodePath(clusterId, node.getId()), node);
    }

    @Override
    public void deleteNode(String clusterId, String nodeId) {
        delete(pathResolver.getNodePath(clusterId, nodeId));
    }

    // =================================================================
    // WORKLOAD OPERATIONS
    // =================================================================

    @Override
    public List<Workload> getAllWorkloads(String clusterId) throws Exception {
        return getAllByPrefix(pathResolver.getWorkloadsPrefix(clusterId), Workload.class);
    }

    @Override
    public Optional<Workload> getWorkload(String clusterId, String workloadId) throws Exception {
        return Optional.ofNullable(getVersionedWorkload(clusterId, workloadId).getValue());
    }

    @Override
    public Versioned<Workload> getVersionedWorkload(String clusterId, String workloadId) throws Exception {
        return getVersioned(pathResolver.getWorkloadPath(clusterId, workloadId), Workload.class);
    }

    @Override
    public void upsertWorkload(String clusterId, Workload workload) throws Exception {
        put(pathResolver.getWorkloadPath(clusterId, workload.getId()), workload);
    }

    @Override
    public boolean compareAndSetWorkload(String clusterId, Workload workload, long expectedVersion) throws Exception {
        return compareAndPut(pathResolver.getWorkloadPath(clusterId, workload.getId()),
            objectMapper.writeValueAsString(workload), expectedVersion);
    }

    @Override
    public void deleteWorkload(String clusterId, String workloadId) {
        delete(pathResolver.getWorkloadPath(clusterId, workloadId));
    }

    // =================================================================
    // ALLOCATION (LEDGER) OPERATIONS
    // =================================================================

    @Override
    public Versioned<NodeAllocation> getAllocation(String clusterId, String nodeId) throws Exception {
        return getVersioned(pathResolver.getAllocationPath(clusterId, nodeId), NodeAllocation.class);
    }

    @Override
    public boolean compareAndSetAllocation(String clusterId, NodeAllocation allocation, long expectedVersion) throws Exception {
        return compareAndPut(pathResolver.getAllocationPath(clusterId, allocation.getNodeId()),
            objectMapper.writeValueAsString(allocation), expectedVersion);
    }

    @Override
    public void deleteAllocation(String clusterId, String nodeId) {
        delete(pathResolver.getAllocationPath(clusterId, nodeId));
    }

    // =================================================================
    // MIGRATION JOB OPERATIONS
    // =================================================================

    @Override
    public List<MigrationJob> getAllMigrationJobs(String clusterId) throws Exception {
        return getAllByPrefix(pathResolver.getMigrationsPrefix(clusterId), MigrationJob.class);
    }

    @Override
    public Optional<MigrationJob> getMigrationJob(String clusterId, String jobId) throws Exception {
        return Optional.ofNullable(getVersioned(pathResolver.getMigrationPath(clusterId, jobId), MigrationJob.class).getValue());
    }

    @Override
    public void upsertMigrationJob(String clusterId, MigrationJob job) throws Exception {
        put(pathResolver.getMigrationPath(clusterId, job.getJobId()), job);
    }

    @Override
    public synchronized boolean createActiveMigrationIfAbsent(String clusterId, String workloadId, String jobId) {
        String key = pathResolver.getActiveMigrationPath(clusterId, workloadId);
        if (entries.containsKey(key)) {
            return false;
        }
        entries.put(key, new Entry(jobId, ++revision));
        return true;
    }

    @Override
    public synchronized Optional<String> getActiveMigration(String clusterId, String workloadId) {
        Entry entry = entries.get(pathResolver.getActiveMigrationPath(clusterId, workloadId));
        return entry != null ? Optional.of(entry.value) : Optional.empty();
    }

    @Override
    public synchronized void clearActiveMigration(String clusterId, String workloadId, String jobId) {
        String key = pathResolver.getActiveMigrationPath(clusterId, workloadId);
        Entry entry = entries.get(key);
        if (entry != null && entry.value.equals(jobId)) {
            entries.remove(key);
        } else if (entry != null) {
            log.warn("Active migration marker of workload {} no longer points at job {}, left untouched", workloadId, jobId);
        }
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private <T> List<T> getAllByPrefix(String prefix, Class<T> clazz) throws Exception {
        String prefixWithSlash = prefix + PATH_DELIMITER;
        List<String> values = new ArrayList<>();
        synchronized (this) {
            for (Map.Entry<String, Entry> e : entries.entrySet()) {
                if (e.getKey().startsWith(prefixWithSlash)) {
                    values.add(e.getValue().value);
                }
            }
        }
        List<T> items = new ArrayList<>();
        for (String json : values) {
            items.add(objectMapper.readValue(json, clazz));
        }
        return items;
    }

    private <T> Versioned<T> getVersioned(String key, Class<T> clazz) throws Exception {
        Entry entry;
        synchronized (this) {
            entry = entries.get(key);
        }
        if (entry == null) {
            return Versioned.absent();
        }
        return new Versioned<>(objectMapper.readValue(entry.value, clazz), entry.modRevision);
    }

    private void put(String key, Object value) throws Exception {
        String json = objectMapper.writeValueAsString(value);
        synchronized (this) {
            entries.put(key, new Entry(json, ++revision));
        }
    }

    private synchronized boolean compareAndPut(String key, String json, long expectedVersion) {
        Entry current = entries.get(key);
        long currentVersion = current != null ? current.modRevision : 0L;
        if (currentVersion != expectedVersion) {
            return false;
        }
        entries.put(key, new Entry(json, ++revision));
        return true;
    }

    private synchronized void delete(String key) {
        entries.remove(key);
    }
}
