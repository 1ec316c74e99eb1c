package io.computeorchestrator.hypervisor;

import io.computeorchestrator.enums.HypervisorState;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.Workload;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory hypervisor used by the "memory" store profile and by tests.
 *
 * Keeps a VM table per node and supports injecting failures and delays per operation,
 * optionally scoped to one node, to exercise migration rollback and stage timeouts.
 */
@Slf4j
public class SimulatedHypervisorDriver implements HypervisorDriver {

    public enum Operation {
        CREATE, START, STOP, DELETE, QUERY, COPY_DISK, STREAM_STATE, SWITCHOVER, COMPATIBILITY, HOST_INFO
    }

    private static final String ANY_NODE = "*";

    // nodeId -> workloadId -> state
    private final Map<String, Map<String, HypervisorState>> vms = new HashMap<>();
    // nodeId -> workload ids with a disk image present
    private final Map<String, Set<String>> disks = new HashMap<>();
    private final Map<Operation, Set<String>> failures = new ConcurrentHashMap<>();
    private final Map<Operation, Long> delaysMillis = new ConcurrentHashMap<>();
    private final Set<String> unreachableNodes = ConcurrentHashMap.newKeySet();
    private final Map<String, HostInfo> hostInfoOverrides = new ConcurrentHashMap<>();
    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    // =================================================================
    // TEST / DEVELOPMENT CONTROLS
    // =================================================================

    /**
     * Make {@code operation} fail on {@code nodeId} (null for every node) until cleared.
     */
    public void injectFailure(Operation operation, String nodeId) {
        failures.computeIfAbsent(operation, op -> ConcurrentHashMap.newKeySet())
            .add(nodeId != null ? nodeId : ANY_NODE);
    }

    /**
     * Delay every call of {@code operation} by the given number of milliseconds.
     */
    public void injectDelay(Operation operation, long millis) {
        delaysMillis.put(operation, millis);
    }

    public void setUnreachable(String nodeId, boolean unreachable) {
        if (unreachable) {
            unreachableNodes.add(nodeId);
        } else {
            unreachableNodes.remove(nodeId);
        }
    }

    public void setHostInfo(String nodeId, HostInfo hostInfo) {
        hostInfoOverrides.put(nodeId, hostInfo);
    }

    public void clearFailures() {
        failures.clear();
        delaysMillis.clear();
        unreachableNodes.clear();
    }

    /**
     * Define a VM on a node directly, with a disk image, as if it had been provisioned earlier.
     */
    public synchronized void defineVm(String nodeId, String workloadId, HypervisorState state) {
        vms.computeIfAbsent(nodeId, n -> new HashMap<>()).put(workloadId, state);
        disks.computeIfAbsent(nodeId, n -> new HashSet<>()).add(workloadId);
    }

    public synchronized HypervisorState stateOf(String nodeId, String workloadId) {
        return vms.getOrDefault(nodeId, Collections.emptyMap()).getOrDefault(workloadId, HypervisorState.NOT_FOUND);
    }

    public synchronized boolean hasDisk(String nodeId, String workloadId) {
        return disks.getOrDefault(nodeId, Collections.emptySet()).contains(workloadId);
    }

    /**
     * Calls made so far, formatted as {@code OPERATION node[->target] workload}.
     */
    public List<String> getCalls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    // =================================================================
    // HYPERVISOR DRIVER
    // =================================================================

    @Override
    public void createWorkload(ComputeNode node, Workload workload) throws HypervisorException {
        before(Operation.CREATE, node.getId(), workload.getId());
        synchronized (this) {
            if (!hasDisk(node.getId(), workload.getId())) {
                throw new HypervisorException(node.getId(), "No disk image for " + workload.getId() + " on " + node.getId());
            }
            vms.computeIfAbsent(node.getId(), n -> new HashMap<>()).putIfAbsent(workload.getId(), HypervisorState.STOPPED);
        }
    }

    @Override
    public void start(ComputeNode node, String workloadId) throws HypervisorException {
        before(Operation.START, node.getId(), workloadId);
        synchronized (this) {
            requireDefined(node.getId(), workloadId);
            vms.get(node.getId()).put(workloadId, HypervisorState.RUNNING);
        }
    }

    @Override
    public void stop(ComputeNode node, String workloadId) throws HypervisorException {
        before(Operation.STOP, node.getId(), workloadId);
        synchronized (this) {
            requireDefined(node.getId(), workloadId);
            vms.get(node.getId()).put(workloadId, HypervisorState.STOPPED);
        }
    }

    @Override
    public void delete(ComputeNode node, String workloadId) throws HypervisorException {
        before(Operation.DELETE, node.getId(), workloadId);
        synchronized (this) {
            vms.getOrDefault(node.getId(), new HashMap<>()).remove(workloadId);
            disks.getOrDefault(node.getId(), new HashSet<>()).remove(workloadId);
        }
    }

    @Override
    public HypervisorState queryState(ComputeNode node, String workloadId) throws HypervisorException {
        before(Operation.QUERY, node.getId(), workloadId);
        return stateOf(node.getId(), workloadId);
    }

    @Override
    public void copyDisk(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException {
        before(Operation.COPY_DISK, source.getId(), target.getId(), workloadId);
        synchronized (this) {
            if (!hasDisk(source.getId(), workloadId)) {
                throw new HypervisorException(source.getId(), "No disk image for " + workloadId + " on " + source.getId());
            }
            if (stateOf(source.getId(), workloadId) == HypervisorState.RUNNING) {
                throw new HypervisorException(source.getId(), "Refusing to copy disk of running VM " + workloadId);
            }
            disks.computeIfAbsent(target.getId(), n -> new HashSet<>()).add(workloadId);
        }
    }

    @Override
    public void streamMemoryState(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException {
        before(Operation.STREAM_STATE, source.getId(), target.getId(), workloadId);
        synchronized (this) {
            if (stateOf(source.getId(), workloadId) != HypervisorState.RUNNING) {
                throw new HypervisorException(source.getId(), "VM " + workloadId + " is not running on " + source.getId());
            }
            // incoming copy waits paused on the target until switchover
            vms.computeIfAbsent(target.getId(), n -> new HashMap<>()).put(workloadId, HypervisorState.PAUSED);
            disks.computeIfAbsent(target.getId(), n -> new HashSet<>()).add(workloadId);
        }
    }

    @Override
    public void switchover(ComputeNode source, ComputeNode target, String workloadId) throws HypervisorException {
        before(Operation.SWITCHOVER, source.getId(), target.getId(), workloadId);
        synchronized (this) {
            requireDefined(source.getId(), workloadId);
            requireDefined(target.getId(), workloadId);
            vms.get(source.getId()).put(workloadId, HypervisorState.STOPPED);
            vms.get(target.getId()).put(workloadId, HypervisorState.RUNNING);
        }
    }

    @Override
    public List<String> checkCompatibility(ComputeNode source, ComputeNode target) throws HypervisorException {
        before(Operation.COMPATIBILITY, source.getId(), target.getId(), null);
        List<String> reasons = new ArrayList<>();
        HostInfo sourceInfo = describe(source);
        HostInfo targetInfo = describe(target);
        if (sourceInfo.getCpuModel() != null && targetInfo.getCpuModel() != null
                && !Objects.equals(sourceInfo.getCpuModel(), targetInfo.getCpuModel())) {
            reasons.add("CPU model mismatch: " + sourceInfo.getCpuModel() + " vs " + targetInfo.getCpuModel());
        }
        if (sourceInfo.getHypervisorVersion() != null && targetInfo.getHypervisorVersion() != null
                && !Objects.equals(sourceInfo.getHypervisorVersion(), targetInfo.getHypervisorVersion())) {
            reasons.add("Hypervisor version mismatch: " + sourceInfo.getHypervisorVersion()
                + " vs " + targetInfo.getHypervisorVersion());
        }
        return reasons;
    }

    @Override
    public HostInfo hostInfo(ComputeNode node) throws HypervisorException {
        before(Operation.HOST_INFO, node.getId(), null);
        return describe(node);
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private HostInfo describe(ComputeNode node) {
        HostInfo override = hostInfoOverrides.get(node.getId());
        if (override != null) {
            return override;
        }
        return HostInfo.builder()
            .cpus(node.getTotalVcpus())
            .memoryMb(node.getTotalMemoryMb())
            .cpuModel(node.getCpuModel())
            .hypervisorVersion(node.getHypervisorVersion())
            .build();
    }

    private void requireDefined(String nodeId, String workloadId) throws HypervisorException {
        if (stateOf(nodeId, workloadId) == HypervisorState.NOT_FOUND) {
            throw new HypervisorException(nodeId, "Domain " + workloadId + " not found on " + nodeId);
        }
    }

    private void before(Operation operation, String nodeId, String workloadId) throws HypervisorException {
        before(operation, nodeId, null, workloadId);
    }

    private void before(Operation operation, String nodeId, String targetNodeId, String workloadId)
            throws HypervisorException {
        calls.add(operation + " " + nodeId + (targetNodeId != null ? "->" + targetNodeId : "")
            + (workloadId != null ? " " + workloadId : ""));

        Long delay = delaysMillis.get(operation);
        if (delay != null && delay > 0) {
            try {
                Thread.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new HypervisorException(nodeId, operation + " interrupted", e);
            }
        }

        if (unreachableNodes.contains(nodeId) || (targetNodeId != null && unreachableNodes.contains(targetNodeId))) {
            throw new HypervisorException(nodeId, "Cannot connect to hypervisor for " + operation);
        }

        Set<String> failing = failures.getOrDefault(operation, Collections.emptySet());
        if (failing.contains(ANY_NODE) || failing.contains(nodeId)
                || (targetNodeId != null && failing.contains(targetNodeId))) {
            log.debug("Injected failure for {} on {}", operation, nodeId);
            throw new HypervisorException(nodeId, "Injected failure for " + operation);
        }
    }
}
