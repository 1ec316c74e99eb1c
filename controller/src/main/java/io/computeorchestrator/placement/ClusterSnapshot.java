package io.computeorchestrator.placement;

import io.computeorchestrator.models.Resources;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable view of the pool used for one placement decision.
 *
 * Snapshots can be derived with hypothetical placements applied, so a sequence of decisions
 * (an evacuation dry run, a rebalance plan) never counts the same free capacity twice.
 */
public class ClusterSnapshot {

    // sorted by node id
    private final Map<String, CandidateNode> nodes;
    // workload id -> owning node id
    private final Map<String, String> owners;

    public ClusterSnapshot(Map<String, CandidateNode> nodes, Map<String, String> owners) {
        this.nodes = Collections.unmodifiableMap(new TreeMap<>(nodes));
        this.owners = Collections.unmodifiableMap(new HashMap<>(owners));
    }

    public List<CandidateNode> getNodes() {
        return new ArrayList<>(nodes.values());
    }

    public Optional<CandidateNode> getNode(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public Optional<String> ownerOf(String workloadId) {
        return Optional.ofNullable(owners.get(workloadId));
    }

    /**
     * Snapshot in which {@code workloadId} has been placed on {@code nodeId}.
     */
    public ClusterSnapshot withPlacement(String workloadId, String nodeId, Resources resources) {
        Map<String, CandidateNode> nextNodes = new TreeMap<>(nodes);
        Map<String, String> nextOwners = new HashMap<>(owners);
        CandidateNode node = nextNodes.get(nodeId);
        if (node != null) {
            nextNodes.put(nodeId, node.withReservation(resources));
        }
        nextOwners.put(workloadId, nodeId);
        return new ClusterSnapshot(nextNodes, nextOwners);
    }

    /**
     * Snapshot in which {@code workloadId} has moved from {@code fromNodeId} to {@code toNodeId}.
     */
    public ClusterSnapshot withMove(String workloadId, String fromNodeId, String toNodeId, Resources resources) {
        Map<String, CandidateNode> nextNodes = new TreeMap<>(nodes);
        CandidateNode from = nextNodes.get(fromNodeId);
        if (from != null) {
            nextNodes.put(fromNodeId, from.withoutReservation(resources));
        }
        return new ClusterSnapshot(nextNodes, owners).withPlacement(workloadId, toNodeId, resources);
    }
}
