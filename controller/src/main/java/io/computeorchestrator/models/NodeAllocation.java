package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

/**
 * Ledger record for one node: the reservation held by each workload placed on it.
 * Stored at {@code /<cluster>/allocations/<node-id>} and updated only through compare-and-commit.
 */
@Data
@NoArgsConstructor
public class NodeAllocation {

    @JsonProperty("node_id")
    private String nodeId;

    @JsonProperty("reservations")
    private Map<String, Resources> reservations = new TreeMap<>();

    public NodeAllocation(String nodeId) {
        this.nodeId = nodeId;
    }

    public void setReservations(Map<String, Resources> reservations) {
        this.reservations = reservations != null ? new TreeMap<>(reservations) : new TreeMap<>();
    }

    @JsonIgnore
    public Resources getAllocated() {
        Resources total = Resources.ZERO;
        for (Resources reservation : reservations.values()) {
            total = total.plus(reservation);
        }
        return total;
    }

    @JsonIgnore
    public int getWorkloadCount() {
        return reservations.size();
    }

    public NodeAllocation withReservation(String workloadId, Resources resources) {
        NodeAllocation copy = copy();
        copy.reservations.put(workloadId, resources);
        return copy;
    }

    public NodeAllocation withoutReservation(String workloadId) {
        NodeAllocation copy = copy();
        copy.reservations.remove(workloadId);
        return copy;
    }

    private NodeAllocation copy() {
        NodeAllocation copy = new NodeAllocation(nodeId);
        copy.setReservations(reservations);
        return copy;
    }
}
