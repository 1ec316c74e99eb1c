package io.computeorchestrator.models;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashSet;
import java.util.Set;

/**
 * Affinity / anti-affinity rules attached to a placement request.
 *
 * preferredNodes is a soft whitelist, excludedNodes a hard blacklist. coLocateWith and
 * separateFrom name another workload whose current owner must (or must not) host this one.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AffinityConstraints {

    @Builder.Default
    @JsonProperty("preferred_nodes")
    private Set<String> preferredNodes = new HashSet<>();

    @Builder.Default
    @JsonProperty("excluded_nodes")
    private Set<String> excludedNodes = new HashSet<>();

    @JsonProperty("co_locate_with")
    private String coLocateWith;

    @JsonProperty("separate_from")
    private String separateFrom;

    public static AffinityConstraints none() {
        return new AffinityConstraints();
    }

    public void setPreferredNodes(Set<String> preferredNodes) {
        this.preferredNodes = preferredNodes != null ? preferredNodes : new HashSet<>();
    }

    public void setExcludedNodes(Set<String> excludedNodes) {
        this.excludedNodes = excludedNodes != null ? excludedNodes : new HashSet<>();
    }

    /**
     * Copy of these constraints with one more excluded node.
     */
    public AffinityConstraints excluding(String nodeId) {
        Set<String> excluded = new HashSet<>(excludedNodes);
        excluded.add(nodeId);
        return toBuilder()
            .preferredNodes(new HashSet<>(preferredNodes))
            .excludedNodes(excluded)
            .build();
    }
}
