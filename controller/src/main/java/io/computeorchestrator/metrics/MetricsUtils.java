package io.computeorchestrator.metrics;

import io.micrometer.core.instrument.Tags;

import static io.computeorchestrator.metrics.MetricsConstants.CLUSTER_ID_TAG;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_ID_TAG;
import static io.computeorchestrator.metrics.MetricsConstants.OUTCOME_TAG;

/**
 * Tag sets shared by the orchestrator's meters.
 */
public class MetricsUtils {

    private MetricsUtils() {}

    public static Tags clusterTags(String clusterId) {
        return Tags.of(CLUSTER_ID_TAG, clusterId);
    }

    public static Tags nodeTags(String clusterId, String nodeId) {
        return clusterTags(clusterId).and(NODE_ID_TAG, nodeId);
    }

    /**
     * @param outcome "success", "completed" or a lower-case error kind
     */
    public static Tags outcomeTags(String clusterId, String outcome) {
        return clusterTags(clusterId).and(OUTCOME_TAG, outcome);
    }
}
