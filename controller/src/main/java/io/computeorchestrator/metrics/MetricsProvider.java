package io.computeorchestrator.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.models.Resources;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static io.computeorchestrator.metrics.MetricsConstants.MIGRATIONS_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.MIGRATION_DURATION_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.MODE_TAG;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_AVAILABLE_DISK_GB_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_AVAILABLE_MEMORY_MB_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_AVAILABLE_VCPUS_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.NODE_HEALTHY_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.PLACEMENT_REQUESTS_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.RESERVATION_CONFLICTS_METRIC_NAME;
import static io.computeorchestrator.metrics.MetricsConstants.STRATEGY_TAG;
import static io.computeorchestrator.metrics.MetricsUtils.nodeTags;
import static io.computeorchestrator.metrics.MetricsUtils.outcomeTags;

/*
 * MetricsProvider publishes the orchestrator's meters: placement and migration outcomes, ledger
 * conflicts and per-node capacity gauges. Every meter carries the hostname of the orchestrator
 * instance that emitted it.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final Tag hostTag;
    private final Map<String, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.hostTag = Tag.of(HOST_NAME_TAG, controllerId);
        log.info("Publishing orchestrator metrics as {}", controllerId);
    }

    // =================================================================
    // ORCHESTRATOR METERS
    // =================================================================

    /**
     * Count one placement request by strategy and outcome ("success" or the lower-case error kind).
     */
    public void recordPlacement(String clusterId, PlacementStrategyType strategy, String outcome) {
        counter(PLACEMENT_REQUESTS_METRIC_NAME, outcomeTags(clusterId, outcome).and(STRATEGY_TAG, strategy.getValue()))
            .increment();
    }

    /**
     * Count one lost compare-and-set on a node's allocation record.
     */
    public void recordReservationConflict(String clusterId, String nodeId) {
        counter(RESERVATION_CONFLICTS_METRIC_NAME, nodeTags(clusterId, nodeId)).increment();
    }

    /**
     * Count a finished migration and, when it got to run, time it.
     *
     * @param durationNanos execution time, or 0 for a job that never started executing
     */
    public void recordMigration(String clusterId, MigrationMode mode, String outcome, long durationNanos) {
        Tags tags = outcomeTags(clusterId, outcome).and(MODE_TAG, mode.name().toLowerCase());
        counter(MIGRATIONS_METRIC_NAME, tags).increment();
        if (durationNanos > 0) {
            timer(MIGRATION_DURATION_METRIC_NAME, tags).record(durationNanos, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * Publish what is still free on a node and whether it is healthy.
     */
    public void recordNodeCapacity(String clusterId, String nodeId, Resources available, boolean healthy) {
        Tags tags = nodeTags(clusterId, nodeId);
        gauge(NODE_AVAILABLE_VCPUS_METRIC_NAME, available.getVcpus(), tags);
        gauge(NODE_AVAILABLE_MEMORY_MB_METRIC_NAME, available.getMemoryMb(), tags);
        gauge(NODE_AVAILABLE_DISK_GB_METRIC_NAME, available.getDiskGb(), tags);
        gauge(NODE_HEALTHY_METRIC_NAME, healthy ? 1 : 0, tags);
    }

    // =================================================================
    // METER PRIMITIVES
    // =================================================================

    Counter counter(String name, Tags tags) {
        return Counter.builder(name).tags(tags.and(hostTag)).register(registry);
    }

    /**
     * Set a gauge, registering it on first use. Returns the same holder for identical name and tags.
     */
    AtomicDouble gauge(String name, double value, Tags tags) {
        Tags allTags = tags.and(hostTag);
        AtomicDouble holder = gaugeValues.computeIfAbsent(gaugeKey(name, allTags), key -> {
            AtomicDouble gaugeValue = new AtomicDouble(value);
            Gauge.builder(name, gaugeValue::get)
                .tags(allTags)
                .register(registry);
            return gaugeValue;
        });
        holder.set(value);
        return holder;
    }

    private static String gaugeKey(String name, Tags tags) {
        // Tags iterate sorted by key
        return tags.stream()
            .map(tag -> tag.getKey() + "=" + tag.getValue())
            .collect(Collectors.joining(",", name + "{", "}"));
    }

    Timer timer(String name, Tags tags) {
        return Timer.builder(name)
            .tags(tags.and(hostTag))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }
}
