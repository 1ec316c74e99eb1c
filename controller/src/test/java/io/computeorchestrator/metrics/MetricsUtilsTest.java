package io.computeorchestrator.metrics;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MetricsUtilsTest {

    @Test
    void testNodeTags() {
        Tags tags = MetricsUtils.nodeTags("pool-a", "node-1");
        assertThat(tags.stream()).containsExactly(Tag.of("clusterId", "pool-a"), Tag.of("nodeId", "node-1"));
    }

    @Test
    void testOutcomeTagsCanBeExtended() {
        Tags tags = MetricsUtils.outcomeTags("pool-a", "insufficient_capacity").and(MetricsConstants.STRATEGY_TAG, "packed");
        assertThat(tags.stream()).containsExactly(
            Tag.of("clusterId", "pool-a"),
            Tag.of("outcome", "insufficient_capacity"),
            Tag.of("strategy", "packed"));
    }
}
