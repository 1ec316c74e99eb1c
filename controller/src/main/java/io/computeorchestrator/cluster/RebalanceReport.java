package io.computeorchestrator.cluster;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceReport {

    @JsonProperty("dry_run")
    private boolean dryRun;

    @JsonProperty("cancelled")
    private boolean cancelled;

    @JsonProperty("initial_variance")
    private double initialVariance;

    @JsonProperty("planned_variance")
    private double plannedVariance;

    @Builder.Default
    @JsonProperty("moves")
    private List<RebalanceMove> moves = new ArrayList<>();
}
