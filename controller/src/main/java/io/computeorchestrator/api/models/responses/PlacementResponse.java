package io.computeorchestrator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.computeorchestrator.placement.PlacementDecision;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class PlacementResponse {

    private String workloadId;
    private String nodeId;
    private String strategy;
    private double score;
    private List<String> rankedCandidates;

    public static PlacementResponse from(PlacementDecision decision) {
        return PlacementResponse.builder()
            .workloadId(decision.getWorkloadId())
            .nodeId(decision.getNodeId())
            .strategy(decision.getStrategy().getValue())
            .score(decision.getScore())
            .rankedCandidates(decision.getRankedCandidates())
            .build();
    }
}
