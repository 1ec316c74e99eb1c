package io.computeorchestrator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Returned when a migration is accepted; poll GET /migrations/{job_id} for progress.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MigrationResponse {

    private boolean acknowledged;
    private String jobId;

    public static MigrationResponse accepted(String jobId) {
        return MigrationResponse.builder()
            .acknowledged(true)
            .jobId(jobId)
            .build();
    }
}
