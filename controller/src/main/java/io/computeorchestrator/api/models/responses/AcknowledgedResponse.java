package io.computeorchestrator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement of a state-changing call that has nothing else to return.
 *
 * Example response:
 * <pre>
 * {
 *   "acknowledged": true
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AcknowledgedResponse {

    private boolean acknowledged;

    public static AcknowledgedResponse success() {
        return AcknowledgedResponse.builder()
            .acknowledged(true)
            .build();
    }
}
