package io.computeorchestrator.migration;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to "could this workload move to that node right now", with the reason when it cannot.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationCheck {
    @JsonProperty("allowed")
    private boolean allowed;

    @JsonProperty("reason")
    private String reason;

    public static MigrationCheck ok() {
        return new MigrationCheck(true, "OK");
    }

    public static MigrationCheck denied(String reason) {
        return new MigrationCheck(false, reason);
    }
}
