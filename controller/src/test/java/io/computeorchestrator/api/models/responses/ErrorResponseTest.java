package io.computeorchestrator.api.models.responses;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.errors.OrchestratorException;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorResponseTest {

    @Test
    void testStatusForEveryKind() {
        assertThat(ErrorResponse.statusFor(ErrorKind.NOT_FOUND)).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(ErrorResponse.statusFor(ErrorKind.INVALID_REQUEST)).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(ErrorResponse.statusFor(ErrorKind.RESERVATION_CONFLICT)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ErrorResponse.statusFor(ErrorKind.MIGRATION_CONFLICT)).isEqualTo(HttpStatus.CONFLICT);
        assertThat(ErrorResponse.statusFor(ErrorKind.INSUFFICIENT_CAPACITY)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ErrorResponse.statusFor(ErrorKind.AFFINITY_UNSATISFIABLE)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ErrorResponse.statusFor(ErrorKind.ALL_NODES_UNAVAILABLE)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ErrorResponse.statusFor(ErrorKind.PREFLIGHT_INCOMPATIBLE)).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(ErrorResponse.statusFor(ErrorKind.STAGE_TIMEOUT)).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(ErrorResponse.statusFor(ErrorKind.STAGE_FAILED)).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void testFromExceptionCarriesStage() {
        OrchestratorException e = new OrchestratorException(ErrorKind.STAGE_TIMEOUT, MigrationState.COPYING_DISK,
            "Stage copying_disk did not finish in 1s", null);

        ResponseEntity<Object> response = ErrorResponse.toResponseEntity(e);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        ErrorResponse body = (ErrorResponse) response.getBody();
        assertThat(body.getType()).isEqualTo("stage_timeout");
        assertThat(body.getStage()).isEqualTo("copying_disk");
        assertThat(body.getStatus()).isEqualTo(504);
    }

    @Test
    void testSerializesSnakeCaseWithoutEmptyFields() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ErrorResponse.notFound("Node node-1"));

        assertThat(json).contains("\"error\":\"resource_not_found_exception\"");
        assertThat(json).contains("\"reason\":\"Node node-1 not found\"");
        assertThat(json).doesNotContain("stage");
        assertThat(json).doesNotContain("type");
    }
}
