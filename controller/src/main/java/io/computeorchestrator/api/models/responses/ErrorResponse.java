package io.computeorchestrator.api.models.responses;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.errors.OrchestratorException;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Standard error response model for all API operations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ErrorResponse {
    private String error;
    private String type;
    private String reason;
    private String stage;
    private Integer status;

    public static ErrorResponse notFound(String resource) {
        return ErrorResponse.builder()
            .error("resource_not_found_exception")
            .reason(resource + " not found")
            .status(404)
            .build();
    }

    public static ErrorResponse internalError(String message) {
        return ErrorResponse.builder()
            .error("internal_server_error")
            .reason(message)
            .status(500)
            .build();
    }

    public static ErrorResponse badRequest(String message) {
        return ErrorResponse.builder()
            .error("bad_request")
            .reason(message)
            .status(400)
            .build();
    }

    public static ErrorResponse fromException(OrchestratorException e) {
        HttpStatus status = statusFor(e.getKind());
        return ErrorResponse.builder()
            .error(errorFor(status))
            .type(e.getKind().name().toLowerCase())
            .reason(e.getMessage())
            .stage(e.getStage() != null ? e.getStage().name().toLowerCase() : null)
            .status(status.value())
            .build();
    }

    public static ResponseEntity<Object> toResponseEntity(OrchestratorException e) {
        ErrorResponse body = fromException(e);
        return ResponseEntity.status(body.getStatus()).body(body);
    }

    public static HttpStatus statusFor(ErrorKind kind) {
        switch (kind) {
            case NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case INVALID_REQUEST:
                return HttpStatus.BAD_REQUEST;
            case RESERVATION_CONFLICT:
            case MIGRATION_CONFLICT:
                return HttpStatus.CONFLICT;
            case INSUFFICIENT_CAPACITY:
            case AFFINITY_UNSATISFIABLE:
            case ALL_NODES_UNAVAILABLE:
            case PREFLIGHT_INCOMPATIBLE:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            case STAGE_TIMEOUT:
                return HttpStatus.GATEWAY_TIMEOUT;
            case STAGE_FAILED:
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static String errorFor(HttpStatus status) {
        switch (status) {
            case NOT_FOUND:
                return "resource_not_found_exception";
            case BAD_REQUEST:
                return "bad_request";
            case CONFLICT:
                return "conflict";
            case UNPROCESSABLE_ENTITY:
                return "placement_exception";
            default:
                return "internal_server_error";
        }
    }
}
