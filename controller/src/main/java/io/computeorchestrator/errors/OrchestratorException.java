package io.computeorchestrator.errors;

import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.MigrationState;
import lombok.Getter;

/**
 * Exception thrown when an orchestrator operation cannot be completed.
 * Carries the error kind and, for migration failures, the stage that failed,
 * so callers can decide whether to retry with different parameters.
 */
@Getter
public class OrchestratorException extends Exception {

    private final ErrorKind kind;
    private final MigrationState stage;

    public OrchestratorException(ErrorKind kind, String message) {
        this(kind, null, message, null);
    }

    public OrchestratorException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, cause);
    }

    public OrchestratorException(ErrorKind kind, MigrationState stage, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.stage = stage;
    }

    public static OrchestratorException notFound(String resource) {
        return new OrchestratorException(ErrorKind.NOT_FOUND, resource + " not found");
    }

    public static OrchestratorException invalid(String message) {
        return new OrchestratorException(ErrorKind.INVALID_REQUEST, message);
    }
}
