package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.requests.MigrationRequest;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.api.models.responses.MigrationResponse;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.migration.MigrationCheck;
import io.computeorchestrator.models.MigrationJob;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MigrationHandlerTest {

    @Mock
    private ComputeOrchestrator orchestrator;

    @InjectMocks
    private MigrationHandler migrationHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testStartMigration_Accepted() throws Exception {
        // Given
        MigrationRequest request = MigrationRequest.builder()
            .workloadId("vm-1")
            .targetNodeId("node-2")
            .mode("offline")
            .build();
        when(orchestrator.migrateWorkload("vm-1", "node-2", MigrationMode.OFFLINE)).thenReturn("job-1");

        // When
        ResponseEntity<Object> response = migrationHandler.startMigration(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        MigrationResponse body = (MigrationResponse) response.getBody();
        assertThat(body.isAcknowledged()).isTrue();
        assertThat(body.getJobId()).isEqualTo("job-1");
    }

    @Test
    void testStartMigration_ModeOmitted() throws Exception {
        // Given
        MigrationRequest request = MigrationRequest.builder().workloadId("vm-1").targetNodeId("node-2").build();
        when(orchestrator.migrateWorkload("vm-1", "node-2", null)).thenReturn("job-2");

        // When
        ResponseEntity<Object> response = migrationHandler.startMigration(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        verify(orchestrator).migrateWorkload("vm-1", "node-2", null);
    }

    @Test
    void testStartMigration_UnknownMode() throws Exception {
        // Given
        MigrationRequest request = MigrationRequest.builder()
            .workloadId("vm-1")
            .targetNodeId("node-2")
            .mode("teleport")
            .build();

        // When
        ResponseEntity<Object> response = migrationHandler.startMigration(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        verify(orchestrator, never()).migrateWorkload(anyString(), anyString(), any());
    }

    @Test
    void testStartMigration_Conflict() throws Exception {
        // Given
        MigrationRequest request = MigrationRequest.builder().workloadId("vm-1").targetNodeId("node-2").build();
        when(orchestrator.migrateWorkload(any(), any(), any()))
            .thenThrow(new OrchestratorException(ErrorKind.MIGRATION_CONFLICT, "Workload vm-1 is already migrating"));

        // When
        ResponseEntity<Object> response = migrationHandler.startMigration(request);

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(((ErrorResponse) response.getBody()).getError()).isEqualTo("conflict");
    }

    @Test
    void testGetMigrationStatus() throws Exception {
        // Given
        MigrationJob job = MigrationJob.builder().jobId("job-1").state(MigrationState.COPYING_DISK).build();
        when(orchestrator.getMigrationStatus("job-1")).thenReturn(job);

        // When
        ResponseEntity<Object> response = migrationHandler.getMigrationStatus("job-1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(job);
    }

    @Test
    void testGetMigrationStatus_NotFound() throws Exception {
        // Given
        when(orchestrator.getMigrationStatus("job-9")).thenThrow(OrchestratorException.notFound("Migration job job-9"));

        // When
        ResponseEntity<Object> response = migrationHandler.getMigrationStatus("job-9");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testListMigrations() throws Exception {
        // Given
        when(orchestrator.listMigrations()).thenReturn(List.of());

        // When
        ResponseEntity<Object> response = migrationHandler.listMigrations();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(List.of());
    }

    @Test
    void testCanMigrate() throws Exception {
        // Given
        when(orchestrator.canMigrate("vm-1", "node-2")).thenReturn(MigrationCheck.denied("Target node node-2 is in maintenance"));

        // When
        ResponseEntity<Object> response = migrationHandler.canMigrate("vm-1", "node-2");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        MigrationCheck check = (MigrationCheck) response.getBody();
        assertThat(check.isAllowed()).isFalse();
        assertThat(check.getReason()).contains("maintenance");
    }
}
