package io.computeorchestrator.api.handlers;

import io.computeorchestrator.ComputeOrchestrator;
import io.computeorchestrator.api.models.requests.PlacementApiRequest;
import io.computeorchestrator.api.models.requests.WorkloadStateRequest;
import io.computeorchestrator.api.models.responses.AcknowledgedResponse;
import io.computeorchestrator.api.models.responses.ErrorResponse;
import io.computeorchestrator.api.models.responses.PlacementResponse;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.PlacementStrategyType;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.models.Resources;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.placement.PlacementDecision;
import io.computeorchestrator.placement.PlacementRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
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

class WorkloadHandlerTest {

    @Mock
    private ComputeOrchestrator orchestrator;

    @InjectMocks
    private WorkloadHandler workloadHandler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private PlacementApiRequest placementRequest(String strategy) {
        return PlacementApiRequest.builder()
            .workloadId("vm-42")
            .resources(Resources.of(4, 8192, 80))
            .strategy(strategy)
            .build();
    }

    @Test
    void testPlaceWorkload_Success() throws Exception {
        // Given
        PlacementDecision decision = PlacementDecision.builder()
            .workloadId("vm-42")
            .nodeId("node-2")
            .strategy(PlacementStrategyType.SPREAD)
            .score(0.5)
            .rankedCandidates(List.of("node-2", "node-1"))
            .build();
        when(orchestrator.placeWorkload(any(PlacementRequest.class))).thenReturn(decision);

        // When
        ResponseEntity<Object> response = workloadHandler.placeWorkload(placementRequest("spread"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        PlacementResponse body = (PlacementResponse) response.getBody();
        assertThat(body.getNodeId()).isEqualTo("node-2");
        assertThat(body.getStrategy()).isEqualTo("spread");
        assertThat(body.getRankedCandidates()).containsExactly("node-2", "node-1");

        ArgumentCaptor<PlacementRequest> captor = ArgumentCaptor.forClass(PlacementRequest.class);
        verify(orchestrator).placeWorkload(captor.capture());
        assertThat(captor.getValue().getStrategy()).isEqualTo(PlacementStrategyType.SPREAD);
        assertThat(captor.getValue().getConstraints()).isNotNull();
    }

    @Test
    void testPlaceWorkload_DefaultStrategyWhenAbsent() throws Exception {
        // Given
        when(orchestrator.placeWorkload(any(PlacementRequest.class))).thenReturn(PlacementDecision.builder()
            .workloadId("vm-42").nodeId("node-1").strategy(PlacementStrategyType.BALANCED).build());

        // When
        workloadHandler.placeWorkload(placementRequest(null));

        // Then
        ArgumentCaptor<PlacementRequest> captor = ArgumentCaptor.forClass(PlacementRequest.class);
        verify(orchestrator).placeWorkload(captor.capture());
        assertThat(captor.getValue().getStrategy()).isNull();
    }

    @Test
    void testPlaceWorkload_InsufficientCapacity() throws Exception {
        // Given
        when(orchestrator.placeWorkload(any(PlacementRequest.class)))
            .thenThrow(new OrchestratorException(ErrorKind.INSUFFICIENT_CAPACITY, "No node can fit vm-42"));

        // When
        ResponseEntity<Object> response = workloadHandler.placeWorkload(placementRequest("packed"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        ErrorResponse error = (ErrorResponse) response.getBody();
        assertThat(error.getError()).isEqualTo("placement_exception");
        assertThat(error.getType()).isEqualTo("insufficient_capacity");
        assertThat(error.getStatus()).isEqualTo(422);
    }

    @Test
    void testGetWorkload_NotFound() throws Exception {
        // Given
        when(orchestrator.getWorkload("vm-9")).thenThrow(OrchestratorException.notFound("Workload vm-9"));

        // When
        ResponseEntity<Object> response = workloadHandler.getWorkload("vm-9");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void testListWorkloads() throws Exception {
        // Given
        Workload workload = Workload.builder().id("vm-1").state(WorkloadState.RUNNING).build();
        when(orchestrator.listWorkloads()).thenReturn(List.of(workload));

        // When
        ResponseEntity<Object> response = workloadHandler.listWorkloads();

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isEqualTo(List.of(workload));
    }

    @Test
    void testUpdateState_ParsesCaseInsensitively() throws Exception {
        // Given
        Workload running = Workload.builder().id("vm-1").state(WorkloadState.RUNNING).build();
        when(orchestrator.updateWorkloadState("vm-1", WorkloadState.RUNNING)).thenReturn(running);

        // When
        ResponseEntity<Object> response = workloadHandler.updateState("vm-1", new WorkloadStateRequest(" running "));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isSameAs(running);
    }

    @Test
    void testUpdateState_UnknownState() throws Exception {
        // When
        ResponseEntity<Object> response = workloadHandler.updateState("vm-1", new WorkloadStateRequest("hibernating"));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(((ErrorResponse) response.getBody()).getReason()).contains("hibernating");
        verify(orchestrator, never()).updateWorkloadState(anyString(), any());
    }

    @Test
    void testUpdateState_MissingState() throws Exception {
        // When
        ResponseEntity<Object> response = workloadHandler.updateState("vm-1", new WorkloadStateRequest(null));

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void testDeleteWorkload_Success() throws Exception {
        // When
        ResponseEntity<Object> response = workloadHandler.deleteWorkload("vm-1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(((AcknowledgedResponse) response.getBody()).isAcknowledged()).isTrue();
        verify(orchestrator).deleteWorkload("vm-1");
    }

    @Test
    void testDeleteWorkload_DuringMigration() throws Exception {
        // Given
        doThrow(new OrchestratorException(ErrorKind.MIGRATION_CONFLICT, "Workload vm-1 has an active migration"))
            .when(orchestrator).deleteWorkload("vm-1");

        // When
        ResponseEntity<Object> response = workloadHandler.deleteWorkload("vm-1");

        // Then
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(((ErrorResponse) response.getBody()).getType()).isEqualTo("migration_conflict");
    }
}
