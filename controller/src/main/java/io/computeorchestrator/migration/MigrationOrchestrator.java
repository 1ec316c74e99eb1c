package io.computeorchestrator.migration;

import io.computeorchestrator.config.OrchestratorConfig;
import io.computeorchestrator.enums.ErrorKind;
import io.computeorchestrator.enums.HypervisorState;
import io.computeorchestrator.enums.MigrationMode;
import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.enums.WorkloadState;
import io.computeorchestrator.errors.OrchestratorException;
import io.computeorchestrator.health.HealthMonitor;
import io.computeorchestrator.hypervisor.HypervisorDriver;
import io.computeorchestrator.hypervisor.HypervisorException;
import io.computeorchestrator.ledger.ReservationOutcome;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.models.ComputeNode;
import io.computeorchestrator.models.MigrationJob;
import io.computeorchestrator.models.Versioned;
import io.computeorchestrator.models.Workload;
import io.computeorchestrator.store.MetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Moves workloads between nodes.
 *
 * A migration is accepted synchronously (validation, per-workload uniqueness key, target reservation,
 * workload marked MIGRATING) and then executed on a bounded worker pool. At most
 * {@code migration.max_concurrent} migrations execute at once across the pool.
 *
 * Ownership of the workload changes in exactly one place, the compare-and-commit write performed in
 * UPDATING_OWNERSHIP. Any failure before the owner moves is rolled back so the workload keeps running on
 * its source. Once the stored owner is the target, a failure leaves the workload there with the source
 * reservation in place for an operator to clean up.
 */
@Slf4j
public class MigrationOrchestrator {

    private final MetadataStore metadataStore;
    private final String clusterId;
    private final ResourceLedger resourceLedger;
    private final HealthMonitor healthMonitor;
    private final HypervisorDriver hypervisorDriver;
    private final MetricsProvider metricsProvider;
    private final OrchestratorConfig config;

    private final ExecutorService workerPool;
    private final ExecutorService stageExecutor;
    private final Semaphore executionPermits;
    private final Map<String, CompletableFuture<MigrationJob>> runningJobs = new ConcurrentHashMap<>();

    public MigrationOrchestrator(MetadataStore metadataStore, String clusterId, ResourceLedger resourceLedger,
                                 HealthMonitor healthMonitor, HypervisorDriver hypervisorDriver,
                                 MetricsProvider metricsProvider, OrchestratorConfig config) {
        this.metadataStore = metadataStore;
        this.clusterId = clusterId;
        this.resourceLedger = resourceLedger;
        this.healthMonitor = healthMonitor;
        this.hypervisorDriver = hypervisorDriver;
        this.metricsProvider = metricsProvider;
        this.config = config;
        this.workerPool = Executors.newFixedThreadPool(config.getMigrationWorkerThreads());
        this.stageExecutor = Executors.newCachedThreadPool();
        this.executionPermits = new Semaphore(config.getMaxConcurrentMigrations(), true);
    }

    /**
     * Holds what one execution learns along the way and needs for rollback.
     */
    private static final class MigrationContext {
        private final MigrationJob job;
        private final Workload workload;
        private final ComputeNode source;
        private final ComputeNode target;
        private boolean sourceWasRunning;
        private boolean switchedOver;
        private long startNanos;

        private MigrationContext(MigrationJob job, Workload workload, ComputeNode source, ComputeNode target) {
            this.job = job;
            this.workload = workload;
            this.source = source;
            this.target = target;
        }
    }

    // =================================================================
    // PUBLIC OPERATIONS
    // =================================================================

    /**
     * Accept a migration and schedule its execution.
     *
     * @param requestedMode LIVE or OFFLINE; null picks LIVE for a running workload and OFFLINE otherwise
     * @return the persisted job in state PENDING
     */
    public MigrationJob startMigration(String workloadId, String targetNodeId, MigrationMode requestedMode) throws Exception {
        Workload workload = metadataStore.getWorkload(clusterId, workloadId)
            .orElseThrow(() -> OrchestratorException.notFound("Workload " + workloadId));
        MigrationMode mode = requestedMode != null ? requestedMode
            : workload.getState() == WorkloadState.RUNNING ? MigrationMode.LIVE : MigrationMode.OFFLINE;
        validate(workload, targetNodeId, mode);
        ComputeNode source = metadataStore.getNode(clusterId, workload.getNodeId())
            .orElseThrow(() -> OrchestratorException.notFound("Source node " + workload.getNodeId()));
        ComputeNode target = metadataStore.getNode(clusterId, targetNodeId)
            .orElseThrow(() -> OrchestratorException.notFound("Node " + targetNodeId));
        if (target.isMaintenance() || !healthMonitor.getStatus(targetNodeId).isHealthy()) {
            throw OrchestratorException.invalid("Target node " + targetNodeId + " is not available");
        }

        String jobId = UUID.randomUUID().toString();
        if (!metadataStore.createActiveMigrationIfAbsent(clusterId, workloadId, jobId)) {
            throw new OrchestratorException(ErrorKind.MIGRATION_CONFLICT,
                "Workload " + workloadId + " already has an active migration");
        }

        MigrationJob job;
        try {
            reserveTarget(workload, targetNodeId);
            WorkloadState previousState;
            try {
                previousState = markMigrating(workloadId, source.getId());
            } catch (Exception e) {
                resourceLedger.release(targetNodeId, workloadId);
                throw e;
            }
            job = MigrationJob.builder()
                .jobId(jobId)
                .workloadId(workloadId)
                .sourceNodeId(source.getId())
                .targetNodeId(targetNodeId)
                .mode(mode)
                .state(MigrationState.PENDING)
                .previousWorkloadState(previousState)
                .startedAt(OffsetDateTime.now())
                .build();
            metadataStore.upsertMigrationJob(clusterId, job);
        } catch (Exception e) {
            metadataStore.clearActiveMigration(clusterId, workloadId, jobId);
            throw e;
        }

        log.info("Accepted {} migration {} of workload {} from {} to {}",
            mode, jobId, workloadId, source.getId(), targetNodeId);

        MigrationContext context = new MigrationContext(job, workload, source, target);
        CompletableFuture<MigrationJob> future = CompletableFuture.supplyAsync(() -> execute(context), workerPool);
        runningJobs.put(jobId, future);
        future.whenComplete((result, error) -> runningJobs.remove(jobId));
        return copyOf(job);
    }

    /**
     * Start a migration and block until it reaches a terminal state.
     */
    public MigrationJob migrateAndWait(String workloadId, String targetNodeId, MigrationMode mode) throws Exception {
        MigrationJob accepted = startMigration(workloadId, targetNodeId, mode);
        return awaitCompletion(accepted.getJobId());
    }

    /**
     * Block until the given job reaches a terminal state and return it.
     */
    public MigrationJob awaitCompletion(String jobId) throws Exception {
        CompletableFuture<MigrationJob> future = runningJobs.get(jobId);
        if (future != null) {
            try {
                return future.get();
            } catch (ExecutionException e) {
                throw new Exception("Migration " + jobId + " execution failed", e.getCause());
            }
        }
        return getMigrationStatus(jobId);
    }

    public MigrationJob getMigrationStatus(String jobId) throws Exception {
        return metadataStore.getMigrationJob(clusterId, jobId)
            .orElseThrow(() -> OrchestratorException.notFound("Migration job " + jobId));
    }

    /**
     * All known jobs, most recent first.
     */
    public List<MigrationJob> listMigrations() throws Exception {
        return metadataStore.getAllMigrationJobs(clusterId).stream()
            .sorted(Comparator.comparing(MigrationJob::getStartedAt,
                Comparator.nullsLast(Comparator.<OffsetDateTime>naturalOrder())).reversed())
            .collect(Collectors.toList());
    }

    /**
     * Pre-check whether a workload could be moved to a node, without side effects.
     */
    public MigrationCheck canMigrate(String workloadId, String targetNodeId) throws Exception {
        Optional<Workload> workload = metadataStore.getWorkload(clusterId, workloadId);
        if (workload.isEmpty()) {
            return MigrationCheck.denied("Workload not found");
        }
        if (workload.get().getNodeId() == null) {
            return MigrationCheck.denied("Workload is not placed on any node");
        }
        if (workload.get().isOwnedBy(targetNodeId)) {
            return MigrationCheck.denied("Target is the same as source");
        }
        Optional<ComputeNode> target = metadataStore.getNode(clusterId, targetNodeId);
        if (target.isEmpty()) {
            return MigrationCheck.denied("Target node not found");
        }
        if (target.get().isMaintenance() || !healthMonitor.getStatus(targetNodeId).isHealthy()) {
            return MigrationCheck.denied("Target node is not active");
        }
        if (metadataStore.getActiveMigration(clusterId, workloadId).isPresent()) {
            return MigrationCheck.denied("Workload already has an active migration");
        }
        if (!resourceLedger.availableCapacity(targetNodeId).fits(workload.get().getResources())) {
            return MigrationCheck.denied("Target node has insufficient resources");
        }
        return MigrationCheck.ok();
    }

    public void shutdown() {
        log.info("Shutting down migration orchestrator");
        workerPool.shutdownNow();
        stageExecutor.shutdownNow();
    }

    // =================================================================
    // ACCEPTANCE
    // =================================================================

    private void validate(Workload workload, String targetNodeId, MigrationMode mode) throws OrchestratorException {
        if (targetNodeId == null || targetNodeId.isBlank()) {
            throw OrchestratorException.invalid("Target node is required");
        }
        if (workload.getState() == WorkloadState.DELETED) {
            throw OrchestratorException.invalid("Workload " + workload.getId() + " is deleted");
        }
        if (workload.getNodeId() == null) {
            throw OrchestratorException.invalid("Workload " + workload.getId() + " is not placed on any node");
        }
        if (workload.isOwnedBy(targetNodeId)) {
            throw OrchestratorException.invalid("Target node " + targetNodeId + " is the current owner of " + workload.getId());
        }
        if (mode == MigrationMode.LIVE && workload.getState() != WorkloadState.RUNNING) {
            throw OrchestratorException.invalid("Live migration requires a running workload, " + workload.getId()
                + " is " + workload.getState());
        }
    }

    private void reserveTarget(Workload workload, String targetNodeId) throws Exception {
        for (int attempt = 1; attempt <= config.getMaxReservationRetries(); attempt++) {
            ReservationOutcome outcome = resourceLedger.reserve(targetNodeId, workload.getId(), workload.getResources());
            switch (outcome) {
                case RESERVED:
                case ALREADY_RESERVED:
                    return;
                case INSUFFICIENT_CAPACITY:
                    throw new OrchestratorException(ErrorKind.INSUFFICIENT_CAPACITY,
                        "Target node " + targetNodeId + " cannot fit " + workload.getResources());
                case UNKNOWN_NODE:
                    throw OrchestratorException.notFound("Node " + targetNodeId);
                case CONFLICT:
                default:
                    log.debug("Target reservation for {} on {} conflicted (attempt {})", workload.getId(), targetNodeId, attempt);
            }
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
            "Could not reserve " + targetNodeId + " for " + workload.getId() + " after "
                + config.getMaxReservationRetries() + " attempts");
    }

    /**
     * Flip the workload to MIGRATING while it is still owned by {@code sourceNodeId}.
     *
     * @return the state it had before
     */
    private WorkloadState markMigrating(String workloadId, String sourceNodeId) throws Exception {
        for (int attempt = 1; attempt <= config.getMaxReservationRetries(); attempt++) {
            Versioned<Workload> current = metadataStore.getVersionedWorkload(clusterId, workloadId);
            if (!current.isPresent() || !current.getValue().isOwnedBy(sourceNodeId)) {
                throw new OrchestratorException(ErrorKind.MIGRATION_CONFLICT,
                    "Workload " + workloadId + " changed owner while the migration was being accepted");
            }
            Workload updated = current.getValue();
            WorkloadState previous = updated.getState();
            updated.setState(WorkloadState.MIGRATING);
            updated.setUpdatedAt(OffsetDateTime.now());
            if (metadataStore.compareAndSetWorkload(clusterId, updated, current.getVersion())) {
                return previous;
            }
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
            "Workload record " + workloadId + " kept changing while marking it MIGRATING");
    }

    // =================================================================
    // EXECUTION
    // =================================================================

    private MigrationJob execute(MigrationContext context) {
        MigrationJob job = context.job;
        try {
            executionPermits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(context, MigrationState.PENDING,
                new OrchestratorException(ErrorKind.STAGE_FAILED, MigrationState.PENDING, "Interrupted while waiting to run", e));
            return copyOf(job);
        }

        context.startNanos = System.nanoTime();
        try {
            log.info("Executing migration {} of workload {}", job.getJobId(), job.getWorkloadId());
            for (MigrationState stage : MigrationPlan.stagesFor(job.getMode())) {
                enterStage(job, stage);
                try {
                    runStage(context, stage);
                } catch (OrchestratorException e) {
                    fail(context, stage, e);
                    return copyOf(job);
                }
            }
            complete(context);
            return copyOf(job);
        } finally {
            executionPermits.release();
        }
    }

    private void runStage(MigrationContext context, MigrationState stage) throws OrchestratorException {
        ComputeNode source = context.source;
        ComputeNode target = context.target;
        String workloadId = context.workload.getId();

        switch (stage) {
            case STOPPING_SOURCE -> withTimeout(stage, () -> {
                HypervisorState state = hypervisorDriver.queryState(source, workloadId);
                context.sourceWasRunning = state == HypervisorState.RUNNING || state == HypervisorState.PAUSED;
                if (context.sourceWasRunning) {
                    hypervisorDriver.stop(source, workloadId);
                }
                return null;
            });
            case COPYING_DISK -> withTimeout(stage, () -> {
                hypervisorDriver.copyDisk(source, target, workloadId);
                return null;
            });
            case PROVISIONING_TARGET -> withTimeout(stage, () -> {
                hypervisorDriver.createWorkload(target, context.workload);
                return null;
            });
            case STARTING_TARGET -> withTimeout(stage, () -> {
                if (context.sourceWasRunning) {
                    hypervisorDriver.start(target, workloadId);
                }
                return null;
            });
            case PREFLIGHT_CHECK -> {
                List<String> reasons = withTimeout(stage, () -> hypervisorDriver.checkCompatibility(source, target));
                if (!reasons.isEmpty()) {
                    throw new OrchestratorException(ErrorKind.PREFLIGHT_INCOMPATIBLE, stage,
                        "Nodes " + source.getId() + " and " + target.getId() + " are incompatible: "
                            + String.join("; ", reasons), null);
                }
                context.sourceWasRunning = true;
            }
            case STREAMING_STATE -> withTimeout(stage, () -> {
                hypervisorDriver.streamMemoryState(source, target, workloadId);
                return null;
            });
            case SWITCHOVER -> withTimeout(stage, () -> {
                hypervisorDriver.switchover(source, target, workloadId);
                context.switchedOver = true;
                return null;
            });
            case VERIFYING -> {
                HypervisorState state = withTimeout(stage, () -> hypervisorDriver.queryState(target, workloadId));
                boolean expectRunning = context.job.getMode() == MigrationMode.LIVE;
                if (state == HypervisorState.NOT_FOUND || (expectRunning && state != HypervisorState.RUNNING)) {
                    throw new OrchestratorException(ErrorKind.STAGE_FAILED, stage,
                        "Workload " + workloadId + " is " + state + " on target " + target.getId(), null);
                }
            }
            case UPDATING_OWNERSHIP -> runCommit(context);
            case CLEANING_SOURCE -> withTimeout(stage, () -> {
                hypervisorDriver.delete(source, workloadId);
                resourceLedger.release(source.getId(), workloadId);
                return null;
            });
            default -> throw new IllegalStateException("Unexpected migration stage " + stage);
        }
    }

    /**
     * Run the ownership commit on the worker thread itself.
     *
     * The write is never cancelled: an abandoned compare-and-set may still land, so the stage timeout
     * only produces a warning here and the stored record decides the outcome.
     */
    private void runCommit(MigrationContext context) throws OrchestratorException {
        MigrationState stage = MigrationState.UPDATING_OWNERSHIP;
        Duration timeout = config.getStageTimeout(stage);
        long started = System.nanoTime();
        try {
            commitOwnership(context);
        } catch (OrchestratorException e) {
            throw e;
        } catch (Exception e) {
            throw new OrchestratorException(ErrorKind.STAGE_FAILED, stage,
                "Stage " + stage + " failed: " + e.getMessage(), e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        if (elapsed.compareTo(timeout) > 0) {
            log.warn("Ownership commit of migration {} took {}ms, above the {}s stage timeout",
                context.job.getJobId(), elapsed.toMillis(), timeout.getSeconds());
        }
    }

    /**
     * The commit point: owner moves from source to target in one conditional write.
     *
     * The write is guarded by the record still naming the source and by the active migration marker
     * still naming this job. A record that already names the target under this job is a commit that
     * landed on an earlier attempt.
     */
    private void commitOwnership(MigrationContext context) throws Exception {
        MigrationJob job = context.job;
        for (int attempt = 1; attempt <= config.getMaxReservationRetries(); attempt++) {
            Optional<String> activeJob = metadataStore.getActiveMigration(clusterId, job.getWorkloadId());
            if (activeJob.isEmpty() || !activeJob.get().equals(job.getJobId())) {
                throw new OrchestratorException(ErrorKind.MIGRATION_CONFLICT, MigrationState.UPDATING_OWNERSHIP,
                    "Migration " + job.getJobId() + " is no longer the active migration of " + job.getWorkloadId(), null);
            }
            Versioned<Workload> current = metadataStore.getVersionedWorkload(clusterId, job.getWorkloadId());
            if (current.isPresent() && current.getValue().isOwnedBy(job.getTargetNodeId())) {
                log.info("Workload {} already owned by {} (migration {})",
                    job.getWorkloadId(), job.getTargetNodeId(), job.getJobId());
                return;
            }
            if (!current.isPresent() || !current.getValue().isOwnedBy(job.getSourceNodeId())) {
                throw new OrchestratorException(ErrorKind.STAGE_FAILED, MigrationState.UPDATING_OWNERSHIP,
                    "Workload " + job.getWorkloadId() + " is no longer owned by " + job.getSourceNodeId(), null);
            }
            Workload updated = current.getValue();
            updated.setNodeId(job.getTargetNodeId());
            updated.setState(context.sourceWasRunning ? WorkloadState.RUNNING : job.getPreviousWorkloadState());
            updated.setUpdatedAt(OffsetDateTime.now());
            if (metadataStore.compareAndSetWorkload(clusterId, updated, current.getVersion())) {
                log.info("Workload {} now owned by {} (migration {})",
                    job.getWorkloadId(), job.getTargetNodeId(), job.getJobId());
                return;
            }
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT, MigrationState.UPDATING_OWNERSHIP,
            "Workload record " + job.getWorkloadId() + " kept changing during ownership update", null);
    }

    private <T> T withTimeout(MigrationState stage, Callable<T> action) throws OrchestratorException {
        Duration timeout = config.getStageTimeout(stage);
        Future<T> future = stageExecutor.submit(action);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new OrchestratorException(ErrorKind.STAGE_TIMEOUT, stage,
                "Stage " + stage + " did not finish within " + timeout.getSeconds() + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new OrchestratorException(ErrorKind.STAGE_FAILED, stage, "Interrupted during " + stage, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof OrchestratorException) {
                OrchestratorException oe = (OrchestratorException) cause;
                if (oe.getStage() == null) {
                    throw new OrchestratorException(oe.getKind(), stage, oe.getMessage(), oe);
                }
                throw oe;
            }
            String detail = cause instanceof HypervisorException
                ? "hypervisor on " + ((HypervisorException) cause).getNodeId() + ": " + cause.getMessage()
                : String.valueOf(cause.getMessage());
            throw new OrchestratorException(ErrorKind.STAGE_FAILED, stage, "Stage " + stage + " failed: " + detail, cause);
        }
    }

    // =================================================================
    // TERMINAL STATES
    // =================================================================

    private void complete(MigrationContext context) {
        MigrationJob job = context.job;
        job.setState(MigrationState.COMPLETED);
        job.setCompletedAt(OffsetDateTime.now());
        persistQuietly(job);
        clearActiveKey(job);
        log.info("Migration {} of workload {} to {} completed", job.getJobId(), job.getWorkloadId(), job.getTargetNodeId());
        recordOutcome(context, "completed");
    }

    private void fail(MigrationContext context, MigrationState stage, OrchestratorException error) {
        MigrationJob job = context.job;
        job.setFailureKind(error.getKind());
        job.setFailureStage(stage);
        job.setFailureReason(error.getMessage());

        if (MigrationPlan.isBeforeCommit(stage) && !ownershipMoved(job, stage)) {
            log.warn("Migration {} of workload {} failed in {}: {}; rolling back",
                job.getJobId(), job.getWorkloadId(), stage, error.getMessage());
            boolean rolledBack = rollback(context, stage);
            job.setRolledBack(rolledBack);
            if (!rolledBack) {
                job.setFailureReason(error.getMessage() + "; rollback incomplete, operator attention required");
            }
        } else {
            // ownership already on target; source copy and reservation are left for cleanup
            log.error("Migration {} of workload {} failed after commit in {}: {}; source {} needs manual cleanup",
                job.getJobId(), job.getWorkloadId(), stage, error.getMessage(), job.getSourceNodeId());
            job.setRolledBack(false);
        }

        job.setState(MigrationState.FAILED);
        job.setCompletedAt(OffsetDateTime.now());
        persistQuietly(job);
        clearActiveKey(job);
        recordOutcome(context, error.getKind().name().toLowerCase());
    }

    /**
     * Whether a failed commit stage still moved the owner to the target.
     * An unreadable record counts as moved so nothing is torn down on the target.
     */
    private boolean ownershipMoved(MigrationJob job, MigrationState stage) {
        if (!MigrationPlan.isCommitPoint(stage)) {
            return false;
        }
        try {
            return metadataStore.getWorkload(clusterId, job.getWorkloadId())
                .map(workload -> workload.isOwnedBy(job.getTargetNodeId()))
                .orElse(false);
        } catch (Exception e) {
            log.error("Could not read workload {} after failed ownership commit of migration {}: {}",
                job.getWorkloadId(), job.getJobId(), e.getMessage(), e);
            return true;
        }
    }

    /**
     * Undo everything done so far so the workload runs on its source as before.
     *
     * @return true if every step succeeded
     */
    private boolean rollback(MigrationContext context, MigrationState failedStage) {
        MigrationJob job = context.job;
        ComputeNode source = context.source;
        ComputeNode target = context.target;
        String workloadId = job.getWorkloadId();
        boolean clean = true;

        if (context.switchedOver) {
            clean &= rollbackStep(job, "reverse switchover", failedStage, () -> {
                hypervisorDriver.switchover(target, source, workloadId);
                return null;
            });
        }

        boolean targetRemoved = rollbackStep(job, "remove target copy", failedStage, () -> {
            hypervisorDriver.delete(target, workloadId);
            return null;
        });
        clean &= targetRemoved;

        if (context.sourceWasRunning) {
            clean &= rollbackStep(job, "restart source", failedStage, () -> {
                if (hypervisorDriver.queryState(source, workloadId) != HypervisorState.RUNNING) {
                    hypervisorDriver.start(source, workloadId);
                }
                return null;
            });
        }

        // a target copy that could not be removed keeps its reservation
        if (targetRemoved) {
            clean &= rollbackStep(job, "release target reservation", failedStage, () -> {
                resourceLedger.release(target.getId(), workloadId);
                return null;
            });
        }

        WorkloadState restoredState = clean ? job.getPreviousWorkloadState() : WorkloadState.ERROR;
        clean &= rollbackStep(job, "restore workload state", failedStage, () -> {
            restoreWorkloadState(job, restoredState);
            return null;
        });

        return clean;
    }

    private boolean rollbackStep(MigrationJob job, String description, MigrationState stage, Callable<Void> step) {
        try {
            withTimeout(stage, step);
            log.debug("Migration {} rollback: {} done", job.getJobId(), description);
            return true;
        } catch (OrchestratorException e) {
            log.error("Migration {} rollback: {} failed: {}", job.getJobId(), description, e.getMessage(), e);
            return false;
        }
    }

    private void restoreWorkloadState(MigrationJob job, WorkloadState state) throws Exception {
        for (int attempt = 1; attempt <= config.getMaxReservationRetries(); attempt++) {
            Versioned<Workload> current = metadataStore.getVersionedWorkload(clusterId, job.getWorkloadId());
            if (!current.isPresent()) {
                return;
            }
            Workload workload = current.getValue();
            workload.setState(state);
            workload.setUpdatedAt(OffsetDateTime.now());
            if (metadataStore.compareAndSetWorkload(clusterId, workload, current.getVersion())) {
                return;
            }
        }
        throw new OrchestratorException(ErrorKind.RESERVATION_CONFLICT,
            "Workload record " + job.getWorkloadId() + " kept changing while restoring its state");
    }

    // =================================================================
    // PRIVATE HELPERS
    // =================================================================

    private void enterStage(MigrationJob job, MigrationState stage) {
        job.setState(stage);
        log.debug("Migration {} entering {}", job.getJobId(), stage);
        persistQuietly(job);
    }

    private void persistQuietly(MigrationJob job) {
        try {
            metadataStore.upsertMigrationJob(clusterId, job);
        } catch (Exception e) {
            log.error("Failed to persist migration job {} in state {}: {}", job.getJobId(), job.getState(), e.getMessage(), e);
        }
    }

    private void clearActiveKey(MigrationJob job) {
        try {
            metadataStore.clearActiveMigration(clusterId, job.getWorkloadId(), job.getJobId());
        } catch (Exception e) {
            log.error("Failed to clear active migration marker of workload {}: {}", job.getWorkloadId(), e.getMessage(), e);
        }
    }

    private void recordOutcome(MigrationContext context, String outcome) {
        long durationNanos = context.startNanos > 0 ? System.nanoTime() - context.startNanos : 0L;
        metricsProvider.recordMigration(clusterId, context.job.getMode(), outcome, durationNanos);
    }

    private static MigrationJob copyOf(MigrationJob job) {
        return job.toBuilder().build();
    }
}
