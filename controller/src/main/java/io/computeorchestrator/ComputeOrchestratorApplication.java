package io.computeorchestrator;

import io.computeorchestrator.cluster.ClusterManager;
import io.computeorchestrator.config.OrchestratorConfig;
import io.computeorchestrator.health.ClusterHealthManager;
import io.computeorchestrator.health.HealthMonitor;
import io.computeorchestrator.health.HypervisorHealthProbe;
import io.computeorchestrator.hypervisor.HypervisorDriver;
import io.computeorchestrator.hypervisor.SimulatedHypervisorDriver;
import io.computeorchestrator.ledger.ResourceLedger;
import io.computeorchestrator.metrics.MetricsProvider;
import io.computeorchestrator.migration.MigrationOrchestrator;
import io.computeorchestrator.placement.PlacementEngine;
import io.computeorchestrator.store.EtcdMetadataStore;
import io.computeorchestrator.store.InMemoryMetadataStore;
import io.computeorchestrator.store.MetadataStore;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

import static io.computeorchestrator.config.Constants.DEFAULT_RELEASE_RETRIES;
import static io.computeorchestrator.config.Constants.STORE_TYPE_MEMORY;

/**
 * Main Spring Boot application class for the Compute Orchestrator.
 *
 * Wires one orchestrator for the configured node pool: metadata store (etcd or in-memory),
 * hypervisor driver, resource ledger, health monitor, placement engine, migration orchestrator
 * and cluster manager, and exposes them through the REST handlers.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.computeorchestrator")
public class ComputeOrchestratorApplication {

    public static void main(String[] args) {
        log.info("Starting Compute Orchestrator Application with REST APIs");

        try {
            SpringApplication.run(ComputeOrchestratorApplication.class, args);
            log.info("Compute Orchestrator with REST APIs started successfully");

        } catch (Exception e) {
            log.error("Failed to start Compute Orchestrator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public OrchestratorConfig config() {
        OrchestratorConfig config = new OrchestratorConfig();
        log.info("Loaded configuration for node pool '{}'", config.getClusterName());
        return config;
    }

    /**
     * MetadataStore bean - etcd unless store.type is "memory"
     */
    @Bean
    public MetadataStore metadataStore(OrchestratorConfig config) {
        if (STORE_TYPE_MEMORY.equalsIgnoreCase(config.getStoreType())) {
            log.warn("Using in-memory MetadataStore; state is lost on restart");
            return new InMemoryMetadataStore();
        }
        log.info("Initializing MetadataStore connection to etcd");
        try {
            EtcdMetadataStore store = EtcdMetadataStore.getInstance(config.getEtcdEndpoints());
            log.info("MetadataStore initialized successfully");
            return store;
        } catch (Exception e) {
            log.error("Failed to initialize MetadataStore: {}", e.getMessage(), e);
            throw new RuntimeException("MetadataStore initialization failed", e);
        }
    }

    /**
     * Hypervisor access. Only the simulated driver ships with the orchestrator; a deployment
     * talking to real hosts provides its own HypervisorDriver bean in place of this one.
     */
    @Bean
    public HypervisorDriver hypervisorDriver() {
        log.info("Initializing SimulatedHypervisorDriver");
        return new SimulatedHypervisorDriver();
    }

    @Bean
    public ResourceLedger resourceLedger(MetadataStore metadataStore, OrchestratorConfig config,
                                         MetricsProvider metricsProvider) {
        log.info("Initializing ResourceLedger for node pool '{}'", config.getClusterName());
        return new ResourceLedger(metadataStore, config.getClusterName(), DEFAULT_RELEASE_RETRIES, metricsProvider);
    }

    @Bean(destroyMethod = "stop")
    public HealthMonitor healthMonitor(MetadataStore metadataStore, OrchestratorConfig config,
                                       HypervisorDriver hypervisorDriver, ResourceLedger resourceLedger,
                                       MetricsProvider metricsProvider) {
        log.info("Initializing HealthMonitor for node pool '{}'", config.getClusterName());
        HealthMonitor healthMonitor = new HealthMonitor(
            metadataStore,
            config.getClusterName(),
            new HypervisorHealthProbe(hypervisorDriver),
            resourceLedger,
            metricsProvider,
            config.getProbeIntervalSeconds(),
            config.getProbeTimeoutSeconds(),
            config.getHealthFailureThreshold()
        );
        healthMonitor.start();
        return healthMonitor;
    }

    @Bean
    public ClusterHealthManager clusterHealthManager(MetadataStore metadataStore, OrchestratorConfig config,
                                                     HealthMonitor healthMonitor, ResourceLedger resourceLedger) {
        return new ClusterHealthManager(metadataStore, config.getClusterName(), healthMonitor, resourceLedger);
    }

    @Bean
    public PlacementEngine placementEngine(MetadataStore metadataStore, OrchestratorConfig config,
                                           ResourceLedger resourceLedger, HealthMonitor healthMonitor,
                                           MetricsProvider metricsProvider) {
        log.info("Initializing PlacementEngine with default strategy {}", config.getDefaultStrategy().getValue());
        return new PlacementEngine(metadataStore, config.getClusterName(), resourceLedger, healthMonitor,
            metricsProvider, config.getDefaultStrategy(), config.getMaxReservationRetries());
    }

    @Bean(destroyMethod = "shutdown")
    public MigrationOrchestrator migrationOrchestrator(MetadataStore metadataStore, OrchestratorConfig config,
                                                       ResourceLedger resourceLedger, HealthMonitor healthMonitor,
                                                       HypervisorDriver hypervisorDriver, MetricsProvider metricsProvider) {
        log.info("Initializing MigrationOrchestrator: {} concurrent migrations on {} workers",
            config.getMaxConcurrentMigrations(), config.getMigrationWorkerThreads());
        return new MigrationOrchestrator(metadataStore, config.getClusterName(), resourceLedger, healthMonitor,
            hypervisorDriver, metricsProvider, config);
    }

    @Bean
    public ClusterManager clusterManager(MetadataStore metadataStore, OrchestratorConfig config,
                                         PlacementEngine placementEngine, MigrationOrchestrator migrationOrchestrator,
                                         HealthMonitor healthMonitor) {
        return new ClusterManager(metadataStore, config.getClusterName(), placementEngine, migrationOrchestrator,
            healthMonitor, config.getRebalanceMinImprovement(), config.getRebalanceMaxMoves());
    }

    @Bean
    public ComputeOrchestrator computeOrchestrator(MetadataStore metadataStore, OrchestratorConfig config,
                                                   ResourceLedger resourceLedger, PlacementEngine placementEngine,
                                                   HealthMonitor healthMonitor, ClusterHealthManager clusterHealthManager,
                                                   MigrationOrchestrator migrationOrchestrator,
                                                   ClusterManager clusterManager) {
        log.info("Initializing ComputeOrchestrator for node pool '{}'", config.getClusterName());
        return new ComputeOrchestrator(metadataStore, config.getClusterName(), resourceLedger, placementEngine,
            healthMonitor, clusterHealthManager, migrationOrchestrator, clusterManager);
    }
}
