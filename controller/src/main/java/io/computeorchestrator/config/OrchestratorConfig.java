package io.computeorchestrator.config;

import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.enums.PlacementStrategyType;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static io.computeorchestrator.config.Constants.*;

/**
 * Configuration for the compute orchestrator.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class OrchestratorConfig {

    private final String clusterName;
    private final String storeType;
    private final String[] etcdEndpoints;
    private final long probeIntervalSeconds;
    private final long probeTimeoutSeconds;
    private final int healthFailureThreshold;
    private final PlacementStrategyType defaultStrategy;
    private final int maxReservationRetries;
    private final int maxConcurrentMigrations;
    private final int migrationWorkerThreads;
    private final long stageTimeoutSeconds;
    private final Map<MigrationState, Long> stageTimeoutOverrides;
    private final double rebalanceMinImprovement;
    private final int rebalanceMaxMoves;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "ORCHESTRATOR_CONFIG_FILE";

    public OrchestratorConfig() {
        this(null);
    }

    /**
     * Builds the configuration from an already parsed model. A null model means "load application.yml".
     */
    public OrchestratorConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();

        this.clusterName = parseClusterName(config);
        this.storeType = parseStoreType(config);
        this.etcdEndpoints = parseEndpoints(config);
        this.probeIntervalSeconds = positiveOrDefault(
            config.getHealth() != null ? config.getHealth().getProbe_interval_seconds() : null,
            DEFAULT_PROBE_INTERVAL_SECONDS, "health.probe_interval_seconds");
        this.probeTimeoutSeconds = positiveOrDefault(
            config.getHealth() != null ? config.getHealth().getProbe_timeout_seconds() : null,
            DEFAULT_PROBE_TIMEOUT_SECONDS, "health.probe_timeout_seconds");
        this.healthFailureThreshold = (int) positiveOrDefault(
            config.getHealth() != null ? toLong(config.getHealth().getFailure_threshold()) : null,
            DEFAULT_HEALTH_FAILURE_THRESHOLD, "health.failure_threshold");
        this.defaultStrategy = parseDefaultStrategy(config);
        this.maxReservationRetries = (int) positiveOrDefault(
            config.getPlacement() != null ? toLong(config.getPlacement().getMax_reservation_retries()) : null,
            DEFAULT_MAX_RESERVATION_RETRIES, "placement.max_reservation_retries");
        this.maxConcurrentMigrations = (int) positiveOrDefault(
            config.getMigration() != null ? toLong(config.getMigration().getMax_concurrent()) : null,
            DEFAULT_MAX_CONCURRENT_MIGRATIONS, "migration.max_concurrent");
        this.migrationWorkerThreads = (int) positiveOrDefault(
            config.getMigration() != null ? toLong(config.getMigration().getWorker_threads()) : null,
            DEFAULT_MIGRATION_WORKER_THREADS, "migration.worker_threads");
        this.stageTimeoutSeconds = positiveOrDefault(
            config.getMigration() != null ? config.getMigration().getStage_timeout_seconds() : null,
            DEFAULT_STAGE_TIMEOUT_SECONDS, "migration.stage_timeout_seconds");
        this.stageTimeoutOverrides = parseStageTimeouts(config);
        this.rebalanceMinImprovement = parseMinImprovement(config);
        this.rebalanceMaxMoves = (int) positiveOrDefault(
            config.getRebalance() != null ? toLong(config.getRebalance().getMax_moves()) : null,
            DEFAULT_REBALANCE_MAX_MOVES, "rebalance.max_moves");

        log.info("Loaded orchestrator config - cluster: {}, store: {}, etcd endpoints: {}, probe interval: {}s, "
                + "failure threshold: {}, max concurrent migrations: {}",
            clusterName, storeType, String.join(", ", etcdEndpoints), probeIntervalSeconds,
            healthFailureThreshold, maxConcurrentMigrations);
    }

    /**
     * Timeout for one migration stage, falling back to the global stage timeout.
     */
    public Duration getStageTimeout(MigrationState stage) {
        Long override = stageTimeoutOverrides.get(stage);
        return Duration.ofSeconds(override != null ? override : stageTimeoutSeconds);
    }

    private ConfigModel loadYamlConfig() {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", EXTERNAL_CONFIG_ENV_VAR, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", EXTERNAL_CONFIG_ENV_VAR);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try {
            ConfigModel config = yaml.load(inputStream);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        } finally {
            try {
                inputStream.close();
            } catch (IOException e) {
                log.error("Error closing config file input stream: {}", e.getMessage());
            }
        }
    }

    private String parseClusterName(ConfigModel config) {
        if (config.getCluster() != null && config.getCluster().getName() != null
                && !config.getCluster().getName().isBlank()) {
            return config.getCluster().getName().trim();
        }
        return DEFAULT_CLUSTER_NAME;
    }

    private String parseStoreType(ConfigModel config) {
        if (config.getStore() != null && config.getStore().getType() != null) {
            String type = config.getStore().getType().trim().toLowerCase();
            if (STORE_TYPE_ETCD.equals(type) || STORE_TYPE_MEMORY.equals(type)) {
                return type;
            }
            log.warn("Unknown store type '{}', using default '{}'", type, DEFAULT_STORE_TYPE);
        }
        return DEFAULT_STORE_TYPE;
    }

    private String[] parseEndpoints(ConfigModel config) {
        try {
            if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
                var endpoints = config.getEtcd().getEndpoints();
                if (!endpoints.isEmpty()) {
                    return endpoints.toArray(new String[0]);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to parse etcd endpoints from config, using defaults: {}", e.getMessage());
        }

        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private PlacementStrategyType parseDefaultStrategy(ConfigModel config) {
        String configured = config.getPlacement() != null ? config.getPlacement().getDefault_strategy() : null;
        PlacementStrategyType type = PlacementStrategyType.fromString(configured);
        if (type == null) {
            if (configured != null) {
                log.warn("Unknown placement strategy '{}', using '{}'", configured, DEFAULT_PLACEMENT_STRATEGY);
            }
            return PlacementStrategyType.fromString(DEFAULT_PLACEMENT_STRATEGY);
        }
        return type;
    }

    private Map<MigrationState, Long> parseStageTimeouts(ConfigModel config) {
        Map<MigrationState, Long> overrides = new EnumMap<>(MigrationState.class);
        if (config.getMigration() == null || config.getMigration().getStage_timeouts() == null) {
            return overrides;
        }
        config.getMigration().getStage_timeouts().forEach((stage, seconds) -> {
            try {
                MigrationState state = MigrationState.valueOf(stage.trim().toUpperCase());
                if (seconds != null && seconds > 0) {
                    overrides.put(state, seconds);
                }
            } catch (IllegalArgumentException e) {
                log.warn("Ignoring timeout for unknown migration stage '{}'", stage);
            }
        });
        return overrides;
    }

    private double parseMinImprovement(ConfigModel config) {
        if (config.getRebalance() != null && config.getRebalance().getMin_improvement() != null) {
            double value = config.getRebalance().getMin_improvement();
            if (value >= 0) {
                return value;
            }
            log.warn("rebalance.min_improvement must not be negative, using default {}", DEFAULT_REBALANCE_MIN_IMPROVEMENT);
        }
        return DEFAULT_REBALANCE_MIN_IMPROVEMENT;
    }

    private long positiveOrDefault(Long value, long defaultValue, String key) {
        if (value == null) {
            return defaultValue;
        }
        if (value <= 0) {
            log.warn("{} must be positive, got {}; using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static Long toLong(Integer value) {
        return value != null ? value.longValue() : null;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Cluster cluster;
        private Store store;
        private Etcd etcd;
        private Health health;
        private Placement placement;
        private Migration migration;
        private Rebalance rebalance;
        private Controller controller; // read by Spring @Value
        private Map<String, Object> server;
        private Map<String, Object> logging;
        private Map<String, Object> management;
        private Map<String, Object> spring;
    }

    @Data
    public static class Cluster {
        private String name;
    }

    @Data
    public static class Store {
        private String type;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Health {
        private Long probe_interval_seconds;
        private Long probe_timeout_seconds;
        private Integer failure_threshold;
    }

    @Data
    public static class Placement {
        private String default_strategy;
        private Integer max_reservation_retries;
    }

    @Data
    public static class Migration {
        private Integer max_concurrent;
        private Integer worker_threads;
        private Long stage_timeout_seconds;
        private Map<String, Long> stage_timeouts;
    }

    @Data
    public static class Rebalance {
        private Double min_improvement;
        private Integer max_moves;
    }

    @Data
    public static class Controller {
        private String id;
    }
}
