package io.computeorchestrator.config;

import io.computeorchestrator.enums.MigrationState;
import io.computeorchestrator.enums.PlacementStrategyType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class OrchestratorConfigTest {

    @Test
    void testEmptyModelUsesDefaults() {
        OrchestratorConfig config = new OrchestratorConfig(new OrchestratorConfig.ConfigModel());

        assertThat(config.getClusterName()).isEqualTo(Constants.DEFAULT_CLUSTER_NAME);
        assertThat(config.getStoreType()).isEqualTo(Constants.STORE_TYPE_ETCD);
        assertThat(config.getEtcdEndpoints()).containsExactly(Constants.DEFAULT_ETCD_ENDPOINT);
        assertThat(config.getProbeIntervalSeconds()).isEqualTo(30L);
        assertThat(config.getHealthFailureThreshold()).isEqualTo(3);
        assertThat(config.getDefaultStrategy()).isEqualTo(PlacementStrategyType.BALANCED);
        assertThat(config.getMaxConcurrentMigrations()).isEqualTo(2);
        assertThat(config.getStageTimeout(MigrationState.COPYING_DISK)).isEqualTo(Duration.ofSeconds(600));
        assertThat(config.getRebalanceMaxMoves()).isEqualTo(10);
    }

    @Test
    void testOverrides() {
        OrchestratorConfig.ConfigModel model = new OrchestratorConfig.ConfigModel();
        OrchestratorConfig.Cluster cluster = new OrchestratorConfig.Cluster();
        cluster.setName("  rack-7 ");
        model.setCluster(cluster);
        OrchestratorConfig.Store store = new OrchestratorConfig.Store();
        store.setType("MEMORY");
        model.setStore(store);
        OrchestratorConfig.Etcd etcd = new OrchestratorConfig.Etcd();
        etcd.setEndpoints(List.of("http://etcd-1:2379", "http://etcd-2:2379"));
        model.setEtcd(etcd);
        OrchestratorConfig.Placement placement = new OrchestratorConfig.Placement();
        placement.setDefault_strategy("Spread");
        model.setPlacement(placement);
        OrchestratorConfig.Migration migration = new OrchestratorConfig.Migration();
        migration.setMax_concurrent(5);
        migration.setStage_timeout_seconds(120L);
        migration.setStage_timeouts(Map.of("copying_disk", 900L, "no_such_stage", 5L));
        model.setMigration(migration);

        OrchestratorConfig config = new OrchestratorConfig(model);

        assertThat(config.getClusterName()).isEqualTo("rack-7");
        assertThat(config.getStoreType()).isEqualTo(Constants.STORE_TYPE_MEMORY);
        assertThat(config.getEtcdEndpoints()).containsExactly("http://etcd-1:2379", "http://etcd-2:2379");
        assertThat(config.getDefaultStrategy()).isEqualTo(PlacementStrategyType.SPREAD);
        assertThat(config.getMaxConcurrentMigrations()).isEqualTo(5);
        assertThat(config.getStageTimeout(MigrationState.COPYING_DISK)).isEqualTo(Duration.ofSeconds(900));
        assertThat(config.getStageTimeout(MigrationState.SWITCHOVER)).isEqualTo(Duration.ofSeconds(120));
        assertThat(config.getStageTimeoutOverrides()).containsOnlyKeys(MigrationState.COPYING_DISK);
    }

    @Test
    void testInvalidValuesFallBackToDefaults() {
        OrchestratorConfig.ConfigModel model = new OrchestratorConfig.ConfigModel();
        OrchestratorConfig.Health health = new OrchestratorConfig.Health();
        health.setProbe_interval_seconds(0L);
        health.setFailure_threshold(-2);
        model.setHealth(health);
        OrchestratorConfig.Store store = new OrchestratorConfig.Store();
        store.setType("zookeeper");
        model.setStore(store);
        OrchestratorConfig.Placement placement = new OrchestratorConfig.Placement();
        placement.setDefault_strategy("random");
        model.setPlacement(placement);
        OrchestratorConfig.Rebalance rebalance = new OrchestratorConfig.Rebalance();
        rebalance.setMin_improvement(-1.0);
        model.setRebalance(rebalance);

        OrchestratorConfig config = new OrchestratorConfig(model);

        assertThat(config.getProbeIntervalSeconds()).isEqualTo(Constants.DEFAULT_PROBE_INTERVAL_SECONDS);
        assertThat(config.getHealthFailureThreshold()).isEqualTo(Constants.DEFAULT_HEALTH_FAILURE_THRESHOLD);
        assertThat(config.getStoreType()).isEqualTo(Constants.DEFAULT_STORE_TYPE);
        assertThat(config.getDefaultStrategy()).isEqualTo(PlacementStrategyType.BALANCED);
        assertThat(config.getRebalanceMinImprovement()).isEqualTo(Constants.DEFAULT_REBALANCE_MIN_IMPROVEMENT);
    }

    @Test
    void testLoadsApplicationYamlFromClasspath() {
        OrchestratorConfig config = new OrchestratorConfig();

        assertThat(config.getClusterName()).isEqualTo("default-pool");
        assertThat(config.getProbeTimeoutSeconds()).isEqualTo(10L);
        assertThat(config.getStageTimeout(MigrationState.COPYING_DISK)).isEqualTo(Duration.ofSeconds(3600));
        assertThat(config.getStageTimeout(MigrationState.STREAMING_STATE)).isEqualTo(Duration.ofSeconds(1800));
    }
}
