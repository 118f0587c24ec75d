package io.clusterstate;

import io.clusterstate.config.ClusterStateConfig;
import io.clusterstate.diagnostics.AdminCommandDispatcher;
import io.clusterstate.diagnostics.DiagnosticsQueryEngine;
import io.clusterstate.ingest.IngestionEngine;
import io.clusterstate.metrics.MetricsProvider;
import io.clusterstate.state.ClusterStateStore;
import io.clusterstate.topology.TopologySyncEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Primary;

/**
 * Spring Boot application hosting the cluster state aggregator.
 *
 * The aggregator merges node status reports and topology snapshots into one
 * versioned cluster map and serves diagnostics over it. Report transport and
 * topology publishing are wired in by the embedding daemon through the
 * {@link IngestionEngine} and {@link TopologySyncEngine} beans.
 */
@Slf4j
@SpringBootApplication
@ComponentScan(basePackages = "io.clusterstate")
public class ClusterStateApplication {

    public static void main(String[] args) {
        log.info("Starting Cluster State Aggregator");

        try {
            SpringApplication.run(ClusterStateApplication.class, args);
            log.info("Cluster State Aggregator started successfully");
        } catch (Exception e) {
            log.error("Failed to start Cluster State Aggregator: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    @Bean
    @Primary
    public ClusterStateConfig config() {
        ClusterStateConfig config = new ClusterStateConfig();
        log.info("Loaded configuration");
        return config;
    }

    @Bean
    public ClusterStateStore clusterStateStore(MetricsProvider metricsProvider) {
        log.info("Initializing ClusterStateStore");
        return new ClusterStateStore(metricsProvider);
    }

    @Bean
    public IngestionEngine ingestionEngine(ClusterStateStore store, MetricsProvider metricsProvider) {
        log.info("Initializing IngestionEngine");
        return new IngestionEngine(store, metricsProvider);
    }

    @Bean
    public TopologySyncEngine topologySyncEngine(ClusterStateStore store, MetricsProvider metricsProvider) {
        log.info("Initializing TopologySyncEngine");
        return new TopologySyncEngine(store, metricsProvider);
    }

    @Bean
    public DiagnosticsQueryEngine diagnosticsQueryEngine(ClusterStateStore store, ClusterStateConfig config) {
        log.info("Initializing DiagnosticsQueryEngine");
        return new DiagnosticsQueryEngine(store, config);
    }

    @Bean(destroyMethod = "unregisterCommands")
    public AdminCommandDispatcher adminCommandDispatcher(DiagnosticsQueryEngine queryEngine) {
        AdminCommandDispatcher dispatcher = new AdminCommandDispatcher(queryEngine);
        dispatcher.registerCommands();
        return dispatcher;
    }

    @Bean(destroyMethod = "stop")
    public PeriodicCommitter periodicCommitter(ClusterStateStore store, ClusterStateConfig config) {
        PeriodicCommitter committer = new PeriodicCommitter(store, config.getCommitIntervalSeconds());
        committer.start();
        log.info("PeriodicCommitter started with interval {}s", config.getCommitIntervalSeconds());
        return committer;
    }
}
