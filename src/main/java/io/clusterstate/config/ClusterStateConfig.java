package io.clusterstate.config;

import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.introspector.PropertyUtils;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;

import static io.clusterstate.config.Constants.*;

/**
 * Configuration for the cluster state aggregator.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class ClusterStateConfig {

    private final String aggregatorId;
    private final long commitIntervalSeconds;
    private final long warnOnSlowPingTimeMicros;
    private final double warnOnSlowPingRatio;
    private final long heartbeatGraceSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "CLUSTER_STATE_CONFIG_FILE";

    public ClusterStateConfig() {
        this(System.getenv(EXTERNAL_CONFIG_ENV_VAR), DEFAULT_CONFIG_FILE_CLASSPATH);
    }

    ClusterStateConfig(String externalConfigPath, String classpathResource) {
        this(loadYamlConfig(externalConfigPath, classpathResource));
    }

    public ClusterStateConfig(ConfigModel config) {
        this.aggregatorId = parseAggregatorId(config);
        this.commitIntervalSeconds = parseCommitIntervalSeconds(config);
        this.warnOnSlowPingTimeMicros = parseWarnOnSlowPingTime(config);
        this.warnOnSlowPingRatio = parseWarnOnSlowPingRatio(config);
        this.heartbeatGraceSeconds = parseHeartbeatGraceSeconds(config);

        log.info("Loaded cluster state config - id: {}, commit interval: {}s, slow ping: {}us, ratio: {}, grace: {}s",
                aggregatorId, commitIntervalSeconds, warnOnSlowPingTimeMicros, warnOnSlowPingRatio, heartbeatGraceSeconds);
    }

    private static ConfigModel loadYamlConfig(String externalConfigPath, String classpathResource) {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // application.yml also carries Spring keys (server, management) this model does not map
        PropertyUtils propertyUtils = new PropertyUtils();
        propertyUtils.setSkipMissingProperties(true);
        constructor.setPropertyUtils(propertyUtils);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check for an external config file path
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
            log.info("Loading config from classpath: {}", classpathResource);
            inputStream = ClusterStateConfig.class.getClassLoader().getResourceAsStream(classpathResource);
            loadedFrom = "classpath (" + classpathResource + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", classpathResource);
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

    private String parseAggregatorId(ConfigModel config) {
        if (config.getAggregator() != null && config.getAggregator().getId() != null
                && !config.getAggregator().getId().isBlank()) {
            return config.getAggregator().getId();
        }
        return DEFAULT_AGGREGATOR_ID;
    }

    private long parseCommitIntervalSeconds(ConfigModel config) {
        if (config.getCommit() != null && config.getCommit().getIntervalSeconds() != null) {
            long interval = config.getCommit().getIntervalSeconds();
            if (interval > 0) {
                return interval;
            }
            log.warn("Ignoring non-positive commit interval {}s, using default", interval);
        }
        return DEFAULT_COMMIT_INTERVAL_SECONDS;
    }

    private long parseWarnOnSlowPingTime(ConfigModel config) {
        if (config.getDiagnostics() != null && config.getDiagnostics().getWarnOnSlowPingTimeMicros() != null) {
            return config.getDiagnostics().getWarnOnSlowPingTimeMicros();
        }
        return DEFAULT_WARN_ON_SLOW_PING_TIME_MICROS;
    }

    private double parseWarnOnSlowPingRatio(ConfigModel config) {
        if (config.getDiagnostics() != null && config.getDiagnostics().getWarnOnSlowPingRatio() != null) {
            return config.getDiagnostics().getWarnOnSlowPingRatio();
        }
        return DEFAULT_WARN_ON_SLOW_PING_RATIO;
    }

    private long parseHeartbeatGraceSeconds(ConfigModel config) {
        if (config.getDiagnostics() != null && config.getDiagnostics().getHeartbeatGraceSeconds() != null) {
            return config.getDiagnostics().getHeartbeatGraceSeconds();
        }
        return DEFAULT_HEARTBEAT_GRACE_SECONDS;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Aggregator aggregator;
        private Commit commit;
        private Diagnostics diagnostics;
    }

    @Data
    public static class Aggregator {
        private String id;
    }

    @Data
    public static class Commit {
        private Long intervalSeconds;
    }

    @Data
    public static class Diagnostics {
        private Long warnOnSlowPingTimeMicros;
        private Double warnOnSlowPingRatio;
        private Long heartbeatGraceSeconds;
    }
}
