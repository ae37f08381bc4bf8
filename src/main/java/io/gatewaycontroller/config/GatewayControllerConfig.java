package io.gatewaycontroller.config;

import io.gatewaycontroller.enums.AbsentClusterPolicy;
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
import java.util.List;

import static io.gatewaycontroller.config.Constants.*;

/**
 * Configuration for the gateway status controller.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * Spring reads the same file for its own keys (server, management, controller.id);
 * unknown keys are skipped here.
 */
@Slf4j
@Getter
public class GatewayControllerConfig {

    private final String[] etcdEndpoints;
    private final String gatewayRootPath;
    private final Duration resyncPeriod;
    private final AbsentClusterPolicy absentClusterPolicy;
    private final Duration queueBaseDelay;
    private final Duration queueMaxDelay;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // Environment variable to check for external config file path
    private static final String EXTERNAL_CONFIG_ENV_VAR = "GATEWAY_CONTROLLER_CONFIG_FILE";

    public GatewayControllerConfig() {
        this(null);
    }

    /**
     * Build from an already parsed model; a null model loads application.yml.
     */
    public GatewayControllerConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();

        this.etcdEndpoints = parseEndpoints(config);
        this.gatewayRootPath = parseGatewayRootPath(config);
        this.resyncPeriod = parseResyncPeriod(config);
        this.absentClusterPolicy = parseAbsentClusterPolicy(config);
        this.queueBaseDelay = parseQueueBaseDelay(config);
        this.queueMaxDelay = parseQueueMaxDelay(config);

        log.info("Loaded gateway controller config - etcd endpoints: {}, gateway root: {}, resync: {}s, absent cluster policy: {}",
                String.join(", ", etcdEndpoints), gatewayRootPath, resyncPeriod.toSeconds(), absentClusterPolicy);
    }

    /**
     * Parse a configuration model from YAML, ignoring keys this class does not know.
     */
    public static ConfigModel parse(InputStream inputStream) {
        LoaderOptions loaderOptions = new LoaderOptions();
        Constructor constructor = new Constructor(ConfigModel.class, loaderOptions);
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        ConfigModel config = new Yaml(constructor).load(inputStream);
        return config != null ? config : new ConfigModel();
    }

    private ConfigModel loadYamlConfig() {
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
        try (InputStream in = inputStream) {
            ConfigModel config = parse(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config;
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null
                && !config.getEtcd().getEndpoints().isEmpty()) {
            return config.getEtcd().getEndpoints().toArray(new String[0]);
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private String parseGatewayRootPath(ConfigModel config) {
        if (config.getGateway() != null && config.getGateway().getRootPath() != null
                && !config.getGateway().getRootPath().isBlank()) {
            return config.getGateway().getRootPath().trim();
        }
        return DEFAULT_GATEWAY_ROOT_PATH;
    }

    private Duration parseResyncPeriod(ConfigModel config) {
        if (config.getGateway() != null && config.getGateway().getResyncSeconds() != null) {
            long seconds = config.getGateway().getResyncSeconds();
            if (seconds >= 0) {
                return Duration.ofSeconds(seconds);
            }
            log.warn("Negative gateway resync interval {}s, disabling resync", seconds);
        }
        return Duration.ofSeconds(DEFAULT_RESYNC_SECONDS);
    }

    private AbsentClusterPolicy parseAbsentClusterPolicy(ConfigModel config) {
        try {
            if (config.getGateway() != null && config.getGateway().getAbsentClusterPolicy() != null) {
                return AbsentClusterPolicy.fromString(config.getGateway().getAbsentClusterPolicy());
            }
        } catch (IllegalArgumentException e) {
            log.warn("Failed to parse absent cluster policy, using default RETAIN: {}", e.getMessage());
        }
        return AbsentClusterPolicy.RETAIN;
    }

    private Duration parseQueueBaseDelay(ConfigModel config) {
        if (config.getQueue() != null && config.getQueue().getBaseDelayMillis() != null
                && config.getQueue().getBaseDelayMillis() > 0) {
            return Duration.ofMillis(config.getQueue().getBaseDelayMillis());
        }
        return Duration.ofMillis(DEFAULT_QUEUE_BASE_DELAY_MILLIS);
    }

    private Duration parseQueueMaxDelay(ConfigModel config) {
        if (config.getQueue() != null && config.getQueue().getMaxDelaySeconds() != null
                && config.getQueue().getMaxDelaySeconds() > 0) {
            return Duration.ofSeconds(config.getQueue().getMaxDelaySeconds());
        }
        return Duration.ofSeconds(DEFAULT_QUEUE_MAX_DELAY_SECONDS);
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Gateway gateway;
        private Queue queue;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Gateway {
        private String rootPath;
        private Long resyncSeconds;
        private String absentClusterPolicy;
    }

    @Data
    public static class Queue {
        private Long baseDelayMillis;
        private Long maxDelaySeconds;
    }
}
