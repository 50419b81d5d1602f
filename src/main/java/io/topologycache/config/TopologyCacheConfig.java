package io.topologycache.config;

import io.topologycache.enums.CacheInformerMode;
import io.topologycache.enums.CacheResyncMethod;
import io.topologycache.enums.ForeignPodsDetectMode;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static io.topologycache.config.Constants.*;

/**
 * Configuration for the node topology cache.
 * Loads configuration from application.yml with fallbacks to constants.
 * <p>
 * The resync method is read once when the cache is built; changing it requires a restart.
 */
@Slf4j
@Getter
public class TopologyCacheConfig {

    private final String[] etcdEndpoints;
    private final String clusterName;
    private final CacheResyncMethod resyncMethod; // null when not configured
    private final CacheInformerMode informerMode;
    private final ForeignPodsDetectMode foreignPodsDetect;
    private final long resyncPeriodSeconds;
    private final List<String> schedulerProfiles;

    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";
    // path of a config file taking precedence over the classpath one
    private static final String EXTERNAL_CONFIG_ENV_VAR = "TOPOLOGY_CACHE_CONFIG_FILE";

    public TopologyCacheConfig() {
        this(loadYamlConfig());
    }

    public TopologyCacheConfig(ConfigModel config) {
        if (config == null) {
            config = new ConfigModel();
        }
        this.etcdEndpoints = parseEndpoints(config);
        this.clusterName = parseClusterName(config);
        this.resyncMethod = parseResyncMethod(config);
        this.informerMode = parseInformerMode(config);
        this.foreignPodsDetect = parseForeignPodsDetect(config);
        this.resyncPeriodSeconds = parseResyncPeriodSeconds(config);
        this.schedulerProfiles = parseSchedulerProfiles(config);

        log.info("Loaded topology cache config - etcd endpoints: {}, cluster: {}, resync method: {}, informer mode: {}, resync period: {}s",
                String.join(", ", etcdEndpoints), clusterName, resyncMethod, informerMode, resyncPeriodSeconds);
    }

    private static ConfigModel loadYamlConfig() {
        String externalConfigPath = System.getenv(EXTERNAL_CONFIG_ENV_VAR);
        if (externalConfigPath != null && !externalConfigPath.isBlank()) {
            Path path = Paths.get(externalConfigPath);
            if (Files.isReadable(path)) {
                return loadYamlConfig(path);
            }
            log.warn("{} points to {} which cannot be read, using classpath config", EXTERNAL_CONFIG_ENV_VAR, path);
        }

        try (InputStream in = TopologyCacheConfig.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH)) {
            if (in == null) {
                log.warn("No {} on classpath, using defaults", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
            return parseYaml(in, "classpath:" + DEFAULT_CONFIG_FILE_CLASSPATH);
        } catch (IOException e) {
            log.warn("Cannot read {} from classpath: {}, using defaults", DEFAULT_CONFIG_FILE_CLASSPATH, e.getMessage());
            return new ConfigModel();
        }
    }

    /**
     * Reads the model from a YAML file; an unreadable or unparsable file yields an empty model.
     */
    static ConfigModel loadYamlConfig(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return parseYaml(in, path.toString());
        } catch (IOException e) {
            log.warn("Cannot read config file {}: {}, using defaults", path, e.getMessage());
            return new ConfigModel();
        }
    }

    private static ConfigModel parseYaml(InputStream in, String source) {
        Yaml yaml = new Yaml(new Constructor(ConfigModel.class, new LoaderOptions()));
        try {
            ConfigModel config = yaml.load(in);
            log.info("Loaded topology cache config from {}", source);
            return config != null ? config : new ConfigModel();
        } catch (YAMLException e) {
            log.warn("Cannot parse config from {}: {}, using defaults", source, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            var endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private String parseClusterName(ConfigModel config) {
        if (config.getCluster() != null && config.getCluster().getName() != null
                && !config.getCluster().getName().isBlank()) {
            return config.getCluster().getName();
        }
        return DEFAULT_CLUSTER_NAME;
    }

    private CacheResyncMethod parseResyncMethod(ConfigModel config) {
        if (config.getCache() == null || config.getCache().getResyncMethod() == null) {
            return null;
        }
        CacheResyncMethod method = CacheResyncMethod.fromString(config.getCache().getResyncMethod());
        if (method == null) {
            log.warn("Unknown cache resync method '{}', leaving it unset", config.getCache().getResyncMethod());
        }
        return method;
    }

    private CacheInformerMode parseInformerMode(ConfigModel config) {
        if (config.getCache() != null && config.getCache().getInformerMode() != null) {
            CacheInformerMode mode = CacheInformerMode.fromString(config.getCache().getInformerMode());
            if (mode != null) {
                return mode;
            }
            log.warn("Unknown cache informer mode '{}', using default", config.getCache().getInformerMode());
        }
        return CacheInformerMode.DEDICATED;
    }

    private ForeignPodsDetectMode parseForeignPodsDetect(ConfigModel config) {
        if (config.getCache() != null && config.getCache().getForeignPodsDetect() != null) {
            ForeignPodsDetectMode mode = ForeignPodsDetectMode.fromString(config.getCache().getForeignPodsDetect());
            if (mode != null) {
                return mode;
            }
            log.warn("Unknown foreign pods detect mode '{}', using default", config.getCache().getForeignPodsDetect());
        }
        return ForeignPodsDetectMode.ALL;
    }

    private long parseResyncPeriodSeconds(ConfigModel config) {
        if (config.getCache() != null && config.getCache().getResyncPeriodSeconds() != null) {
            long value = config.getCache().getResyncPeriodSeconds();
            if (value >= 0) {
                return value;
            }
            log.warn("Negative resync period {}s, using default", value);
        }
        return DEFAULT_RESYNC_PERIOD_SECONDS;
    }

    private List<String> parseSchedulerProfiles(ConfigModel config) {
        if (config.getCache() != null && config.getCache().getSchedulerProfiles() != null
                && !config.getCache().getSchedulerProfiles().isEmpty()) {
            return List.copyOf(config.getCache().getSchedulerProfiles());
        }
        return List.of(DEFAULT_SCHEDULER_PROFILE);
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private Cluster cluster;
        private Cache cache;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class Cluster {
        private String name;
    }

    @Data
    public static class Cache {
        private String resyncMethod;
        private String informerMode;
        private String foreignPodsDetect;
        private Long resyncPeriodSeconds;
        private List<String> schedulerProfiles;
    }
}
