package io.topologycache.config;

/**
 * Application constants.
 */
public final class Constants {

    private Constants() {
        // Utility class
    }

    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_CLUSTER_NAME = "default-cluster";
    public static final long DEFAULT_RESYNC_PERIOD_SECONDS = 5L;
    public static final String DEFAULT_SCHEDULER_PROFILE = "topology-aware-scheduler";

    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_NODE_TOPOLOGY = "node-topology";
    public static final String PATH_PODS = "pods";

    // Resource names
    public static final String RESOURCE_CPU = "cpu";
    public static final String RESOURCE_MEMORY = "memory";
    public static final String RESOURCE_HUGEPAGES_PREFIX = "hugepages-";
    public static final String NATIVE_RESOURCE_DOMAIN = "kubernetes.io/";
    public static final long MILLICORES_PER_CPU = 1000L;
}
