package io.topologycache.metrics;

/**
 * Constants for metrics names and tags used by the topology cache.
 */
public class MetricsConstants {
    public final static String RESYNC_DURATION_METRIC_NAME = "topology_cache_resync_duration";
    public final static String RESYNC_ABORTED_METRIC_NAME = "topology_cache_resync_aborted";
    public final static String FLUSHED_NODES_METRIC_NAME = "topology_cache_flushed_nodes";
    public final static String DIRTY_NODES_METRIC_NAME = "topology_cache_dirty_nodes";
    public final static String CLUSTER_NAME_TAG = "clusterName";

    private MetricsConstants() {}
}
