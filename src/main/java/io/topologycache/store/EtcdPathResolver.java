package io.topologycache.store;

import java.nio.file.Paths;

import static io.topologycache.config.Constants.*;

/**
 * Centralized etcd path resolver for node topology snapshots and pods.
 * Stateless singleton.
 */
public class EtcdPathResolver {

    private static final EtcdPathResolver INSTANCE = new EtcdPathResolver();

    private EtcdPathResolver() {
        // Private constructor for singleton
    }

    public static EtcdPathResolver getInstance() {
        return INSTANCE;
    }

    // =================================================================
    // NODE TOPOLOGY PATHS
    // =================================================================

    /**
     * Get prefix for all node topology snapshots
     * Pattern: /<cluster-name>/node-topology
     */
    public String getNodeTopologyPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_NODE_TOPOLOGY).toString();
    }

    /**
     * Get path for the snapshot of a node
     * Pattern: /<cluster-name>/node-topology/<node-name>
     */
    public String getNodeTopologyPath(String clusterName, String nodeName) {
        return Paths.get(getNodeTopologyPrefix(clusterName), nodeName).toString();
    }

    // =================================================================
    // POD PATHS
    // =================================================================

    /**
     * Get prefix for all pods
     * Pattern: /<cluster-name>/pods
     */
    public String getPodsPrefix(String clusterName) {
        return Paths.get(PATH_DELIMITER, clusterName, PATH_PODS).toString();
    }

    /**
     * Get path for a pod
     * Pattern: /<cluster-name>/pods/<namespace>/<pod-name>
     */
    public String getPodPath(String clusterName, String namespace, String podName) {
        return Paths.get(getPodsPrefix(clusterName), namespace, podName).toString();
    }
}
