package io.topologycache.store;

import io.topologycache.models.NodeResourceTopology;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the published node topology snapshots.
 * The cache never writes snapshots back.
 */
public interface NodeTopologyClient {

    /**
     * Get all published node topology snapshots
     */
    List<NodeResourceTopology> listNodeTopologies() throws Exception;

    /**
     * Get the published snapshot of a node
     */
    Optional<NodeResourceTopology> getNodeTopology(String nodeName) throws Exception;
}
