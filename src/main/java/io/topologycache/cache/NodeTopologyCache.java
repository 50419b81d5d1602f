package io.topologycache.cache;

import io.topologycache.models.CachedTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.ResyncResult;

/**
 * View of the node topologies consumed by the scheduler extension points.
 * All methods are safe to call from concurrent scheduling attempts.
 */
public interface NodeTopologyCache {

    /**
     * Get the topology of a node as the scheduler should see it while placing the given pod.
     * A result which is not known means the node must not be used for topology aware
     * decisions this cycle.
     */
    CachedTopology getCachedCopy(String nodeName, Pod pod);

    /**
     * Record that the node was discarded as a placement candidate for the given pod.
     */
    void markMaybeOverReserved(String nodeName, Pod pod);

    /**
     * Record that the node runs pods not placed through this cache.
     */
    void markHasForeignPods(String nodeName, Pod pod);

    /**
     * Account the resources of the pod as consumed on the node.
     */
    void reserve(String nodeName, Pod pod);

    /**
     * Release the resources previously accounted by {@link #reserve(String, Pod)}.
     */
    void unreserve(String nodeName, Pod pod);

    /**
     * Called once the pod is bound to the node.
     */
    void postBind(String nodeName, Pod pod);

    /**
     * Run one reconciliation step against the published snapshots.
     * Not reentrant: callers must serialize invocations.
     */
    ResyncResult resync();
}
