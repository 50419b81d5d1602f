package io.topologycache.cache;

import io.topologycache.models.CachedTopology;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.ResyncResult;
import io.topologycache.store.NodeTopologyClient;
import io.topologycache.util.LogIds;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Cache which reads the published snapshot on every call and keeps no state.
 * Reservations are not tracked, so it is only accurate when the node agent
 * refreshes faster than pods are scheduled.
 */
@Slf4j
public class PassthroughCache implements NodeTopologyCache {

    private final NodeTopologyClient client;

    public PassthroughCache(NodeTopologyClient client) {
        if (client == null) {
            throw new IllegalArgumentException("received null references");
        }
        this.client = client;
        log.info("PassthroughCache initialized");
    }

    @Override
    public CachedTopology getCachedCopy(String nodeName, Pod pod) {
        try {
            Optional<NodeResourceTopology> nrt = client.getNodeTopology(nodeName);
            return nrt.map(CachedTopology::of).orElseGet(CachedTopology::missing);
        } catch (Exception e) {
            log.debug("[{}] Failed to get node topology for node {}: {}", LogIds.forPod(pod), nodeName, e.getMessage());
            return CachedTopology.missing();
        }
    }

    @Override
    public void markMaybeOverReserved(String nodeName, Pod pod) {}

    @Override
    public void markHasForeignPods(String nodeName, Pod pod) {}

    @Override
    public void reserve(String nodeName, Pod pod) {}

    @Override
    public void unreserve(String nodeName, Pod pod) {}

    @Override
    public void postBind(String nodeName, Pod pod) {}

    @Override
    public ResyncResult resync() {
        return ResyncResult.nothingToDo(LogIds.forTime());
    }
}
