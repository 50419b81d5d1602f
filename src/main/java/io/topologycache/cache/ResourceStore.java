package io.topologycache.cache;

import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.ResourceInfo;
import io.topologycache.models.Zone;
import io.topologycache.resources.ResourceRequests;
import io.topologycache.util.Stringify;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Resources assumed consumed on a node by pods reserved through the cache
 * but not yet accounted for in the node's published snapshot.
 * Not thread safe: guarded by the owning cache lock.
 */
@Slf4j
class ResourceStore {

    // pod key (namespace/name) -> effective requests
    private final Map<String, Map<String, Long>> data = new HashMap<>();

    void addPod(Pod pod) {
        String key = pod.getKey();
        if (data.containsKey(key)) {
            log.debug("Updating existing entry for pod {}", key);
        }
        data.put(key, ResourceRequests.forPod(pod));
    }

    /**
     * @return true if the pod was tracked
     */
    boolean deletePod(Pod pod) {
        String key = pod.getKey();
        if (data.remove(key) == null) {
            log.debug("Pod {} not tracked, nothing to release", key);
            return false;
        }
        return true;
    }

    boolean isEmpty() {
        return data.isEmpty();
    }

    /**
     * Subtracts the tracked requests from the available quantities of the given snapshot.
     * The zone a pod lands in is not known here, so every zone is charged. Quantities
     * never go below zero.
     */
    void applyTo(String logId, NodeResourceTopology nrt) {
        Map<String, Long> assumed = totals();
        if (nrt.getZones() == null) {
            return;
        }
        for (Zone zone : nrt.getZones()) {
            if (zone.getResources() == null) {
                continue;
            }
            for (ResourceInfo res : zone.getResources()) {
                Long qty = assumed.get(res.getName());
                if (qty == null) {
                    continue;
                }
                if (res.getAvailable() < qty) {
                    // can happen when a reserved pod is larger than what the agent last reported
                    log.debug("[{}] Cannot decrement resource {} on zone {}: available {} assumed {}",
                            logId, res.getName(), zone.getName(), res.getAvailable(), qty);
                    res.setAvailable(0L);
                    continue;
                }
                res.setAvailable(res.getAvailable() - qty);
            }
        }
    }

    private Map<String, Long> totals() {
        Map<String, Long> totals = new HashMap<>();
        for (Map<String, Long> requests : data.values()) {
            requests.forEach((name, qty) -> totals.merge(name, qty, Long::sum));
        }
        return totals;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Map<String, Long>> entry : new TreeMap<>(data).entrySet()) {
            sb.append(entry.getKey()).append(": ").append(Stringify.resourceList(entry.getValue())).append("; ");
        }
        return sb.toString();
    }
}
