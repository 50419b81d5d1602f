package io.topologycache.cache;

import io.topologycache.models.NodeResourceTopology;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Latest known topology snapshot per node.
 * Stores and returns deep copies so callers can never mutate the stored data.
 * Not thread safe: guarded by the owning cache lock.
 */
@Slf4j
class NrtStore {

    private final Map<String, NodeResourceTopology> data = new HashMap<>();

    NrtStore(List<NodeResourceTopology> nrts) {
        for (NodeResourceTopology nrt : nrts) {
            if (nrt == null || nrt.getName() == null) {
                log.warn("Skipping node topology without node name");
                continue;
            }
            data.put(nrt.getName(), nrt.deepCopy());
        }
        log.debug("Node topology store initialized with {} nodes", data.size());
    }

    boolean contains(String nodeName) {
        return data.containsKey(nodeName);
    }

    Optional<NodeResourceTopology> getCopy(String nodeName) {
        NodeResourceTopology nrt = data.get(nodeName);
        if (nrt == null) {
            log.debug("Missing node topology for node {}", nodeName);
            return Optional.empty();
        }
        return Optional.of(nrt.deepCopy());
    }

    void update(NodeResourceTopology nrt) {
        data.put(nrt.getName(), nrt.deepCopy());
        log.debug("Updated node topology for node {}", nrt.getName());
    }

    int size() {
        return data.size();
    }
}
