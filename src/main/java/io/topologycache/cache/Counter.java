package io.topologycache.cache;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-node occurrence counter used to flag dirty nodes.
 * Not thread safe: guarded by the owning cache lock.
 */
class Counter {

    private final Map<String, Integer> counts;

    Counter() {
        this.counts = new HashMap<>();
    }

    private Counter(Map<String, Integer> counts) {
        this.counts = new HashMap<>(counts);
    }

    int incr(String key) {
        return counts.merge(key, 1, Integer::sum);
    }

    void delete(String key) {
        counts.remove(key);
    }

    boolean isSet(String key) {
        return counts.containsKey(key);
    }

    List<String> keys() {
        return new ArrayList<>(counts.keySet());
    }

    int len() {
        return counts.size();
    }

    Counter copy() {
        return new Counter(counts);
    }
}
