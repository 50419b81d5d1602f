package io.topologycache.models;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Result of a cache read.
 * <p>
 * {@code known == false} means the node must not be used for topology aware decisions
 * this cycle. {@code known == true} with a null topology means no snapshot exists yet.
 */
@Data
@AllArgsConstructor
public class CachedTopology {
    private final NodeResourceTopology topology;
    private final boolean known;

    public static CachedTopology unknown() {
        return new CachedTopology(null, false);
    }

    public static CachedTopology missing() {
        return new CachedTopology(null, true);
    }

    public static CachedTopology of(NodeResourceTopology topology) {
        return new CachedTopology(topology, true);
    }
}
