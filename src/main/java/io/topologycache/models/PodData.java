package io.topologycache.models;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Entry of the per-node pod roster used to recompute pod set fingerprints.
 */
@Data
@AllArgsConstructor
public class PodData {
    private final String namespace;
    private final String name;
    private final boolean hasExclusiveResources;
}
