package io.topologycache.podprovider;

import io.topologycache.models.Pod;

/**
 * Decides whether a pod takes part in the per-node pod roster used for fingerprinting.
 */
@FunctionalInterface
public interface PodFilter {

    boolean isRelevant(Pod pod, String logId);
}
