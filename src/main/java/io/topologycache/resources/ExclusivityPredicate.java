package io.topologycache.resources;

import io.topologycache.models.Pod;

/**
 * Decides whether a pod counts toward the "exclusive resources only" fingerprint scope.
 */
@FunctionalInterface
public interface ExclusivityPredicate {

    boolean hasExclusiveResources(Pod pod);
}
