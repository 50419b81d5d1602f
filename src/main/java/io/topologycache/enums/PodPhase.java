package io.topologycache.enums;

/**
 * Lifecycle phase of a pod as reported by the control plane.
 */
public enum PodPhase {
    PENDING,
    RUNNING,
    SUCCEEDED,
    FAILED,
    UNKNOWN
}
