package io.topologycache.enums;

/**
 * Outcome of comparing the pod set fingerprint published in a topology snapshot
 * with the one computed from the pods currently running on the node.
 *
 * <ul>
 *   <li><strong>MATCH</strong> - the snapshot accounts for exactly the running pods and can be trusted</li>
 *   <li><strong>MISMATCH</strong> - the snapshot is stale relative to the running pods</li>
 *   <li><strong>MISSING</strong> - the snapshot carries no fingerprint, nothing to validate against</li>
 * </ul>
 */
public enum FingerprintCheckResult {
    MATCH,
    MISMATCH,
    MISSING
}
