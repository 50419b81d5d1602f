package io.topologycache.enums;

/**
 * Why a dirty node was left untouched by a resync cycle.
 */
public enum ResyncSkipReason {
    FETCH_FAILED,
    MISSING_TOPOLOGY,
    NAME_MISMATCH,
    MISSING_PODS,
    MISSING_FINGERPRINT,
    MISMATCH,
    MALFORMED_FINGERPRINT
}
