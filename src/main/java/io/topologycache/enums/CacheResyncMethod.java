package io.topologycache.enums;

/**
 * How the resync loop scopes the pod set fingerprint of a node.
 *
 * AUTODETECT: follow the method the node agent declares in the topology snapshot,
 * ALL_RESOURCES: every relevant pod, ONLY_EXCLUSIVE_RESOURCES: pods with exclusive resources only
 */
public enum CacheResyncMethod {
    AUTODETECT("Autodetect"),
    ALL_RESOURCES("AllResources"),
    ONLY_EXCLUSIVE_RESOURCES("OnlyExclusiveResources");

    private final String value;

    CacheResyncMethod(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CacheResyncMethod fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (CacheResyncMethod method : CacheResyncMethod.values()) {
            if (method.value.equalsIgnoreCase(trimmed) || method.name().equalsIgnoreCase(trimmed)) {
                return method;
            }
        }
        return null; // unknown values are left to the caller's fallback
    }
}
