package io.topologycache.enums;

/**
 * Which pods the resync loop considers as consuming node resources.
 *
 * SHARED: only running pods, DEDICATED: running pods plus pending pods already bound to a node
 */
public enum CacheInformerMode {
    SHARED("Shared"),
    DEDICATED("Dedicated");

    private final String value;

    CacheInformerMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static CacheInformerMode fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (CacheInformerMode mode : CacheInformerMode.values()) {
            if (mode.value.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        return null;
    }
}
