package io.topologycache.enums;

/**
 * Which pods scheduled by other schedulers mark a node as having foreign pods.
 */
public enum ForeignPodsDetectMode {
    NONE("None"),
    ALL("All"),
    ONLY_EXCLUSIVE_RESOURCES("OnlyExclusiveResources");

    private final String value;

    ForeignPodsDetectMode(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static ForeignPodsDetectMode fromString(String value) {
        if (value == null) return null;

        String trimmed = value.trim();
        for (ForeignPodsDetectMode mode : ForeignPodsDetectMode.values()) {
            if (mode.value.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        return null;
    }
}
