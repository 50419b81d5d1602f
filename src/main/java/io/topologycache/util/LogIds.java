package io.topologycache.util;

import io.topologycache.models.Pod;

/**
 * Correlation ids attached to log lines so a single scheduling attempt or
 * resync cycle can be followed across components.
 */
public final class LogIds {

    private LogIds() {
        // Utility class
    }

    public static String forPod(Pod pod) {
        if (pod == null) {
            return "<nil>";
        }
        return pod.getNamespace() + "/" + pod.getName();
    }

    /**
     * Id for flows not bound to a pod, like the periodic resync.
     */
    public static String forTime() {
        return "resync-" + System.nanoTime();
    }
}
