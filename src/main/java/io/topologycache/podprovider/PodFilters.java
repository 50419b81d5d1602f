package io.topologycache.podprovider;

import io.topologycache.enums.CacheInformerMode;
import io.topologycache.enums.PodPhase;
import lombok.extern.slf4j.Slf4j;

/**
 * Stock pod filters. Pods not bound to a node never take part in a roster.
 */
@Slf4j
public final class PodFilters {

    private PodFilters() {
        // Utility class
    }

    public static final PodFilter ALWAYS = (pod, logId) -> pod != null && pod.isBound();

    /**
     * Only running pods are known to consume node resources.
     */
    public static final PodFilter SHARED = (pod, logId) ->
            ALWAYS.isRelevant(pod, logId) && pod.getPhase() == PodPhase.RUNNING;

    /**
     * Running pods, plus pending pods already bound: the node agent accounts for
     * them as soon as their resources are admitted.
     */
    public static final PodFilter DEDICATED = (pod, logId) ->
            ALWAYS.isRelevant(pod, logId)
                    && (pod.getPhase() == PodPhase.RUNNING || pod.getPhase() == PodPhase.PENDING);

    public static PodFilter forInformerMode(CacheInformerMode mode) {
        if (mode == CacheInformerMode.SHARED) {
            log.debug("Using pod filter for shared informer mode");
            return SHARED;
        }
        log.debug("Using pod filter for dedicated informer mode");
        return DEDICATED;
    }
}
