package io.topologycache.cache;

import io.topologycache.enums.ForeignPodsDetectMode;
import io.topologycache.models.Pod;
import io.topologycache.resources.ExclusivityPredicate;
import io.topologycache.util.LogIds;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.Set;

/**
 * Detects pods placed by schedulers other than the known profiles.
 * Such pods consume node resources the overlay never saw, so their node
 * cannot be trusted until the next successful resync.
 */
@Slf4j
public class ForeignPods {

    private final ForeignPodsDetectMode mode;
    private final Set<String> schedulerProfiles;
    private final ExclusivityPredicate exclusivity;

    public ForeignPods(ForeignPodsDetectMode mode, Collection<String> schedulerProfiles, ExclusivityPredicate exclusivity) {
        this.mode = mode != null ? mode : ForeignPodsDetectMode.ALL;
        this.schedulerProfiles = Set.copyOf(schedulerProfiles);
        this.exclusivity = exclusivity;
        log.info("Foreign pods detection mode: {}, known scheduler profiles: {}", this.mode, this.schedulerProfiles);
    }

    public boolean isForeign(Pod pod) {
        if (mode == ForeignPodsDetectMode.NONE || pod == null) {
            return false;
        }
        if (pod.getSchedulerName() != null && schedulerProfiles.contains(pod.getSchedulerName())) {
            return false;
        }
        if (mode == ForeignPodsDetectMode.ONLY_EXCLUSIVE_RESOURCES) {
            return exclusivity.hasExclusiveResources(pod);
        }
        return true;
    }

    /**
     * To be called for every pod added or updated in the cluster.
     *
     * @return true if the node of the pod got marked
     */
    public boolean onPodObserved(NodeTopologyCache cache, Pod pod) {
        if (pod == null || !pod.isBound() || !isForeign(pod)) {
            return false;
        }
        log.debug("[{}] Foreign pod observed on node {} (scheduler: {})",
                LogIds.forPod(pod), pod.getNodeName(), pod.getSchedulerName());
        cache.markHasForeignPods(pod.getNodeName(), pod);
        return true;
    }
}
