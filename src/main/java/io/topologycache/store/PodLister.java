package io.topologycache.store;

import io.topologycache.models.Pod;

import java.util.List;

/**
 * Read access to the pods known to the control plane.
 */
public interface PodLister {

    /**
     * Get all pods, bound or not, in every namespace
     */
    List<Pod> listPods() throws Exception;
}
