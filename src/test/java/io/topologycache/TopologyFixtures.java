package io.topologycache;

import io.topologycache.enums.PodPhase;
import io.topologycache.fingerprint.PodFingerprint;
import io.topologycache.models.AttributeInfo;
import io.topologycache.models.Container;
import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.Pod;
import io.topologycache.models.ResourceInfo;
import io.topologycache.models.Zone;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.topologycache.config.Constants.*;

/**
 * Builders for topology snapshots and pods shared by the tests.
 */
public final class TopologyFixtures {

    public static final String NAMESPACE = "default";
    public static final long GIB = 1024L * 1024L * 1024L;

    private TopologyFixtures() {
    }

    /**
     * Two NUMA zones, each with the given cpu (millicores) and memory (bytes) available.
     */
    public static NodeResourceTopology nodeTopology(String nodeName, long cpuPerZone, long memoryPerZone) {
        List<Zone> zones = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            List<ResourceInfo> resources = new ArrayList<>();
            resources.add(new ResourceInfo(RESOURCE_CPU, cpuPerZone, cpuPerZone, cpuPerZone));
            resources.add(new ResourceInfo(RESOURCE_MEMORY, memoryPerZone, memoryPerZone, memoryPerZone));
            zones.add(new Zone("node-" + i, "Node", resources));
        }
        return new NodeResourceTopology(nodeName, zones);
    }

    public static NodeResourceTopology withFingerprintAttribute(NodeResourceTopology nrt, String fingerprint) {
        nrt.getAttributes().add(new AttributeInfo(PodFingerprint.ATTRIBUTE, fingerprint));
        return nrt;
    }

    public static NodeResourceTopology withFingerprintMethod(NodeResourceTopology nrt, String method) {
        nrt.getAttributes().add(new AttributeInfo(PodFingerprint.ATTRIBUTE_METHOD, method));
        return nrt;
    }

    public static long available(NodeResourceTopology nrt, String zoneName, String resourceName) {
        return nrt.getZones().stream()
                .filter(zone -> zoneName.equals(zone.getName()))
                .flatMap(zone -> zone.getResources().stream())
                .filter(res -> resourceName.equals(res.getName()))
                .mapToLong(ResourceInfo::getAvailable)
                .findFirst()
                .orElseThrow();
    }

    /**
     * Running pod with a single container requesting the given cpu and memory.
     */
    public static Pod pod(String name, String nodeName, long cpuMillis, long memoryBytes) {
        Map<String, Long> requests = new HashMap<>();
        requests.put(RESOURCE_CPU, cpuMillis);
        requests.put(RESOURCE_MEMORY, memoryBytes);
        Pod pod = new Pod(NAMESPACE, name);
        pod.setNodeName(nodeName);
        pod.setPhase(PodPhase.RUNNING);
        pod.setSchedulerName(DEFAULT_SCHEDULER_PROFILE);
        pod.getContainers().add(new Container("main", requests, new HashMap<>()));
        return pod;
    }

    /**
     * Pod with requests equal to limits.
     */
    public static Pod guaranteedPod(String name, String nodeName, long cpuMillis, long memoryBytes) {
        Pod pod = pod(name, nodeName, cpuMillis, memoryBytes);
        Container container = pod.getContainers().get(0);
        container.setLimits(new HashMap<>(container.getRequests()));
        return pod;
    }

    public static String fingerprintOf(String... podNames) {
        PodFingerprint pfp = new PodFingerprint(podNames.length);
        for (String name : podNames) {
            pfp.add(NAMESPACE, name);
        }
        return pfp.sign();
    }
}
