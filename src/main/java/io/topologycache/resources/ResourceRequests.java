package io.topologycache.resources;

import io.topologycache.models.Container;
import io.topologycache.models.Pod;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.topologycache.config.Constants.*;

/**
 * Resource request arithmetic on pods.
 */
public final class ResourceRequests {

    private ResourceRequests() {
        // Utility class
    }

    /**
     * Effective requests of a pod: for each resource the larger of the sum over the
     * regular containers and the largest single init container request, since init
     * containers run one at a time before the regular ones.
     */
    public static Map<String, Long> forPod(Pod pod) {
        Map<String, Long> reqs = new HashMap<>();
        if (pod == null) {
            return reqs;
        }
        for (Container cnt : nonNull(pod.getContainers())) {
            for (Map.Entry<String, Long> entry : nonNull(cnt.getRequests()).entrySet()) {
                reqs.merge(entry.getKey(), valueOf(entry.getValue()), Long::sum);
            }
        }
        for (Container cnt : nonNull(pod.getInitContainers())) {
            for (Map.Entry<String, Long> entry : nonNull(cnt.getRequests()).entrySet()) {
                reqs.merge(entry.getKey(), valueOf(entry.getValue()), Math::max);
            }
        }
        return reqs;
    }

    /**
     * Whether the pod asks for resources the node agent pins to specific zones:
     * integral cpus in a guaranteed pod, hugepages or devices.
     */
    public static boolean areExclusiveForPod(Pod pod) {
        if (pod == null) {
            return false;
        }
        if (requestsNonNativeResources(pod)) {
            return true;
        }
        return isGuaranteed(pod) && hasIntegralCpus(pod);
    }

    static boolean isGuaranteed(Pod pod) {
        List<Container> all = allContainers(pod);
        if (all.isEmpty()) {
            return false;
        }
        for (Container cnt : all) {
            Map<String, Long> requests = nonNull(cnt.getRequests());
            Map<String, Long> limits = nonNull(cnt.getLimits());
            for (String res : List.of(RESOURCE_CPU, RESOURCE_MEMORY)) {
                Long limit = limits.get(res);
                if (limit == null || limit == 0L) {
                    return false;
                }
                // requests default to limits when omitted
                Long request = requests.getOrDefault(res, limit);
                if (!limit.equals(request)) {
                    return false;
                }
            }
        }
        return true;
    }

    private static boolean hasIntegralCpus(Pod pod) {
        for (Container cnt : nonNull(pod.getContainers())) {
            Long cpu = nonNull(cnt.getRequests()).get(RESOURCE_CPU);
            if (cpu != null && cpu > 0 && cpu % MILLICORES_PER_CPU == 0) {
                return true;
            }
        }
        return false;
    }

    private static boolean requestsNonNativeResources(Pod pod) {
        for (Container cnt : allContainers(pod)) {
            for (Map.Entry<String, Long> entry : nonNull(cnt.getRequests()).entrySet()) {
                if (valueOf(entry.getValue()) > 0 && isExclusiveResourceName(entry.getKey())) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isExclusiveResourceName(String name) {
        if (name == null) {
            return false;
        }
        if (name.startsWith(RESOURCE_HUGEPAGES_PREFIX)) {
            return true;
        }
        return name.contains("/") && !name.startsWith(NATIVE_RESOURCE_DOMAIN);
    }

    private static List<Container> allContainers(Pod pod) {
        List<Container> all = new ArrayList<>(nonNull(pod.getContainers()));
        all.addAll(nonNull(pod.getInitContainers()));
        return all;
    }

    private static long valueOf(Long value) {
        return value != null ? value : 0L;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list != null ? list : List.of();
    }

    private static Map<String, Long> nonNull(Map<String, Long> map) {
        return map != null ? map : Map.of();
    }
}
