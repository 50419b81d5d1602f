package io.topologycache.util;

import io.topologycache.models.NodeResourceTopology;
import io.topologycache.models.ResourceInfo;
import io.topologycache.models.Zone;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Compact renderings of resource data for debug logs.
 */
public final class Stringify {

    private Stringify() {
        // Utility class
    }

    /**
     * Renders the available quantities of every zone, e.g. {@code node-0=<cpu=4000,memory=1024>}.
     */
    public static String topologyResources(NodeResourceTopology nrt) {
        if (nrt == null || nrt.getZones() == null) {
            return "<nil>";
        }
        StringBuilder sb = new StringBuilder();
        for (Zone zone : nrt.getZones()) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(zone.getName()).append("=<");
            if (zone.getResources() != null) {
                sb.append(zone.getResources().stream()
                        .map(ResourceInfo::getName)
                        .sorted()
                        .map(name -> name + "=" + availableOf(zone, name))
                        .collect(Collectors.joining(",")));
            }
            sb.append(">");
        }
        return sb.toString();
    }

    public static String resourceList(Map<String, Long> resources) {
        if (resources == null) {
            return "{}";
        }
        return new TreeMap<>(resources).toString();
    }

    private static long availableOf(Zone zone, String resourceName) {
        return zone.getResources().stream()
                .filter(res -> resourceName.equals(res.getName()))
                .mapToLong(ResourceInfo::getAvailable)
                .findFirst()
                .orElse(0L);
    }
}
