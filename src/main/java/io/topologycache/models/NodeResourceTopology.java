package io.topologycache.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Topology snapshot of a node as published by the node agent.
 * Holds the per-zone resource availability plus the pod set fingerprint
 * the agent computed when it produced the snapshot.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NodeResourceTopology {

    @JsonProperty("name")
    private String name; // node name

    @JsonProperty("zones")
    private List<Zone> zones = new ArrayList<>();

    @JsonProperty("attributes")
    private List<AttributeInfo> attributes = new ArrayList<>();

    @JsonProperty("annotations")
    private Map<String, String> annotations = new HashMap<>();

    public NodeResourceTopology(String name, List<Zone> zones) {
        this.name = name;
        this.zones = zones;
    }

    /**
     * Value of the named attribute, if the agent published it.
     */
    @JsonIgnore
    public Optional<String> getAttribute(String attributeName) {
        if (attributes == null) {
            return Optional.empty();
        }
        return attributes.stream()
                .filter(attr -> attributeName.equals(attr.getName()))
                .map(AttributeInfo::getValue)
                .findFirst();
    }

    public NodeResourceTopology deepCopy() {
        NodeResourceTopology copy = new NodeResourceTopology();
        copy.setName(name);
        List<Zone> zonesCopy = new ArrayList<>();
        if (zones != null) {
            for (Zone zone : zones) {
                zonesCopy.add(zone.deepCopy());
            }
        }
        copy.setZones(zonesCopy);
        List<AttributeInfo> attributesCopy = new ArrayList<>();
        if (attributes != null) {
            for (AttributeInfo attr : attributes) {
                attributesCopy.add(new AttributeInfo(attr.getName(), attr.getValue()));
            }
        }
        copy.setAttributes(attributesCopy);
        copy.setAnnotations(annotations != null ? new HashMap<>(annotations) : new HashMap<>());
        return copy;
    }
}
