package io.topologycache.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * A resource zone of a node, typically a NUMA cell.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Zone {

    @JsonProperty("name")
    private String name;

    @JsonProperty("type")
    private String type; // "Node" for NUMA cells

    @JsonProperty("resources")
    private List<ResourceInfo> resources = new ArrayList<>();

    public Zone(String name, String type, List<ResourceInfo> resources) {
        this.name = name;
        this.type = type;
        this.resources = resources;
    }

    public Zone deepCopy() {
        List<ResourceInfo> resourcesCopy = new ArrayList<>();
        if (resources != null) {
            for (ResourceInfo res : resources) {
                resourcesCopy.add(new ResourceInfo(res.getName(), res.getCapacity(), res.getAllocatable(), res.getAvailable()));
            }
        }
        return new Zone(name, type, resourcesCopy);
    }
}
