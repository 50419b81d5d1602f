package io.topologycache.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.topologycache.enums.PodPhase;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Pod entity as exposed by the pod lister: identity, node binding, phase and resource requests.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Pod {

    @JsonProperty("namespace")
    private String namespace;

    @JsonProperty("name")
    private String name;

    @JsonProperty("node_name")
    private String nodeName; // empty until bound

    @JsonProperty("scheduler_name")
    private String schedulerName;

    @JsonProperty("phase")
    private PodPhase phase;

    @JsonProperty("containers")
    private List<Container> containers = new ArrayList<>();

    @JsonProperty("init_containers")
    private List<Container> initContainers = new ArrayList<>();

    public Pod(String namespace, String name) {
        this.namespace = namespace;
        this.name = name;
    }

    /**
     * Identity key of the pod: namespace/name.
     */
    @JsonIgnore
    public String getKey() {
        return namespace + "/" + name;
    }

    @JsonIgnore
    public boolean isBound() {
        return nodeName != null && !nodeName.isEmpty();
    }
}
