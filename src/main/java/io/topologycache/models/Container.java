package io.topologycache.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Container {

    @JsonProperty("name")
    private String name;

    @JsonProperty("requests")
    private Map<String, Long> requests = new HashMap<>();

    @JsonProperty("limits")
    private Map<String, Long> limits = new HashMap<>();

    public Container(String name, Map<String, Long> requests, Map<String, Long> limits) {
        this.name = name;
        this.requests = requests;
        this.limits = limits;
    }
}
