package io.topologycache.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Quantities of a single resource inside a zone.
 * Values are in the resource base unit: millicores for cpu, bytes for memory and hugepages, count otherwise.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ResourceInfo {

    @JsonProperty("name")
    private String name;

    @JsonProperty("capacity")
    private long capacity;

    @JsonProperty("allocatable")
    private long allocatable;

    @JsonProperty("available")
    private long available;
}
