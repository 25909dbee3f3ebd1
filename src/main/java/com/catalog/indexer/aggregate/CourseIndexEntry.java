package com.catalog.indexer.aggregate;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A course code with the title and credit units of its first sighting and every
 * sighting in scan order.
 */
@Value
@JsonPropertyOrder({"canonical_title", "canonical_cus", "instances"})
public class CourseIndexEntry {

    @JsonIgnore
    String code;

    @JsonProperty("canonical_title")
    String canonicalTitle;

    @JsonProperty("canonical_cus")
    int canonicalCreditUnits;

    @JsonProperty("instances")
    List<CourseInstance> instances;

    /**
     * Distinct non-blank college names across all instances, sorted.
     */
    public Set<String> colleges() {
        Set<String> colleges = new TreeSet<>();
        for (CourseInstance instance : instances) {
            if (instance.getCollege() != null && !instance.getCollege().isBlank()) {
                colleges.add(instance.getCollege().strip());
            }
        }
        return colleges;
    }
}
