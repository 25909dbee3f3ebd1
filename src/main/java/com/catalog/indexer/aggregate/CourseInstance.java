package com.catalog.indexer.aggregate;

import com.catalog.indexer.model.PatternId;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One sighting of a course code: where it was listed and the row it came from.
 */
@Value
@Builder
@JsonPropertyOrder({"catalog_date", "college", "degree", "pattern", "raw"})
public class CourseInstance {

    @NonNull
    @JsonProperty("catalog_date")
    String catalogDate;

    @JsonProperty("college")
    String college;

    @JsonProperty("degree")
    String degree;

    @NonNull
    @JsonProperty("pattern")
    PatternId pattern;

    @NonNull
    @JsonProperty("raw")
    String raw;
}
