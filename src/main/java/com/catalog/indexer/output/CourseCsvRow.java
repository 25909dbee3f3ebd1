package com.catalog.indexer.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Row of {@code courses_flat.csv}.
 */
@Value
@JsonPropertyOrder({"CourseCode", "CourseName"})
public class CourseCsvRow {

    @JsonProperty("CourseCode")
    String courseCode;

    @JsonProperty("CourseName")
    String courseName;
}
