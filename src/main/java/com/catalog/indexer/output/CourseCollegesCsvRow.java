package com.catalog.indexer.output;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import lombok.Value;

/**
 * Row of {@code courses_with_college.csv}; colleges are sorted and joined with {@code "; "}.
 */
@Value
@JsonPropertyOrder({"CourseCode", "CourseName", "Colleges"})
public class CourseCollegesCsvRow {

    public static final String COLLEGE_SEPARATOR = "; ";

    @JsonProperty("CourseCode")
    String courseCode;

    @JsonProperty("CourseName")
    String courseName;

    @JsonProperty("Colleges")
    String colleges;
}
