package com.catalog.indexer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;

/**
 * A course row together with the pattern that matched it and the captured fields.
 * Department, number and code are absent for the patterns that do not capture them.
 */
@Value
@Builder
public class ClassifiedCourseRow {

    @NonNull
    String rawLine;

    @NonNull
    PatternId patternId;

    String department;
    String number;
    String code;

    @NonNull
    String title;

    int creditUnits;
    int term;

    public Optional<String> code() {
        return Optional.ofNullable(code);
    }

    public boolean hasCode() {
        return code != null;
    }
}
