package com.catalog.indexer.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A course-area row that could not be keyed into the course index. Kept for audit.
 */
@Value
@Builder
public class Anomaly {
    @NonNull
    String catalogDate;
    String college;
    String degree;
    @NonNull
    String rawLine;
    @NonNull
    AnomalyKind kind;
}
