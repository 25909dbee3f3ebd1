package com.catalog.indexer.aggregate;

import com.catalog.indexer.model.Anomaly;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Rows seen while scanning the sections of one catalog document.
 */
@Value
@Builder
public class DocumentCourses {

    String catalogDate;

    /** Every non-empty row inside a course block, in scan order. */
    @Singular
    List<String> rawRows;

    @Singular
    List<Anomaly> anomalies;

    int indexedRows;

    public List<String> anomalyLines() {
        return anomalies.stream().map(Anomaly::getRawLine).toList();
    }
}
