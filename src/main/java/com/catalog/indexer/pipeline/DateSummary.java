package com.catalog.indexer.pipeline;

import lombok.Builder;
import lombok.Value;

/**
 * Per-catalog counters reported at the end of a run.
 */
@Value
@Builder(toBuilder = true)
public class DateSummary {

    String catalogDate;
    String fileName;

    boolean upwardScan;

    int listedDegrees;
    int sections;
    int failures;

    int rawRows;
    int indexedRows;
    int anomalies;
}
