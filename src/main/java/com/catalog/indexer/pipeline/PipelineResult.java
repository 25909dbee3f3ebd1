package com.catalog.indexer.pipeline;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

import java.nio.file.Path;
import java.util.List;

/**
 * Result of an indexing run.
 */
@Data
@Builder
public class PipelineResult {
    private boolean success;
    private String errorMessage;

    private int catalogsProcessed;
    private int sectionsIndexed;
    private int sectionFailures;
    private int degreeSnapshots;
    private int courseCodes;
    private int anomalies;

    @Singular
    private List<DateSummary> dateSummaries;

    @Singular
    private List<Path> outputs;

    private PipelineDiagnostics diagnostics;

    public static PipelineResult failure(String errorMessage) {
        return PipelineResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
