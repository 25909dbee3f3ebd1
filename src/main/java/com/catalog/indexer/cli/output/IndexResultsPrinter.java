package com.catalog.indexer.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.catalog.indexer.cli.model.IndexOptions;
import com.catalog.indexer.cli.model.ValidatedIndexOptions;
import com.catalog.indexer.pipeline.PipelineResult;

/**
 * Responsible only for printing CLI output for the "index" command.
 * No validation, no execution.
 */
public class IndexResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(IndexResultsPrinter.class);

    public void printBanner(IndexOptions o, ValidatedIndexOptions v) {
        log.info("=================================================");
        log.info("Catalog Indexer");
        log.info("=================================================");
        log.info("Text Directory: {}", o.getTextDir().toAbsolutePath());
        log.info("College Snapshots: {}", o.getCollegeSnapshots().toAbsolutePath());
        log.info("College Order: {}", v.getConfigPaths().collegeOrderOrDefault().toAbsolutePath());
        log.info("Degree Duplicates: {}", o.getDegreeDuplicates().toAbsolutePath());
        log.info("Stop Fence: {}", o.getStopFencePolicy());
        log.info("Output Directory: {}", v.getNormalizedOutputDir());
        log.info("=================================================");
    }

    public void printSuccess(PipelineResult result) {
        log.info("");
        log.info("=================================================");
        log.info("INDEXING SUCCESSFUL");
        log.info("=================================================");
        log.info("Catalogs Processed: {}", result.getCatalogsProcessed());
        log.info("Sections Indexed: {}", result.getSectionsIndexed());
        log.info("Section Issues: {}", result.getSectionFailures());
        log.info("Degree Snapshots: {}", result.getDegreeSnapshots());
        log.info("Course Codes: {}", result.getCourseCodes());
        log.info("Anomalies: {}", result.getAnomalies());

        if (result.getDiagnostics() != null && result.getDiagnostics().hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            result.getDiagnostics().getWarnings().forEach(w -> log.info("  {}", w));
        }

        if (result.getDiagnostics() != null && !result.getDiagnostics().getInfos().isEmpty()) {
            log.info("");
            log.info("Notes:");
            result.getDiagnostics().getInfos().forEach(i -> log.info("  {}", i));
        }

        log.info("");
        log.info("Generated files:");
        for (Path output : result.getOutputs()) {
            log.info("  - {}", output);
        }
        log.info("=================================================");
    }

    public void printFailure(PipelineResult result) {
        log.error("Indexing failed: {}", result.getErrorMessage());
    }
}
