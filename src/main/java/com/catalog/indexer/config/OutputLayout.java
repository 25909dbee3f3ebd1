package com.catalog.indexer.config;

import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * File names of everything an indexing run writes, relative to one output root.
 */
@Value
public class OutputLayout {

    @NonNull
    Path root;

    public Path helpersDir() {
        return root.resolve("helpers");
    }

    public Path programNamesDir() {
        return root.resolve("program_names");
    }

    public Path rawRowsDir() {
        return root.resolve("raw_course_rows");
    }

    public Path anomalyDir() {
        return root.resolve("anomalies");
    }

    public Path sectionsIndexFile() {
        return helpersDir().resolve("sections_index_v10.json");
    }

    public Path degreeSnapshotsFile() {
        return helpersDir().resolve("degree_snapshots_v10_seed.json");
    }

    public Path courseIndexFile() {
        return helpersDir().resolve("course_index_v10.json");
    }

    public Path coursesFlatCsv() {
        return root.resolve("courses_flat.csv");
    }

    public Path coursesWithCollegeCsv() {
        return root.resolve("courses_with_college.csv");
    }

    public Path runReport() {
        return root.resolve("run_report.md");
    }

    public Path programNamesFile(String catalogDate) {
        return programNamesDir().resolve(filePrefix(catalogDate) + "_program_names_v10.json");
    }

    public Path rawRowsFile(String catalogDate) {
        return rawRowsDir().resolve(filePrefix(catalogDate) + "_raw_course_rows.json");
    }

    public Path anomalyFile(String catalogDate) {
        return anomalyDir().resolve("anomalies_" + filePrefix(catalogDate) + ".json");
    }

    private static String filePrefix(String catalogDate) {
        return catalogDate.replace('-', '_');
    }
}
