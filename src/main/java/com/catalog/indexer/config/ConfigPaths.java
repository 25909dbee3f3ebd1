package com.catalog.indexer.config;

import com.catalog.indexer.section.StopFencePolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Locations of the inputs of an indexing run, before anything is read.
 */
@Value
@Builder
public class ConfigPaths {

    @NonNull
    Path textDir;

    @NonNull
    Path collegeSnapshots;

    /** Canonical college ordering; the college snapshots file when not set. */
    Path collegeOrder;

    @NonNull
    Path degreeDuplicates;

    @NonNull
    Path outputDir;

    @Builder.Default
    StopFencePolicy stopFencePolicy = StopFencePolicy.SIBLING_OR_COLLEGE;

    public Path collegeOrderOrDefault() {
        return collegeOrder != null ? collegeOrder : collegeSnapshots;
    }
}
