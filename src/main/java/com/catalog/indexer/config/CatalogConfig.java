package com.catalog.indexer.config;

import com.catalog.indexer.model.DuplicatesMap;
import com.catalog.indexer.model.SnapshotSet;
import com.catalog.indexer.section.StopFencePolicy;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;

/**
 * Everything an indexing run needs, loaded once at start-up by {@link ConfigLoader}.
 */
@Value
@Builder
public class CatalogConfig {

    @NonNull
    Path textDir;

    /** Valid college names per snapshot version. */
    @NonNull
    SnapshotSet collegeSnapshots;

    /** Canonical college ordering per snapshot version. */
    @NonNull
    SnapshotSet collegeOrder;

    @NonNull
    DuplicatesMap duplicates;

    @NonNull
    OutputLayout output;

    @NonNull
    StopFencePolicy stopFencePolicy;
}
