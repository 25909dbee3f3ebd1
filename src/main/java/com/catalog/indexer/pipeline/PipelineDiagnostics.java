package com.catalog.indexer.pipeline;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Run-wide diagnostics (warnings and info) accumulated while indexing.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class PipelineDiagnostics {
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
