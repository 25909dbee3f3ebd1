package com.catalog.indexer.cli.model;

import java.nio.file.Path;

import com.catalog.indexer.config.ConfigPaths;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps IndexCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedIndexOptions {
    Path normalizedOutputDir;
    ConfigPaths configPaths;
}
