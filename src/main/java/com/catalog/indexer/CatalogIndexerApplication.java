package com.catalog.indexer;

import com.catalog.indexer.cli.CatalogIndexerCommand;
import picocli.CommandLine;

/**
 * Main entry point for the catalog indexer.
 * Turns monthly plain-text course catalog dumps into section, degree and course
 * indexes plus the CSV course lists consumed downstream.
 */
public class CatalogIndexerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new CatalogIndexerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
