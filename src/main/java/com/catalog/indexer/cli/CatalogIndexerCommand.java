package com.catalog.indexer.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level command; all work happens in the subcommands.
 */
@Command(
        name = "catalog-indexer",
        mixinStandardHelpOptions = true,
        version = "catalog-indexer 1.0.0",
        description = "Indexes plain-text course catalog dumps into sections, degree snapshots and a course index.",
        subcommands = {
                IndexCommand.class,
                ConvertDuplicatesCommand.class,
                MergeCourseListCommand.class
        }
)
public class CatalogIndexerCommand implements Runnable {

    @Spec
    private CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing required subcommand");
    }
}
