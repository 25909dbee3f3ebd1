package com.catalog.indexer.cli;

import com.catalog.indexer.cli.exception.OptionsValidationException;
import com.catalog.indexer.cli.model.IndexOptions;
import com.catalog.indexer.cli.model.ValidatedIndexOptions;
import com.catalog.indexer.cli.output.IndexResultsPrinter;
import com.catalog.indexer.cli.validation.IndexOptionsValidator;
import com.catalog.indexer.config.CatalogConfig;
import com.catalog.indexer.config.ConfigLoader;
import com.catalog.indexer.exception.CatalogIndexException;
import com.catalog.indexer.pipeline.CatalogPipeline;
import com.catalog.indexer.pipeline.PipelineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * CLI command running the full catalog indexing batch.
 */
@Command(
        name = "index",
        mixinStandardHelpOptions = true,
        description = "Builds the sections index, degree snapshots, course index and course CSVs from catalog text files."
)
public class IndexCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(IndexCommand.class);

    @Mixin
    private IndexOptions options;

    private final IndexOptionsValidator validator = new IndexOptionsValidator();
    private final IndexResultsPrinter printer = new IndexResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedIndexOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            CatalogConfig config = new ConfigLoader().load(validated.getConfigPaths());
            PipelineResult result = new CatalogPipeline(config).run();

            if (!result.isSuccess()) {
                printer.printFailure(result);
                return 1;
            }
            printer.printSuccess(result);
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        } catch (CatalogIndexException | IOException e) {
            log.error("Failed to load configuration: {}", e.getMessage());
            return 1;
        }
    }
}
