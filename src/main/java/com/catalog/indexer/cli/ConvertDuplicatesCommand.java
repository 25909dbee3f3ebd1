package com.catalog.indexer.cli;

import com.catalog.indexer.config.DuplicatesCsvConverter;
import com.catalog.indexer.exception.CatalogIndexException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Converts the degree duplicates CSV into the flat JSON map read by "index".
 */
@Command(
        name = "convert-duplicates",
        mixinStandardHelpOptions = true,
        description = "Converts a raw_degree_name,resolved_name CSV into degree duplicates JSON."
)
public class ConvertDuplicatesCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConvertDuplicatesCommand.class);

    @Option(names = {"--input", "-i"}, required = true, description = "Degree duplicates CSV")
    private Path input;

    @Option(names = {"--output", "-o"}, required = true, description = "JSON file to write")
    private Path output;

    @Override
    public Integer call() {
        if (!Files.isRegularFile(input)) {
            log.error("Input CSV not found: {}", input);
            return 1;
        }
        try {
            new DuplicatesCsvConverter().convert(input, output);
            return 0;
        } catch (CatalogIndexException | IOException e) {
            log.error("Conversion failed: {}", e.getMessage());
            return 1;
        }
    }
}
