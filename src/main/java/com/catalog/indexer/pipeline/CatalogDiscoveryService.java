package com.catalog.indexer.pipeline;

import com.catalog.indexer.model.CatalogDocument;

import lombok.NoArgsConstructor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists {@code catalog_<YYYY>_<MM>.txt} files of a directory sorted by file name,
 * which is also chronological order.
 */
@NoArgsConstructor
public class CatalogDiscoveryService {

    private static final Logger log = LoggerFactory.getLogger(CatalogDiscoveryService.class);

    public List<Path> discoverCatalogFiles(Path textDir) throws IOException {
        try (Stream<Path> stream = Files.walk(textDir, 1)) {
            List<Path> textFiles = stream.filter(Files::isRegularFile)
                    .filter(this::isTextFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());

            textFiles.stream()
                    .filter(p -> !CatalogDocument.isCatalogFile(p))
                    .forEach(p -> log.warn("Skipping {}: name is not catalog_<YYYY>_<MM>.txt", p.getFileName()));

            return textFiles.stream()
                    .filter(CatalogDocument::isCatalogFile)
                    .collect(Collectors.toList());
        }
    }

    private boolean isTextFile(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt");
    }
}
