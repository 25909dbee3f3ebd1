package com.catalog.indexer.config;

import com.catalog.indexer.exception.InvalidConfigurationException;
import com.catalog.indexer.util.FileWriteUtil;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns a hand-maintained {@code raw_degree_name,resolved_name} CSV into the flat
 * duplicates JSON the indexer reads. Rows without a resolution are skipped.
 */
public class DuplicatesCsvConverter {

    private static final Logger log = LoggerFactory.getLogger(DuplicatesCsvConverter.class);

    private final CsvMapper csvMapper = new CsvMapper();
    private final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public Map<String, String> read(Path csvFile) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        Map<String, String> mapping = new LinkedHashMap<>();
        try (MappingIterator<Map<String, String>> rows = csvMapper.readerFor(Map.class).with(schema).readValues(csvFile.toFile())) {
            int line = 1;
            while (rows.hasNext()) {
                Map<String, String> row = rows.next();
                line++;
                if (!row.containsKey(ConfigLoader.RAW_NAME_FIELD) || !row.containsKey(ConfigLoader.RESOLVED_NAME_FIELD)) {
                    throw new InvalidConfigurationException("Row " + line + " of " + csvFile + " lacks '"
                            + ConfigLoader.RAW_NAME_FIELD + "' or '" + ConfigLoader.RESOLVED_NAME_FIELD + "'");
                }
                String raw = row.get(ConfigLoader.RAW_NAME_FIELD).strip();
                String resolved = row.get(ConfigLoader.RESOLVED_NAME_FIELD).strip();
                if (!resolved.isEmpty()) {
                    mapping.put(raw, resolved);
                }
            }
        }
        return mapping;
    }

    /**
     * @return number of entries written
     */
    public int convert(Path csvFile, Path jsonFile) throws IOException {
        Map<String, String> mapping = read(csvFile);
        FileWriteUtil.safeWriteString(jsonFile, jsonMapper.writeValueAsString(mapping));
        log.info("Saved: {} ({} entries)", jsonFile, mapping.size());
        return mapping.size();
    }
}
