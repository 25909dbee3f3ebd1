package com.catalog.indexer.config;

import com.catalog.indexer.exception.InvalidConfigurationException;
import com.catalog.indexer.exception.UnrecognizedDuplicatesFormatException;
import com.catalog.indexer.model.DuplicatesMap;
import com.catalog.indexer.model.SnapshotSet;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the snapshot and duplicates files once and returns an immutable {@link CatalogConfig}.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    static final String RAW_NAME_FIELD = "raw_degree_name";
    static final String RESOLVED_NAME_FIELD = "resolved_name";

    private final ObjectMapper mapper;

    public ConfigLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ConfigLoader() {
        this(new ObjectMapper());
    }

    public CatalogConfig load(ConfigPaths paths) throws IOException {
        SnapshotSet collegeSnapshots = loadSnapshots(paths.getCollegeSnapshots());
        SnapshotSet collegeOrder = paths.getCollegeOrder() == null
                ? collegeSnapshots
                : loadSnapshots(paths.getCollegeOrder());
        DuplicatesMap duplicates = loadDuplicates(paths.getDegreeDuplicates());

        log.info("Loaded {} college snapshot versions, {} ordering versions, {} degree duplicates",
                collegeSnapshots.getVersions().size(), collegeOrder.getVersions().size(), duplicates.size());

        return CatalogConfig.builder()
                .textDir(paths.getTextDir())
                .collegeSnapshots(collegeSnapshots)
                .collegeOrder(collegeOrder)
                .duplicates(duplicates)
                .output(new OutputLayout(paths.getOutputDir()))
                .stopFencePolicy(paths.getStopFencePolicy())
                .build();
    }

    /**
     * Reads {@code {"YYYY-MM": ["College", ...], ...}}.
     */
    public SnapshotSet loadSnapshots(Path file) throws IOException {
        JsonNode root = readJson(file);
        if (!root.isObject()) {
            throw new InvalidConfigurationException("Snapshot file must be a JSON object: " + file);
        }
        Map<String, List<String>> byVersion = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isArray()) {
                throw new InvalidConfigurationException(
                        "Snapshot version '" + field.getKey() + "' is not an array in " + file);
            }
            List<String> colleges = new ArrayList<>();
            for (JsonNode college : field.getValue()) {
                if (!college.isTextual()) {
                    throw new InvalidConfigurationException(
                            "Snapshot version '" + field.getKey() + "' holds a non-string entry in " + file);
                }
                colleges.add(college.asText());
            }
            byVersion.put(field.getKey(), colleges);
        }
        SnapshotSet snapshots = SnapshotSet.of(byVersion);
        if (snapshots.isEmpty()) {
            throw new InvalidConfigurationException("Snapshot file has no versions: " + file);
        }
        return snapshots;
    }

    public DuplicatesMap loadDuplicates(Path file) throws IOException {
        return parseDuplicates(readJson(file), file.toString());
    }

    /**
     * Accepts a flat {@code {raw: canonical}} object or an array of
     * {@code {"raw_degree_name": ..., "resolved_name": ...}} records.
     *
     * @throws UnrecognizedDuplicatesFormatException for any other shape
     */
    static DuplicatesMap parseDuplicates(JsonNode root, String source) {
        Map<String, String> mapping = new LinkedHashMap<>();
        if (root.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isTextual()) {
                    throw new UnrecognizedDuplicatesFormatException(
                            "Degree duplicates entry '" + field.getKey() + "' is not a string in " + source);
                }
                mapping.put(field.getKey(), field.getValue().asText());
            }
            return DuplicatesMap.of(mapping);
        }
        if (root.isArray()) {
            for (JsonNode record : root) {
                JsonNode raw = record.get(RAW_NAME_FIELD);
                JsonNode resolved = record.get(RESOLVED_NAME_FIELD);
                if (!record.isObject() || raw == null || resolved == null || !raw.isTextual() || !resolved.isTextual()) {
                    throw new UnrecognizedDuplicatesFormatException("Unrecognized degree duplicates format in " + source
                            + ": expected records with '" + RAW_NAME_FIELD + "' and '" + RESOLVED_NAME_FIELD + "'");
                }
                mapping.put(raw.asText(), resolved.asText());
            }
            log.debug("Normalized {} duplicate records from list format", mapping.size());
            return DuplicatesMap.of(mapping);
        }
        throw new UnrecognizedDuplicatesFormatException(
                "Unrecognized degree duplicates format in " + source + ": expected an object or an array");
    }

    private JsonNode readJson(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new InvalidConfigurationException("Config file not found: " + file);
        }
        return mapper.readTree(file.toFile());
    }
}
