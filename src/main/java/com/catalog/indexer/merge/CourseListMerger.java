package com.catalog.indexer.merge;

import com.catalog.indexer.exception.InvalidConfigurationException;
import com.catalog.indexer.output.CourseCollegesCsvRow;
import com.catalog.indexer.util.FileWriteUtil;
import com.fasterxml.jackson.core.FormatSchema;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Adds a {@code Colleges} column to an external course list by looking each
 * {@code CourseCode} up in {@code courses_with_college.csv}. Historical college
 * names are remapped to their current names first; codes without a match get
 * {@value #NOT_FOUND}.
 */
public class CourseListMerger {

    private static final Logger log = LoggerFactory.getLogger(CourseListMerger.class);

    public static final String NOT_FOUND = "NOT FOUND";
    static final String CODE_COLUMN = "CourseCode";
    static final String COLLEGES_COLUMN = "Colleges";
    static final String DEFAULT_REMAP_RESOURCE = "/college_remap.json";

    private final Map<String, String> collegeRemap;
    private final CsvMapper csvMapper = new CsvMapper();

    public CourseListMerger(Map<String, String> collegeRemap) {
        this.collegeRemap = Map.copyOf(collegeRemap);
    }

    public static Map<String, String> loadRemap(Path file) throws IOException {
        return new ObjectMapper().readValue(file.toFile(), new TypeReference<Map<String, String>>() { });
    }

    public static Map<String, String> defaultRemap() throws IOException {
        try (InputStream in = CourseListMerger.class.getResourceAsStream(DEFAULT_REMAP_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULT_REMAP_RESOURCE);
            }
            return new ObjectMapper().readValue(in, new TypeReference<Map<String, String>>() { });
        }
    }

    /**
     * Course code to remapped, sorted, {@code "; "}-joined colleges.
     */
    public Map<String, String> readCourseColleges(Path coursesWithCollege) throws IOException {
        Map<String, String> byCode = new LinkedHashMap<>();
        for (Map<String, String> row : readRows(coursesWithCollege, new ArrayList<>())) {
            String code = row.getOrDefault(CODE_COLUMN, "").strip();
            Set<String> colleges = Arrays.stream(row.getOrDefault(COLLEGES_COLUMN, "").split(";"))
                    .map(String::strip)
                    .filter(c -> !c.isEmpty())
                    .map(c -> collegeRemap.getOrDefault(c, c))
                    .collect(Collectors.toCollection(TreeSet::new));
            byCode.put(code, String.join(CourseCollegesCsvRow.COLLEGE_SEPARATOR, colleges));
        }
        return byCode;
    }

    public MergeResult merge(Path coursesWithCollege, Path courseList, Path output) throws IOException {
        Map<String, String> collegesByCode = readCourseColleges(coursesWithCollege);

        List<String> columns = new ArrayList<>();
        List<Map<String, String>> rows = readRows(courseList, columns);
        if (!columns.contains(CODE_COLUMN)) {
            throw new InvalidConfigurationException("Course list " + courseList + " has no " + CODE_COLUMN + " column");
        }
        if (!columns.contains(COLLEGES_COLUMN)) {
            columns.add(COLLEGES_COLUMN);
        }

        MergeResult.MergeResultBuilder result = MergeResult.builder().total(rows.size());
        int found = 0;
        for (Map<String, String> row : rows) {
            String code = row.getOrDefault(CODE_COLUMN, "").strip();
            String colleges = collegesByCode.get(code);
            if (colleges == null || colleges.isEmpty()) {
                log.warn("[MISSING] {} not found in college list", code);
                row.put(COLLEGES_COLUMN, NOT_FOUND);
                result.missingCode(code);
            } else {
                row.put(COLLEGES_COLUMN, colleges);
                found++;
            }
        }

        CsvSchema.Builder schema = CsvSchema.builder();
        columns.forEach(schema::addColumn);
        FileWriteUtil.createParentDirectories(output);
        try (SequenceWriter writer = csvMapper.writer(schema.build().withHeader()).writeValues(output.toFile())) {
            writer.writeAll(rows);
        }

        MergeResult merged = result.found(found).build();
        log.info("Total courses processed: {}", merged.getTotal());
        log.info("Found: {}", merged.getFound());
        log.info("Missing: {}", merged.getMissingCodes().size());
        return merged;
    }

    /**
     * Reads a headed CSV into ordered rows; header names are appended to {@code columns}.
     */
    private List<Map<String, String>> readRows(Path csv, List<String> columns) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>();
        CsvSchema headed = CsvSchema.emptySchema().withHeader();
        try (MappingIterator<Map<String, String>> it = csvMapper.readerFor(Map.class).with(headed).readValues(csv.toFile())) {
            while (it.hasNext()) {
                rows.add(new LinkedHashMap<>(it.next()));
            }
            FormatSchema schema = it.getParserSchema();
            if (schema instanceof CsvSchema) {
                for (CsvSchema.Column column : (CsvSchema) schema) {
                    columns.add(column.getName());
                }
            }
        }
        return rows;
    }
}
