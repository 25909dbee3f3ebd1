package com.catalog.indexer.output;

import com.catalog.indexer.aggregate.CourseIndex;
import com.catalog.indexer.aggregate.CourseIndexEntry;
import com.catalog.indexer.config.OutputLayout;
import com.catalog.indexer.model.DegreeSnapshot;
import com.catalog.indexer.model.ProgramNames;
import com.catalog.indexer.section.Section;
import com.catalog.indexer.section.SectionsIndex;
import com.catalog.indexer.util.FileWriteUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes the run's indexes to JSON and CSV under an {@link OutputLayout}.
 * Every write replaces the previous file.
 */
public class IndexOutputWriter {

    private static final Logger log = LoggerFactory.getLogger(IndexOutputWriter.class);

    private final OutputLayout layout;
    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;
    private final List<Path> written = new ArrayList<>();

    public IndexOutputWriter(OutputLayout layout) {
        this.layout = layout;
        this.jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        this.csvMapper = new CsvMapper();
    }

    public void writeProgramNames(ProgramNames names) throws IOException {
        writeJson(layout.programNamesFile(names.getCatalogDate()), names.getByCollege());
    }

    public void writeRawRows(String catalogDate, List<String> rows) throws IOException {
        writeJson(layout.rawRowsFile(catalogDate), rows);
    }

    public void writeAnomalies(String catalogDate, List<String> anomalyLines) throws IOException {
        writeJson(layout.anomalyFile(catalogDate), anomalyLines);
    }

    /**
     * {@code {date: {college: {degree: [start, stop]}}}}
     */
    public void writeSectionsIndex(SectionsIndex index) throws IOException {
        Map<String, Map<String, Map<String, List<Integer>>>> out = new LinkedHashMap<>();
        for (String date : index.dates()) {
            Map<String, Map<String, List<Integer>>> colleges = new LinkedHashMap<>();
            index.collegesOf(date).forEach((college, degrees) -> {
                Map<String, List<Integer>> fences = new LinkedHashMap<>();
                for (Section s : degrees.values()) {
                    fences.put(s.getDegreeName(), List.of(s.getStartLine(), s.getStopLine()));
                }
                colleges.put(college, fences);
            });
            out.put(date, colleges);
        }
        writeJson(layout.sectionsIndexFile(), out);
    }

    public void writeDegreeSnapshots(Collection<DegreeSnapshot> snapshots) throws IOException {
        Map<String, Map<String, List<String>>> out = new LinkedHashMap<>();
        snapshots.forEach(s -> out.put(s.getCatalogDate(), s.getColleges()));
        writeJson(layout.degreeSnapshotsFile(), out);
    }

    public void writeCourseIndex(CourseIndex index) throws IOException {
        writeJson(layout.courseIndexFile(), index.asMap());
    }

    public void writeCourseCsvs(CourseIndex index) throws IOException {
        List<CourseCsvRow> flat = new ArrayList<>();
        List<CourseCollegesCsvRow> withColleges = new ArrayList<>();
        for (CourseIndexEntry entry : index.entries()) {
            String code = entry.getCode().strip();
            String title = entry.getCanonicalTitle().strip();
            flat.add(new CourseCsvRow(code, title));
            withColleges.add(new CourseCollegesCsvRow(code, title,
                    String.join(CourseCollegesCsvRow.COLLEGE_SEPARATOR, entry.colleges())));
        }
        writeCsv(layout.coursesFlatCsv(), CourseCsvRow.class, flat);
        writeCsv(layout.coursesWithCollegeCsv(), CourseCollegesCsvRow.class, withColleges);
    }

    public List<Path> getWritten() {
        return List.copyOf(written);
    }

    private void writeJson(Path file, Object value) throws IOException {
        FileWriteUtil.safeWriteString(file, jsonMapper.writeValueAsString(value));
        written.add(file);
        log.debug("Saved: {}", file);
    }

    private <T> void writeCsv(Path file, Class<T> rowType, List<T> rows) throws IOException {
        FileWriteUtil.createParentDirectories(file);
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        if (rows.isEmpty()) {
            // the generator only emits the header along with the first row
            List<String> header = new ArrayList<>();
            schema.forEach(column -> header.add(column.getName()));
            FileWriteUtil.safeWriteString(file, String.join(",", header) + "\n");
            written.add(file);
            return;
        }
        try (SequenceWriter writer = csvMapper.writer(schema).writeValues(file.toFile())) {
            writer.writeAll(rows);
        }
        written.add(file);
        log.debug("Saved: {}", file);
    }
}
