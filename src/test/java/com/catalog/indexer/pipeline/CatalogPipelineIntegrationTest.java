package com.catalog.indexer.pipeline;

import com.catalog.indexer.config.CatalogConfig;
import com.catalog.indexer.config.ConfigLoader;
import com.catalog.indexer.config.ConfigPaths;
import com.catalog.indexer.config.OutputLayout;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for a complete indexing run over two catalogs: one without a
 * program listing (upward scan) and one with front-matter program names.
 */
class CatalogPipelineIntegrationTest {

    private static final String CCN = "CCN Course Number Course Description CUs Term";

    @TempDir
    Path tempDir;

    private Path textDir;
    private Path outputDir;
    private Path duplicates;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() throws IOException {
        textDir = tempDir.resolve("text");
        outputDir = tempDir.resolve("outputs");
        Files.createDirectories(textDir);

        Files.writeString(textDir.resolve("catalog_2018_07.txt"), String.join("\n",
                "College of Business",
                "B.S. Business Management",
                CCN,
                "BUS 1010 C100 Intro to Business 3 1",
                "© 2018 Western University"));

        Files.writeString(textDir.resolve("catalog_2019_01.txt"), String.join("\n",
                "School of Business",
                "  B.S. Accounting",
                "Program Outcomes",
                CCN,
                "ACCT 2010 C200 Financial Accounting 3 1",
                "C100 Introduction to Business 3 1",
                "© 2019 Western University"));

        Files.writeString(textDir.resolve("notes.txt"), "not a catalog");

        duplicates = tempDir.resolve("degree_duplicates.json");
        Files.writeString(duplicates, "{}");
    }

    private PipelineResult run(String snapshotsJson) throws IOException {
        Path snapshots = tempDir.resolve("college_snapshots.json");
        Files.writeString(snapshots, snapshotsJson);
        CatalogConfig config = new ConfigLoader().load(ConfigPaths.builder()
                .textDir(textDir)
                .collegeSnapshots(snapshots)
                .degreeDuplicates(duplicates)
                .outputDir(outputDir)
                .build());
        return new CatalogPipeline(config).run();
    }

    @Test
    void testIndexesBothCatalogs() throws IOException {
        PipelineResult result = run("""
                {"2017-01": ["College of Business"], "2019-01": ["School of Business"]}
                """);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getCatalogsProcessed()).isEqualTo(2);
        assertThat(result.getSectionsIndexed()).isEqualTo(2);
        assertThat(result.getSectionFailures()).isZero();
        assertThat(result.getDegreeSnapshots()).isEqualTo(1);
        assertThat(result.getCourseCodes()).isEqualTo(2);
        assertThat(result.getAnomalies()).isZero();
        assertThat(result.getDateSummaries()).extracting(DateSummary::getCatalogDate, DateSummary::isUpwardScan)
                .containsExactly(tuple("2018-07", true), tuple("2019-01", false));
        assertThat(result.getDiagnostics().getInfos()).anyMatch(i -> i.startsWith("2018-07"));
    }

    @Test
    void testWritesSectionsIndex() throws IOException {
        run("{\"2017-01\": [\"College of Business\"], \"2019-01\": [\"School of Business\"]}");
        OutputLayout layout = new OutputLayout(outputDir);

        JsonNode sections = mapper.readTree(layout.sectionsIndexFile().toFile());
        JsonNode upward = sections.path("2018-07").path("College of Business").path("B.S. Business Management");
        assertThat(upward.get(0).asInt()).isEqualTo(2);
        assertThat(upward.get(1).asInt()).isEqualTo(4);
        JsonNode heading = sections.path("2019-01").path("School of Business").path("B.S. Accounting");
        assertThat(heading.get(0).asInt()).isEqualTo(3);
        assertThat(heading.get(1).asInt()).isEqualTo(6);
    }

    @Test
    void testWritesProgramNamesAndDegreeSnapshotsOnlyForListedCatalogs() throws IOException {
        run("{\"2017-01\": [\"College of Business\"], \"2019-01\": [\"School of Business\"]}");
        OutputLayout layout = new OutputLayout(outputDir);

        assertThat(layout.programNamesFile("2019-01")).exists();
        assertThat(layout.programNamesFile("2018-07")).doesNotExist();

        JsonNode snapshots = mapper.readTree(layout.degreeSnapshotsFile().toFile());
        assertThat(snapshots.has("2018-07")).isFalse();
        assertThat(snapshots.path("2019-01").path("School of Business").get(0).asText()).isEqualTo("B.S. Accounting");
    }

    @Test
    void testWritesCourseIndexWithFirstSightingTitle() throws IOException {
        run("{\"2017-01\": [\"College of Business\"], \"2019-01\": [\"School of Business\"]}");
        OutputLayout layout = new OutputLayout(outputDir);

        JsonNode index = mapper.readTree(layout.courseIndexFile().toFile());
        JsonNode c100 = index.get("C100");
        assertThat(c100.get("canonical_title").asText()).isEqualTo("Intro to Business");
        assertThat(c100.get("canonical_cus").asInt()).isEqualTo(3);
        assertThat(c100.has("code")).isFalse();
        assertThat(c100.get("instances")).hasSize(2);
        assertThat(c100.get("instances").get(0).get("catalog_date").asText()).isEqualTo("2018-07");
        assertThat(c100.get("instances").get(0).get("pattern").asText()).isEqualTo("CCN_FULL");
        assertThat(c100.get("instances").get(1).get("pattern").asText()).isEqualTo("CODE_ONLY");
        assertThat(c100.get("instances").get(1).get("degree").asText()).isEqualTo("B.S. Accounting");
    }

    @Test
    void testWritesRowFilesAndCsvs() throws IOException {
        run("{\"2017-01\": [\"College of Business\"], \"2019-01\": [\"School of Business\"]}");
        OutputLayout layout = new OutputLayout(outputDir);

        assertThat(mapper.readTree(layout.rawRowsFile("2019-01").toFile())).hasSize(2);
        assertThat(mapper.readTree(layout.anomalyFile("2018-07").toFile())).isEmpty();

        assertThat(Files.readAllLines(layout.coursesFlatCsv())).first().isEqualTo("CourseCode,CourseName");
        assertThat(Files.readAllLines(layout.coursesFlatCsv())).hasSize(3);
        assertThat(Files.readString(layout.coursesWithCollegeCsv()))
                .startsWith("CourseCode,CourseName,Colleges")
                .contains("College of Business; School of Business");

        assertThat(Files.readString(layout.runReport())).contains("| Catalogs processed | 2 |");
    }

    @Test
    void testMissingSnapshotFailsRun() throws IOException {
        PipelineResult result = run("{\"2019-01\": [\"School of Business\"]}");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("2018-07");
    }

    @Test
    void testMissingCanonicalCollegeFailsRun() throws IOException {
        PipelineResult result = run("""
                {"2017-01": ["College of Business"], "2019-01": ["School of Business", "School of Education"]}
                """);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("School of Education");

        OutputLayout layout = new OutputLayout(outputDir);
        assertThat(layout.sectionsIndexFile()).doesNotExist();
        assertThat(layout.programNamesFile("2019-01")).doesNotExist();
        assertThat(layout.degreeSnapshotsFile()).doesNotExist();
    }

    @Test
    void testSingleUpwardScanCatalogEndToEnd() throws IOException {
        Files.delete(textDir.resolve("catalog_2019_01.txt"));
        Files.writeString(textDir.resolve("catalog_2018_07.txt"), String.join("\n",
                "College of Business",
                "Bachelor of Science, Business",
                "CCN Course Number Title CUS Term",
                "BUS 1010 C100 Intro to Business 3 1",
                "Total CUs 120"));

        PipelineResult result = run("{\"2017-01\": [\"College of Business\"]}");

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSectionsIndexed()).isEqualTo(1);
        assertThat(result.getAnomalies()).isZero();
        OutputLayout layout = new OutputLayout(outputDir);

        JsonNode section = mapper.readTree(layout.sectionsIndexFile().toFile())
                .path("2018-07").path("College of Business").path("Bachelor of Science, Business");
        assertThat(section.get(0).asInt()).isEqualTo(2);
        assertThat(section.get(1).asInt()).isEqualTo(4);

        JsonNode index = mapper.readTree(layout.courseIndexFile().toFile());
        assertThat(index.size()).isEqualTo(1);
        JsonNode c100 = index.get("C100");
        assertThat(c100.get("canonical_title").asText()).isEqualTo("Intro to Business");
        assertThat(c100.get("canonical_cus").asInt()).isEqualTo(3);
        assertThat(c100.get("instances")).hasSize(1);
        JsonNode instance = c100.get("instances").get(0);
        assertThat(instance.get("catalog_date").asText()).isEqualTo("2018-07");
        assertThat(instance.get("college").asText()).isEqualTo("College of Business");
        assertThat(instance.get("degree").asText()).isEqualTo("Bachelor of Science, Business");
        assertThat(instance.get("pattern").asText()).isEqualTo("CCN_FULL");
        assertThat(instance.get("raw").asText()).isEqualTo("BUS 1010 C100 Intro to Business 3 1");

        assertThat(mapper.readTree(layout.anomalyFile("2018-07").toFile())).isEmpty();
        assertThat(Files.readString(layout.runReport())).contains("## Notes").contains("2018-07: no program listing");
    }

    @Test
    void testEmptyTextDirFails() throws IOException {
        Files.delete(textDir.resolve("catalog_2018_07.txt"));
        Files.delete(textDir.resolve("catalog_2019_01.txt"));

        PipelineResult result = run("{\"2017-01\": [\"College of Business\"]}");

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorMessage()).contains("No catalog files");
    }
}
