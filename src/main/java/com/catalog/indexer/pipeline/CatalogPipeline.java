package com.catalog.indexer.pipeline;

import com.catalog.indexer.aggregate.CourseIndex;
import com.catalog.indexer.aggregate.CourseIndexAggregator;
import com.catalog.indexer.aggregate.DocumentCourses;
import com.catalog.indexer.canon.DegreeCanonicalizer;
import com.catalog.indexer.config.CatalogConfig;
import com.catalog.indexer.exception.CatalogIndexException;
import com.catalog.indexer.model.CatalogDocument;
import com.catalog.indexer.model.DegreeSnapshot;
import com.catalog.indexer.model.ProgramNames;
import com.catalog.indexer.output.IndexOutputWriter;
import com.catalog.indexer.output.RunReportRenderer;
import com.catalog.indexer.parser.CourseRowClassifier;
import com.catalog.indexer.parser.ProgramNameExtractor;
import com.catalog.indexer.section.DocumentSections;
import com.catalog.indexer.section.SectionIndexer;
import com.catalog.indexer.section.SectionsIndex;
import com.catalog.indexer.snapshot.SnapshotResolver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the whole catalog indexing batch: program names, sections, degree snapshots,
 * course index, then the JSON/CSV outputs and the run report.
 * <p>
 * Missing anchors in one file only skip that degree or file. Snapshot gaps and
 * degree data that contradicts the canonical college ordering fail the run.
 */
public class CatalogPipeline {
    private static final Logger log = LoggerFactory.getLogger(CatalogPipeline.class);

    private final CatalogConfig config;
    private final CatalogDiscoveryService discoveryService;
    private final ProgramNameExtractor programNameExtractor;
    private final CourseRowClassifier classifier;

    public CatalogPipeline(CatalogConfig config) {
        this.config = config;
        this.discoveryService = new CatalogDiscoveryService();
        this.programNameExtractor = new ProgramNameExtractor();
        this.classifier = new CourseRowClassifier();
    }

    public PipelineResult run() {
        try {
            log.info("Starting catalog indexing...");
            PipelineDiagnostics diagnostics = new PipelineDiagnostics();
            IndexOutputWriter writer = new IndexOutputWriter(config.getOutput());

            List<Path> files = discoveryService.discoverCatalogFiles(config.getTextDir());
            if (files.isEmpty()) {
                return PipelineResult.failure("No catalog files found in " + config.getTextDir());
            }

            // Step 1: Program names and sections
            log.info("Step 1: Indexing sections of {} catalogs...", files.size());
            SectionIndexer indexer = new SectionIndexer(config.getStopFencePolicy());
            List<CatalogDocument> documents = new ArrayList<>();
            Map<String, ProgramNames> programNames = new LinkedHashMap<>();
            Map<String, DateSummary> summaries = new LinkedHashMap<>();
            int sectionFailures = 0;

            for (Path file : files) {
                CatalogDocument doc = CatalogDocument.load(file);
                String date = doc.getCatalogDate();
                log.info("{} ({} lines)", date, doc.lineCount());

                List<String> validColleges = SnapshotResolver.pickSnapshot(date, config.getCollegeSnapshots());
                ProgramNames names = programNameExtractor.extract(doc);

                DocumentSections sections = indexer.index(doc, names, validColleges);
                for (CatalogIndexException failure : sections.getFailures()) {
                    diagnostics.getWarnings().add(date + ": " + failure.getMessage());
                }
                sectionFailures += sections.getFailures().size();
                log.info("  {} sections, {} issues{}", sections.getSections().size(), sections.getFailures().size(),
                        sections.isUpwardScan() ? " (upward scan)" : "");

                documents.add(doc);
                programNames.put(date, names);
                summaries.put(date, DateSummary.builder()
                        .catalogDate(date)
                        .fileName(doc.getFileName())
                        .upwardScan(sections.isUpwardScan())
                        .listedDegrees(names.degreeCount())
                        .sections(sections.getSections().size())
                        .failures(sections.getFailures().size())
                        .build());
            }
            SectionsIndex sectionsIndex = indexer.build();

            // Step 2: Degree snapshots
            log.info("Step 2: Building degree snapshots...");
            DegreeCanonicalizer canonicalizer = new DegreeCanonicalizer(config.getDuplicates(), config.getCollegeOrder());
            List<DegreeSnapshot> snapshots = new ArrayList<>();
            for (ProgramNames names : programNames.values()) {
                if (names.isEmpty()) {
                    diagnostics.getInfos().add(names.getCatalogDate() + ": no program listing, no degree snapshot");
                    log.info("  {}: no program listing, degree snapshot skipped", names.getCatalogDate());
                    continue;
                }
                snapshots.add(canonicalizer.canonicalize(names));
            }

            // nothing is written until the degree data has been checked against the canonical ordering
            for (ProgramNames names : programNames.values()) {
                if (!names.isEmpty()) {
                    writer.writeProgramNames(names);
                }
            }
            writer.writeSectionsIndex(sectionsIndex);
            writer.writeDegreeSnapshots(snapshots);

            // Step 3: Course index
            log.info("Step 3: Classifying course rows...");
            CourseIndexAggregator aggregator = new CourseIndexAggregator(classifier);
            int anomalies = 0;
            for (CatalogDocument doc : documents) {
                String date = doc.getCatalogDate();
                DocumentCourses courses = aggregator.aggregate(doc, sectionsIndex.sectionsOf(date));
                writer.writeRawRows(date, courses.getRawRows());
                writer.writeAnomalies(date, courses.anomalyLines());
                anomalies += courses.getAnomalies().size();
                summaries.computeIfPresent(date, (d, s) -> s.toBuilder()
                        .rawRows(courses.getRawRows().size())
                        .indexedRows(courses.getIndexedRows())
                        .anomalies(courses.getAnomalies().size())
                        .build());
                log.info("  {}: {} rows ({} indexed, {} anomalies)", date, courses.getRawRows().size(),
                        courses.getIndexedRows(), courses.getAnomalies().size());
            }
            CourseIndex courseIndex = aggregator.build();

            // Step 4: Course outputs
            log.info("Step 4: Writing course index and CSVs...");
            writer.writeCourseIndex(courseIndex);
            writer.writeCourseCsvs(courseIndex);

            Path report = config.getOutput().runReport();
            PipelineResult result = PipelineResult.builder()
                    .success(true)
                    .catalogsProcessed(documents.size())
                    .sectionsIndexed(sectionsIndex.size())
                    .sectionFailures(sectionFailures)
                    .degreeSnapshots(snapshots.size())
                    .courseCodes(courseIndex.size())
                    .anomalies(anomalies)
                    .dateSummaries(summaries.values())
                    .outputs(writer.getWritten())
                    .output(report)
                    .diagnostics(diagnostics)
                    .build();

            // Step 5: Run report
            log.info("Step 5: Writing run report...");
            new RunReportRenderer().write(result, report);

            log.info("Catalog indexing complete!");
            return result;

        } catch (CatalogIndexException e) {
            log.error("Indexing failed: {}", e.getMessage());
            return PipelineResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Indexing failed", e);
            return PipelineResult.failure(e.getMessage());
        }
    }
}
