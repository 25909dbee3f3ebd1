package com.catalog.indexer.aggregate;

import com.catalog.indexer.model.Anomaly;
import com.catalog.indexer.model.AnomalyKind;
import com.catalog.indexer.model.CatalogDocument;
import com.catalog.indexer.model.ClassifiedCourseRow;
import com.catalog.indexer.parser.CatalogAnchor;
import com.catalog.indexer.parser.CourseRowClassifier;
import com.catalog.indexer.section.Section;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Walks every section of every catalog, classifies each course row and merges the
 * coded rows into one {@link CourseIndex}.
 * <p>
 * Documents must be fed in file-name order and sections in index order: the first
 * sighting of a code decides its canonical title and credit units.
 */
public class CourseIndexAggregator {

    private static final Logger log = LoggerFactory.getLogger(CourseIndexAggregator.class);

    private final CourseRowClassifier classifier;
    private final CourseIndex.Builder index = new CourseIndex.Builder();

    public CourseIndexAggregator(CourseRowClassifier classifier) {
        this.classifier = classifier;
    }

    public CourseIndexAggregator() {
        this(new CourseRowClassifier());
    }

    public DocumentCourses aggregate(CatalogDocument doc, List<Section> sections) {
        DocumentCourses.DocumentCoursesBuilder result = DocumentCourses.builder().catalogDate(doc.getCatalogDate());
        int indexed = 0;
        for (Section section : sections) {
            indexed += scanSection(doc, section, result);
        }
        DocumentCourses courses = result.indexedRows(indexed).build();
        log.debug("{}: {} rows, {} indexed, {} anomalies", doc.getCatalogDate(),
                courses.getRawRows().size(), indexed, courses.getAnomalies().size());
        return courses;
    }

    public CourseIndex build() {
        return index.build();
    }

    /**
     * Scans {@code [start + 1, stop)}. A repeated CCN header opens a new block and a
     * footer closes the current one until the next header.
     */
    private int scanSection(CatalogDocument doc, Section section, DocumentCourses.DocumentCoursesBuilder result) {
        int indexed = 0;
        boolean inBlock = true;
        for (int i = section.getStartLine() + 1; i < section.getStopLine(); i++) {
            String line = doc.line(i);
            if (CatalogAnchor.isCcnHeader(line)) {
                inBlock = true;
                continue;
            }
            if (CatalogAnchor.isFooter(line)) {
                inBlock = false;
                continue;
            }
            if (!inBlock || line.isEmpty()) {
                continue;
            }

            result.rawRow(line);
            Optional<ClassifiedCourseRow> classified = classifier.classify(line);
            if (classified.isPresent() && classified.get().hasCode()) {
                index.upsert(classified.get(), CourseInstance.builder()
                        .catalogDate(section.getCatalogDate())
                        .college(section.getCollege())
                        .degree(section.getDegreeName())
                        .pattern(classified.get().getPatternId())
                        .raw(line)
                        .build());
                indexed++;
            } else {
                result.anomaly(Anomaly.builder()
                        .catalogDate(section.getCatalogDate())
                        .college(section.getCollege())
                        .degree(section.getDegreeName())
                        .rawLine(line)
                        .kind(classified.isPresent() ? AnomalyKind.NO_CODE : AnomalyKind.UNMATCHED)
                        .build());
            }
        }
        return indexed;
    }
}
