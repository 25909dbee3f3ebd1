package com.catalog.indexer.section;

import com.catalog.indexer.exception.CatalogIndexException;
import com.catalog.indexer.exception.MissingSectionAnchorException;
import com.catalog.indexer.exception.NoEnclosingCollegeException;
import com.catalog.indexer.model.CatalogDocument;
import com.catalog.indexer.model.ProgramNames;
import com.catalog.indexer.parser.CatalogAnchor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Locates the course listing of every degree in a catalog and accumulates the
 * results into a {@link SectionsIndex}, one document at a time.
 * <p>
 * When the front matter lists program names, each degree heading is found by exact
 * match and fenced from its first CCN header to the next sibling degree, college
 * heading or footer ({@link StopFencePolicy}). Older catalogs without such a listing
 * fall back to an upward scan from the first CCN header to the enclosing college,
 * which yields a single best-guess degree.
 * <p>
 * Missing anchors are recorded per degree or per file and never abort the run.
 */
public class SectionIndexer {

    private static final Logger log = LoggerFactory.getLogger(SectionIndexer.class);

    private final StopFencePolicy stopFencePolicy;
    private final SectionsIndex.Builder index = new SectionsIndex.Builder();

    public SectionIndexer(StopFencePolicy stopFencePolicy) {
        this.stopFencePolicy = stopFencePolicy;
    }

    public SectionIndexer() {
        this(StopFencePolicy.SIBLING_OR_COLLEGE);
    }

    /**
     * Indexes one document and adds its sections to the index under construction.
     *
     * @param validColleges the valid-college snapshot for the document's date, used by the upward scan
     */
    public DocumentSections index(CatalogDocument doc, ProgramNames programNames, List<String> validColleges) {
        index.date(doc.getCatalogDate());
        DocumentSections result = programNames.isEmpty()
                ? indexByUpwardScan(doc, validColleges)
                : indexByHeadings(doc, programNames);
        result.getSections().forEach(index::put);
        return result;
    }

    public SectionsIndex build() {
        return index.build();
    }

    DocumentSections indexByHeadings(CatalogDocument doc, ProgramNames programNames) {
        String date = doc.getCatalogDate();
        DocumentSections.DocumentSectionsBuilder result = DocumentSections.builder().catalogDate(date);

        for (String college : programNames.colleges()) {
            index.college(date, college);
            List<String> degrees = programNames.degreesOf(college);
            Set<String> siblings = new HashSet<>(degrees);

            for (String degree : degrees) {
                try {
                    Section section = fenceDegree(doc, programNames, college, degree, siblings);
                    log.debug("  {} / {} at lines {}-{}", college, degree, section.getStartLine(), section.getStopLine());
                    result.section(section);
                } catch (CatalogIndexException e) {
                    if (e.isFatal()) {
                        throw e;
                    }
                    log.warn("  {}: {}", date, e.getMessage());
                    result.failure(e);
                }
            }
        }
        return result.build();
    }

    private Section fenceDegree(CatalogDocument doc, ProgramNames programNames, String college,
                                String degree, Set<String> siblings) {
        String date = doc.getCatalogDate();
        int heading = doc.indexOf(degree::equals, 0).orElseThrow(() ->
                new MissingSectionAnchorException(date, degree, "Heading not found: " + degree));
        int start = doc.indexOf(CatalogAnchor::isCcnHeader, heading).orElseThrow(() ->
                new MissingSectionAnchorException(date, degree, "CCN header not found after heading: " + degree));

        int stop = doc.indexOf(line ->
                        (siblings.contains(line) && !line.equals(degree))
                                || (stopFencePolicy.stopsOnCollege() && programNames.isCollege(line))
                                || CatalogAnchor.isFooter(line),
                        start + 1)
                .orElse(doc.lineCount());
        return Section.of(date, college, degree, start, stop, doc.lineCount());
    }

    DocumentSections indexByUpwardScan(CatalogDocument doc, List<String> validColleges) {
        String date = doc.getCatalogDate();
        DocumentSections.DocumentSectionsBuilder result = DocumentSections.builder()
                .catalogDate(date)
                .upwardScan(true);
        try {
            Section section = fenceFirstDegree(doc, validColleges);
            log.debug("  {} / {} (upward scan) at lines {}-{}, {} lines", section.getCollege(), section.getDegreeName(),
                    section.getStartLine(), section.getStopLine(), section.length());
            result.section(section);
        } catch (CatalogIndexException e) {
            if (e.isFatal()) {
                throw e;
            }
            log.warn("  {}: {}", date, e.getMessage());
            result.failure(e);
        }
        return result.build();
    }

    private Section fenceFirstDegree(CatalogDocument doc, List<String> validColleges) {
        String date = doc.getCatalogDate();
        int firstCcn = doc.indexOf(CatalogAnchor::isCcnHeader, 0).orElseThrow(() ->
                new MissingSectionAnchorException(date, null, "No CCN header found"));

        String college = null;
        int collegeLine = -1;
        for (int j = firstCcn; j >= 0; j--) {
            Optional<String> match = matchCollege(doc.line(j), validColleges);
            if (match.isPresent()) {
                college = match.get();
                collegeLine = j;
                break;
            }
        }
        if (college == null) {
            throw new NoEnclosingCollegeException(date, firstCcn);
        }
        index.college(date, college);

        // the degree guess must sit between the college heading and the CCN header;
        // a college heading directly above its course table names the section itself
        String degree = college;
        for (int i = collegeLine + 1; i < firstCcn; i++) {
            String line = doc.line(i);
            if (!line.isEmpty() && !CatalogAnchor.COLLEGE_HEADING.startsLine(line)) {
                degree = line;
                break;
            }
        }

        int start = firstCcn;
        int stop = doc.indexOf(line -> CatalogAnchor.COLLEGE_HEADING.startsLine(line)
                        || matchCollege(line, validColleges).isPresent()
                        || CatalogAnchor.isFooter(line), start + 1)
                .orElse(doc.lineCount());
        return Section.of(date, college, degree, start, stop, doc.lineCount());
    }

    /**
     * Exact match first, then the first valid college the line starts with.
     */
    static Optional<String> matchCollege(String line, List<String> validColleges) {
        if (line.isEmpty()) {
            return Optional.empty();
        }
        if (validColleges.contains(line)) {
            return Optional.of(line);
        }
        return validColleges.stream().filter(line::startsWith).findFirst();
    }
}
