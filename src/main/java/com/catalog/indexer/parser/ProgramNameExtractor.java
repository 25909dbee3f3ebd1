package com.catalog.indexer.parser;

import com.catalog.indexer.model.CatalogDocument;
import com.catalog.indexer.model.ProgramNames;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Lists degree names per college from the front matter of a catalog, i.e. the
 * lines before the first CCN header.
 * <p>
 * A "School of ..." line opens a college and starts collecting; a course break,
 * "Program Outcomes", a footer line or the next college closes it. Collected lines
 * that look like steps, numbered items or bullets are skipped.
 */
public class ProgramNameExtractor {

    private static final Logger log = LoggerFactory.getLogger(ProgramNameExtractor.class);

    static final Pattern NOISE = Pattern.compile("^(Steps|[0-9]|[•\\-])");

    public ProgramNames extract(CatalogDocument doc) {
        OptionalInt firstCcn = doc.indexOf(CatalogAnchor::isCcnHeader, 0);
        if (firstCcn.isEmpty()) {
            log.debug("{}: no CCN header, no front matter to scan", doc.getCatalogDate());
            return ProgramNames.empty(doc.getCatalogDate());
        }

        ProgramNames.Builder result = new ProgramNames.Builder(doc.getCatalogDate());
        String currentCollege = null;
        List<String> buffer = new ArrayList<>();
        boolean collecting = false;

        for (String line : doc.getLines().subList(0, firstCcn.getAsInt())) {
            if (line.isEmpty()) {
                continue;
            }
            if (CatalogAnchor.SCHOOL_OF.startsLine(line)) {
                flush(result, currentCollege, buffer);
                currentCollege = line;
                buffer = new ArrayList<>();
                collecting = true;
                continue;
            }
            if (closesCollege(line)) {
                flush(result, currentCollege, buffer);
                currentCollege = null;
                buffer = new ArrayList<>();
                collecting = false;
                continue;
            }
            if (collecting && !NOISE.matcher(line).lookingAt()) {
                buffer.add(line);
            }
        }
        flush(result, currentCollege, buffer);

        ProgramNames names = result.build();
        log.debug("{}: {} colleges, {} degree names in front matter",
                doc.getCatalogDate(), names.colleges().size(), names.degreeCount());
        return names;
    }

    private static boolean closesCollege(String line) {
        return CatalogAnchor.COURSES_SECTION_BREAK.startsLine(line)
                || CatalogAnchor.PROGRAM_OUTCOMES.startsLine(line)
                || CatalogAnchor.FOOTER_COPYRIGHT.startsLine(line)
                || CatalogAnchor.FOOTER_TOTAL_CUS.startsLine(line);
    }

    private static void flush(ProgramNames.Builder result, String college, List<String> buffer) {
        if (college != null && !buffer.isEmpty()) {
            result.addAll(college, buffer);
        }
    }
}
