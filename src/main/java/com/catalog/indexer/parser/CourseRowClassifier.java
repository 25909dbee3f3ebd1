package com.catalog.indexer.parser;

import com.catalog.indexer.model.ClassifiedCourseRow;
import com.catalog.indexer.model.PatternId;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * Classifies a single course row. Patterns are tried in {@link #MATCH_ORDER} and the
 * first one that matches wins, so a row that fits several layouts always gets the
 * most specific one.
 */
public class CourseRowClassifier {

    private static final Logger log = LoggerFactory.getLogger(CourseRowClassifier.class);

    static final List<PatternId> MATCH_ORDER = List.of(PatternId.CCN_FULL, PatternId.CODE_ONLY, PatternId.FALLBACK);

    /**
     * @return the classified row, or empty when no pattern matches (the row is an anomaly)
     */
    public Optional<ClassifiedCourseRow> classify(String row) {
        for (PatternId id : MATCH_ORDER) {
            Matcher m = id.getPattern().matcher(row);
            if (!m.matches()) {
                continue;
            }
            try {
                return Optional.of(capture(id, m, row));
            } catch (NumberFormatException e) {
                // credit or term field too large for an int
                log.debug("Row matched {} but has an unparseable count: {}", id, row);
            }
        }
        return Optional.empty();
    }

    private ClassifiedCourseRow capture(PatternId id, Matcher m, String row) {
        ClassifiedCourseRow.ClassifiedCourseRowBuilder b = ClassifiedCourseRow.builder()
                .rawLine(row)
                .patternId(id);
        return switch (id) {
            case CCN_FULL -> b.department(m.group(1))
                    .number(m.group(2))
                    .code(m.group(3))
                    .title(m.group(4))
                    .creditUnits(Integer.parseInt(m.group(5)))
                    .term(Integer.parseInt(m.group(6)))
                    .build();
            case CODE_ONLY -> b.code(m.group(1))
                    .title(m.group(2))
                    .creditUnits(Integer.parseInt(m.group(3)))
                    .term(Integer.parseInt(m.group(4)))
                    .build();
            case FALLBACK -> b.title(m.group(1))
                    .creditUnits(Integer.parseInt(m.group(2)))
                    .term(Integer.parseInt(m.group(3)))
                    .build();
        };
    }
}
