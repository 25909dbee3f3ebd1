package com.catalog.indexer.parser;

import com.catalog.indexer.model.ClassifiedCourseRow;
import com.catalog.indexer.model.PatternId;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for course row classification and pattern precedence.
 */
class CourseRowClassifierTest {

    private final CourseRowClassifier classifier = new CourseRowClassifier();

    @Test
    void testFullRowCapturesAllFields() {
        ClassifiedCourseRow row = classifier.classify("BUS 1010 C100 Intro to Business 3 1").orElseThrow();

        assertThat(row.getPatternId()).isEqualTo(PatternId.CCN_FULL);
        assertThat(row.getDepartment()).isEqualTo("BUS");
        assertThat(row.getNumber()).isEqualTo("1010");
        assertThat(row.getCode()).isEqualTo("C100");
        assertThat(row.getTitle()).isEqualTo("Intro to Business");
        assertThat(row.getCreditUnits()).isEqualTo(3);
        assertThat(row.getTerm()).isEqualTo(1);
    }

    @Test
    void testCodeOnlyRow() {
        ClassifiedCourseRow row = classifier.classify("C714 Project Management 4 2").orElseThrow();

        assertThat(row.getPatternId()).isEqualTo(PatternId.CODE_ONLY);
        assertThat(row.getDepartment()).isNull();
        assertThat(row.getNumber()).isNull();
        assertThat(row.code()).contains("C714");
        assertThat(row.getTitle()).isEqualTo("Project Management");
        assertThat(row.getCreditUnits()).isEqualTo(4);
        assertThat(row.getTerm()).isEqualTo(2);
    }

    @Test
    void testFallbackRowHasNoCode() {
        ClassifiedCourseRow row = classifier.classify("Capstone Project 4 3").orElseThrow();

        assertThat(row.getPatternId()).isEqualTo(PatternId.FALLBACK);
        assertThat(row.hasCode()).isFalse();
        assertThat(row.code()).isEmpty();
        assertThat(row.getTitle()).isEqualTo("Capstone Project");
    }

    @Test
    void testFullRowWinsOverCodeOnly() {
        // CODE_ONLY alone would read "BUS" as the code
        assertThat(PatternId.CODE_ONLY.getPattern().matcher("BUS 1010 C100 Intro 3 1").matches()).isTrue();

        ClassifiedCourseRow row = classifier.classify("BUS 1010 C100 Intro 3 1").orElseThrow();
        assertThat(row.getPatternId()).isEqualTo(PatternId.CCN_FULL);
        assertThat(row.getCode()).isEqualTo("C100");
    }

    @Test
    void testMatchOrder() {
        assertThat(CourseRowClassifier.MATCH_ORDER)
                .containsExactly(PatternId.CCN_FULL, PatternId.CODE_ONLY, PatternId.FALLBACK);
    }

    @ParameterizedTest
    @CsvSource({
            "'ACCT 2010 C200 Financial Accounting 3 1', CCN_FULL",
            "'C200 Financial Accounting 3 1', CODE_ONLY",
            "'D072 Fundamentals for Success in Business 3 1', CODE_ONLY",
            "'Financial Accounting 3 1', FALLBACK",
            "'Orientation 0 1', FALLBACK"
    })
    void testPatternSelection(String row, PatternId expected) {
        assertThat(classifier.classify(row)).map(ClassifiedCourseRow::getPatternId).contains(expected);
    }

    @Test
    void testNoBreakSpaceSeparatesFields() {
        ClassifiedCourseRow row = classifier.classify("C100 Intro to Business 3\u00a01").orElseThrow();

        assertThat(row.getPatternId()).isEqualTo(PatternId.CODE_ONLY);
        assertThat(row.getTitle()).isEqualTo("Intro to Business");
        assertThat(row.getCreditUnits()).isEqualTo(3);
        assertThat(row.getTerm()).isEqualTo(1);

        assertThat(classifier.classify("BUS\u00a01010 C100 Intro to Business 3 1"))
                .map(ClassifiedCourseRow::getPatternId).contains(PatternId.CCN_FULL);
    }

    @Test
    void testRowWithoutTrailingCountsIsUnmatched() {
        assertThat(classifier.classify("Special Topics Seminar abc 3")).isEmpty();
        assertThat(classifier.classify("Program Description")).isEmpty();
    }

    @Test
    void testOversizedCountIsUnmatched() {
        Optional<ClassifiedCourseRow> row = classifier.classify("C100 Intro to Business 99999999999 1");

        assertThat(row).isEmpty();
    }
}
