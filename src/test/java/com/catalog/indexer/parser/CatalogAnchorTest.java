package com.catalog.indexer.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CatalogAnchorTest {

    @Test
    void testCcnHeaderIsCaseInsensitiveAndUnanchored() {
        assertThat(CatalogAnchor.isCcnHeader("CCN Course Number Course Description CUs Term")).isTrue();
        assertThat(CatalogAnchor.isCcnHeader("Course list: ccn / course number")).isTrue();
        assertThat(CatalogAnchor.isCcnHeader("Course Number CCN")).isFalse();
    }

    @Test
    void testFootersMatchAnywhere() {
        assertThat(CatalogAnchor.isFooter("© Western University 2019")).isTrue();
        assertThat(CatalogAnchor.isFooter("Program Total CUs 120")).isTrue();
        assertThat(CatalogAnchor.isFooter("Total Credits")).isFalse();
    }

    @Test
    void testStartsLineRequiresLeadingMatch() {
        assertThat(CatalogAnchor.FOOTER_TOTAL_CUS.startsLine("Total CUs 120")).isTrue();
        assertThat(CatalogAnchor.FOOTER_TOTAL_CUS.startsLine("Program Total CUs 120")).isFalse();
        assertThat(CatalogAnchor.PROGRAM_OUTCOMES.startsLine("Program Outcomes")).isTrue();
        assertThat(CatalogAnchor.PROGRAM_OUTCOMES.startsLine("Program Outcomes and more")).isFalse();
    }

    @Test
    void testCollegeHeading() {
        assertThat(CatalogAnchor.COLLEGE_HEADING.startsLine("College of Business")).isTrue();
        assertThat(CatalogAnchor.COLLEGE_HEADING.startsLine("School of Education")).isTrue();
        assertThat(CatalogAnchor.COLLEGE_HEADING.startsLine("Teachers College")).isFalse();
    }
}
