package com.catalog.indexer.section;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SectionTest {

    @Test
    void testValidSection() {
        Section section = Section.of("2019-01", "School of Business", "M.B.A.", 5, 7, 12);

        assertThat(section.length()).isEqualTo(2);
    }

    @Test
    void testSectionMustEndAtOrBeforeLastLine() {
        assertThat(Section.of("2019-01", "School of Business", "M.B.A.", 5, 12, 12).getStopLine()).isEqualTo(12);
        assertThatThrownBy(() -> Section.of("2019-01", "School of Business", "M.B.A.", 5, 13, 12))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testEmptyOrInvertedSectionRejected() {
        assertThatThrownBy(() -> Section.of("2019-01", "School of Business", "M.B.A.", 5, 5, 12))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Section.of("2019-01", "School of Business", "M.B.A.", -1, 3, 12))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testBuiltIndexIsFrozen() {
        SectionsIndex.Builder builder = new SectionsIndex.Builder();
        builder.put(Section.of("2019-01", "School of Business", "M.B.A.", 5, 7, 12));
        SectionsIndex index = builder.build();

        assertThatThrownBy(() -> builder.date("2019-02")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> index.collegesOf("2019-01").clear()).isInstanceOf(UnsupportedOperationException.class);
        assertThat(index.size()).isEqualTo(1);
    }
}
