package com.catalog.indexer.model;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CatalogDocumentTest {

    @TempDir
    Path tempDir;

    @Test
    void testCatalogDateFromFileName() {
        assertThat(CatalogDocument.catalogDateOf("catalog_2019_01.txt")).contains("2019-01");
        assertThat(CatalogDocument.catalogDateOf("catalog_2019_1.txt")).isEmpty();
        assertThat(CatalogDocument.catalogDateOf("catalog_2019_01.txt.bak")).isEmpty();
    }

    @Test
    void testLoadTrimsLines() throws IOException {
        Path file = tempDir.resolve("catalog_2018_07.txt");
        Files.writeString(file, "  College of Business \n\tB.S. Business Management\n\n");

        CatalogDocument doc = CatalogDocument.load(file);

        assertThat(doc.getCatalogDate()).isEqualTo("2018-07");
        assertThat(doc.getLines()).containsExactly("College of Business", "B.S. Business Management", "");
        assertThat(doc.indexOf(String::isEmpty, 0)).hasValue(2);
        assertThat(doc.indexOf(String::isEmpty, 3)).isEmpty();
    }

    @Test
    void testTrimRemovesNoBreakSpaces() {
        CatalogDocument doc = CatalogDocument.of("catalog_2018_07.txt", "2018-07", List.of(
                "C100 Intro 3 1\u00a0",
                "\u00a0\u2007College of Business\u202f "));

        assertThat(doc.line(0)).isEqualTo("C100 Intro 3 1");
        assertThat(doc.line(1)).isEqualTo("College of Business");
        assertThat(CatalogDocument.trim("B.S. Accounting")).isEqualTo("B.S. Accounting");
    }

    @Test
    void testLoadRejectsOtherNames() throws IOException {
        Path file = Files.writeString(tempDir.resolve("notes.txt"), "x");

        assertThatThrownBy(() -> CatalogDocument.load(file)).isInstanceOf(IllegalArgumentException.class);
        assertThat(CatalogDocument.isCatalogFile(file)).isFalse();
    }
}
