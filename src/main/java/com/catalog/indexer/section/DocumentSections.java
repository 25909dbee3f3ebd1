package com.catalog.indexer.section;

import com.catalog.indexer.exception.CatalogIndexException;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What indexing one catalog document produced: its sections and the degrees or
 * file-level anchors that could not be located.
 */
@Value
@Builder
public class DocumentSections {

    String catalogDate;

    boolean upwardScan;

    @Singular
    List<Section> sections;

    @Singular
    List<CatalogIndexException> failures;
}
