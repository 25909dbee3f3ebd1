package com.catalog.indexer.exception;

import java.util.Set;

/**
 * A certificate is listed both under a subject college and in the trailing certificates bucket.
 */
public class DuplicateCertificateException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    private final String catalogDate;
    private final Set<String> overlap;

    public DuplicateCertificateException(String catalogDate, Set<String> overlap) {
        super("Overlapping certificates in " + catalogDate + ": " + overlap);
        this.catalogDate = catalogDate;
        this.overlap = Set.copyOf(overlap);
    }

    public String getCatalogDate() {
        return catalogDate;
    }

    public Set<String> getOverlap() {
        return overlap;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
