package com.catalog.indexer.exception;

/**
 * No snapshot version is less than or equal to the requested catalog date.
 */
public class NoApplicableSnapshotException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    private final String catalogDate;

    public NoApplicableSnapshotException(String catalogDate) {
        super("No snapshot version found for " + catalogDate);
        this.catalogDate = catalogDate;
    }

    public String getCatalogDate() {
        return catalogDate;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
