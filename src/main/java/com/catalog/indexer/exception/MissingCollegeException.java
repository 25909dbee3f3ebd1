package com.catalog.indexer.exception;

/**
 * A college of the canonical ordering has no degrees in the observed catalog data.
 */
public class MissingCollegeException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    private final String catalogDate;
    private final String college;

    public MissingCollegeException(String catalogDate, String college) {
        super("Missing expected college '" + college + "' in " + catalogDate);
        this.catalogDate = catalogDate;
        this.college = college;
    }

    public String getCatalogDate() {
        return catalogDate;
    }

    public String getCollege() {
        return college;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
