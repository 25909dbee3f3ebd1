package com.catalog.indexer.exception;

/**
 * Scanning upward from the first CCN header found no valid college heading.
 */
public class NoEnclosingCollegeException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    private final String catalogDate;
    private final int ccnLine;

    public NoEnclosingCollegeException(String catalogDate, int ccnLine) {
        super("No valid college header found above CCN header at line " + ccnLine + " in " + catalogDate);
        this.catalogDate = catalogDate;
        this.ccnLine = ccnLine;
    }

    public String getCatalogDate() {
        return catalogDate;
    }

    public int getCcnLine() {
        return ccnLine;
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
