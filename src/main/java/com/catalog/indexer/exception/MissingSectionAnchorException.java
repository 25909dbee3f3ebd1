package com.catalog.indexer.exception;

/**
 * A degree heading or CCN header could not be located. Skips one degree or one file.
 */
public class MissingSectionAnchorException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    private final String catalogDate;
    private final String degreeName;

    public MissingSectionAnchorException(String catalogDate, String degreeName, String message) {
        super(message);
        this.catalogDate = catalogDate;
        this.degreeName = degreeName;
    }

    public String getCatalogDate() {
        return catalogDate;
    }

    public String getDegreeName() {
        return degreeName;
    }

    @Override
    public boolean isFatal() {
        return false;
    }
}
