package com.catalog.indexer.exception;

/**
 * The degree duplicates file is neither a flat name map nor a list of
 * {@code raw_degree_name}/{@code resolved_name} records.
 */
public class UnrecognizedDuplicatesFormatException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    public UnrecognizedDuplicatesFormatException(String message) {
        super(message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
