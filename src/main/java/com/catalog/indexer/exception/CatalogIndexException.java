package com.catalog.indexer.exception;

/**
 * Base type for every failure raised while indexing catalog files.
 * Subclasses say whether the failure is local to one file or degree
 * ({@link #isFatal()} false) or invalidates the whole run.
 */
public abstract class CatalogIndexException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected CatalogIndexException(String message) {
        super(message);
    }

    protected CatalogIndexException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isFatal();
}
