package com.catalog.indexer.exception;

/**
 * A configuration input exists but does not have the expected shape.
 */
public class InvalidConfigurationException extends CatalogIndexException {

    private static final long serialVersionUID = 1L;

    public InvalidConfigurationException(String message) {
        super(message);
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
