package com.simmodel.catalog.catalog;

/**
 * Model catalog cannot be refreshed: model directory is missing, not accessible or cannot be listed.
 * The catalog state is not changed when this is thrown.
 */
public class CatalogException extends Exception {

    private static final long serialVersionUID = 1L;

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
