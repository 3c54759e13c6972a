package com.simmodel.catalog.catalog.store;

import java.nio.file.Path;

/**
 * Failure reported by the model store layer: open, compatibility check, read or close.
 */
public class StoreException extends Exception {

    private static final long serialVersionUID = 1L;
    private final transient Path storePath;

    public StoreException(Path storePath, String message) {
        super(message);
        this.storePath = storePath;
    }

    public StoreException(Path storePath, String message, Throwable cause) {
        super(message, cause);
        this.storePath = storePath;
    }

    public Path getStorePath() {
        return storePath;
    }
}
