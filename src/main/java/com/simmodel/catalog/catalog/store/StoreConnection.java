package com.simmodel.catalog.catalog.store;

import java.nio.file.Path;

/**
 * Open connection to a single model store file.
 *
 * Implementations must tolerate repeated close calls.
 */
public interface StoreConnection extends AutoCloseable {

    Path getPath();

    @Override
    void close() throws StoreException;
}
