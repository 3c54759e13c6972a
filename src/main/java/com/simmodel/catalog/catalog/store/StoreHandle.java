package com.simmodel.catalog.catalog.store;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Store-level resource record: owns the connection shared by every registry entry read from one store.
 * Entries reference the handle, they never close the connection directly.
 */
public final class StoreHandle {

    private final StoreConnection connection;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StoreHandle(StoreConnection connection) {
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    public StoreConnection getConnection() {
        return connection;
    }

    public Path getPath() {
        return connection.getPath();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Close the underlying connection. Only the first call reaches the connection.
     */
    public void release() throws StoreException {
        if (closed.compareAndSet(false, true)) {
            connection.close();
        }
    }

    @Override
    public String toString() {
        return "StoreHandle[" + getPath() + (isClosed() ? ", closed]" : "]");
    }
}
