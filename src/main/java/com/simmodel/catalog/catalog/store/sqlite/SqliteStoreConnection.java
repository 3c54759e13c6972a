package com.simmodel.catalog.catalog.store.sqlite;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;

import com.simmodel.catalog.catalog.store.StoreConnection;
import com.simmodel.catalog.catalog.store.StoreException;

/**
 * JDBC connection to a model.sqlite file.
 */
final class SqliteStoreConnection implements StoreConnection {

    private final Path path;
    private final Connection connection;

    SqliteStoreConnection(Path path, Connection connection) {
        this.path = Objects.requireNonNull(path, "path");
        this.connection = Objects.requireNonNull(connection, "connection");
    }

    @Override
    public Path getPath() {
        return path;
    }

    Connection jdbc() {
        return connection;
    }

    @Override
    public void close() throws StoreException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException(path, "Failed to close model store: " + path, e);
        }
    }
}
