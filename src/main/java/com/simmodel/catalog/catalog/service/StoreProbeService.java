package com.simmodel.catalog.catalog.service;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.ModelDicRow;
import com.simmodel.catalog.catalog.store.ProbedStore;
import com.simmodel.catalog.catalog.store.StoreAccess;
import com.simmodel.catalog.catalog.store.StoreConnection;
import com.simmodel.catalog.catalog.store.StoreException;
import com.simmodel.catalog.catalog.store.StoreHandle;

import lombok.RequiredArgsConstructor;

/**
 * Opens a candidate store file and reads its models and languages.
 *
 * A store that cannot be used is logged and skipped; its connection is closed before returning.
 * Unchecked failures of the store access are handled the same way.
 */
@RequiredArgsConstructor
public class StoreProbeService {

    private static final Logger log = LoggerFactory.getLogger(StoreProbeService.class);

    private final StoreAccess storeAccess;

    /**
     * @return probed store with an open handle, or empty if store must be skipped
     */
    public Optional<ProbedStore> probe(Path path) {

        StoreConnection conn;
        try {
            conn = storeAccess.openStore(path);
        } catch (StoreException e) {
            log.error("Error: {} : {}", path, e.getMessage());
            return Optional.empty();
        }

        try {
            return inspect(path, conn);
        } catch (RuntimeException e) {
            log.error("Error: unable to read model store: {} : {}", path, e.toString());
            closeRejected(conn);
            return Optional.empty();
        }
    }

    private Optional<ProbedStore> inspect(Path path, StoreConnection conn) {

        try {
            if (!storeAccess.checkCompatibility(conn)) {
                log.warn("Invalid database, likely not a model store: {}", path);
                closeRejected(conn);
                return Optional.empty();
            }
        } catch (StoreException e) {
            log.error("Invalid database, likely not a model store: {} : {}", path, e.getMessage());
            closeRejected(conn);
            return Optional.empty();
        }

        List<ModelDicRow> models;
        try {
            models = storeAccess.listModels(conn);
        } catch (StoreException e) {
            log.warn("Empty database, no models found: {} : {}", path, e.getMessage());
            closeRejected(conn);
            return Optional.empty();
        }
        if (models == null || models.isEmpty()) {
            log.warn("Empty database, no models found: {}", path);
            closeRejected(conn);
            return Optional.empty();
        }

        LanguageMeta languages;
        try {
            languages = storeAccess.listLanguages(conn);
        } catch (StoreException e) {
            log.warn("No languages found in database: {} : {}", path, e.getMessage());
            closeRejected(conn);
            return Optional.empty();
        }
        if (languages == null || languages.isEmpty()) {
            log.warn("No languages found in database: {}", path);
            closeRejected(conn);
            return Optional.empty();
        }
        if (languages.getCodes().stream().anyMatch(c -> c == null || c.isBlank())) {
            log.warn("Invalid empty language code in database: {}", path);
            closeRejected(conn);
            return Optional.empty();
        }

        return Optional.of(new ProbedStore(new StoreHandle(conn), models, languages));
    }

    private void closeRejected(StoreConnection conn) {
        try {
            conn.close();
        } catch (StoreException e) {
            log.error("Close db connection error: {} : {}", conn.getPath(), e.getMessage());
        }
    }
}
