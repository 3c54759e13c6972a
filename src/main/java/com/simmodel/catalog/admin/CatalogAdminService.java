package com.simmodel.catalog.admin;

import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.catalog.CatalogException;
import com.simmodel.catalog.catalog.ModelCatalog;
import com.simmodel.catalog.catalog.RefreshResult;
import com.simmodel.catalog.catalog.config.CatalogConfig;
import com.simmodel.catalog.catalog.model.DirSetting;
import com.simmodel.catalog.catalog.store.StoreException;

/**
 * Administrative operations over the model catalog: service state, reload and close.
 */
public class CatalogAdminService {

    private static final Logger log = LoggerFactory.getLogger(CatalogAdminService.class);

    private final CatalogConfig config;
    private final ModelCatalog catalog;

    public CatalogAdminService(CatalogConfig config, ModelCatalog catalog) {
        this.config = Objects.requireNonNull(config, "config");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public ServiceState serviceState() {
        return ServiceState.builder()
                .rootDir(config.getRootDir())
                .rowPageMaxSize(config.getRowPageMaxSize())
                .doubleFormat(config.getDoubleFormat())
                .runHistoryMaxSize(config.getRunHistoryMaxSize())
                .loginUrl(config.getLoginUrl())
                .logoutUrl(config.getLogoutUrl())
                .modelCatalogConfig(catalog.toPublicConfig())
                .modelCatalogState(catalog.toPublicState())
                .build();
    }

    /**
     * Reload the catalog from the current model directory and model log directory.
     *
     * @throws CatalogException if model directory is not set yet or refresh failed
     */
    public RefreshResult refreshAll() throws CatalogException {

        DirSetting modelDir = catalog.getModelDir();
        if (modelDir.getPath() == null || modelDir.getPath().isEmpty()) {
            log.error("Failed to refresh models catalog: path to model directory cannot be empty");
            throw new CatalogException("Failed to refresh models catalog: path to model directory cannot be empty");
        }
        log.info("Model directory: {}", modelDir.getPath());

        DirSetting logDir = catalog.getModelLogDir();
        try {
            RefreshResult result = catalog.refresh(modelDir.getPath(), logDir.getPath());
            result.getReleaseFailure().ifPresent(e ->
                    log.warn("Models catalog refreshed with close error: {}", e.getMessage()));
            return result;
        } catch (CatalogException e) {
            log.error("Failed to refresh models catalog: {} : {}", modelDir.getPath(), e.getMessage());
            throw e;
        }
    }

    /**
     * Close all model stores and clear the catalog.
     *
     * @return first close error, if any
     */
    public Optional<StoreException> closeAll() {
        DirSetting modelDir = catalog.getModelDir();

        Optional<StoreException> err = catalog.close();
        err.ifPresent(e -> log.error("Failed to close models catalog: {} : {}", modelDir.getPath(), e.getMessage()));
        return err;
    }
}
