package com.simmodel.catalog.cli.output;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.simmodel.catalog.catalog.RefreshResult;
import com.simmodel.catalog.catalog.model.ModelBasic;
import com.simmodel.catalog.cli.model.ValidatedCatalogOptions;

/**
 * Responsible only for printing CLI output of the catalog command.
 */
public class CatalogResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(CatalogResultsPrinter.class);

    public void printBanner(ValidatedCatalogOptions v) {
        log.info("=================================================");
        log.info("Model Catalog");
        log.info("=================================================");
        log.info("Model Directory: {}", v.getModelDir());
        log.info("Model Log Directory: {}", v.getLogDir().isEmpty() ? "None" : v.getLogDir());
        log.info("Store Extension: {}", v.getStoreExtension());
        if (v.getReportPath() != null) {
            log.info("Report File: {}", v.getReportPath());
        }
        log.info("=================================================");
    }

    public void printRefresh(RefreshResult result, List<ModelBasic> models) {
        log.info("");
        log.info("=================================================");
        log.info("CATALOG REFRESHED");
        log.info("=================================================");
        log.info("Store Files Found: {}", result.getStoresFound());
        log.info("Store Files Skipped: {}", result.getStoresSkipped());
        log.info("Duplicate Models Skipped: {}", result.getDuplicatesSkipped());
        log.info("Models: {}", result.getModelCount());
        log.info("Model Log: {}", result.isLogDirEnabled() ? result.getModelLogDir() : "disabled");
        result.getReleaseFailure().ifPresent(e -> log.warn("Previous store close error: {}", e.getMessage()));

        if (!models.isEmpty()) {
            log.info("");
            for (ModelBasic m : models) {
                log.info("  {}  {}  {}", m.getName(), m.getDigest(), m.getBinDir());
            }
        }
        log.info("=================================================");
    }

    public void printLookup(String token, ModelBasic model, List<String> languageCodes, String matchedLanguage) {
        log.info("");
        log.info("Model: {}", token);
        log.info("  Name: {}", model.getName());
        log.info("  Digest: {}", model.getDigest());
        log.info("  Bin Directory: {}", model.getBinDir());
        log.info("  Log Directory: {}", model.isLogEnabled() ? model.getLogDir() : "disabled");
        log.info("  Languages: {}", String.join(", ", languageCodes));
        if (matchedLanguage != null) {
            log.info("  Selected Language: {}", matchedLanguage);
        }
    }

    public void printNotFound(String token) {
        log.warn("Model not found by digest or name: {}", token);
    }
}
