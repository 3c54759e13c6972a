package com.simmodel.catalog.cli.model;

import java.nio.file.Path;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the command. Keeps CatalogCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedCatalogOptions {
    String modelDir;
    String logDir;
    String storeExtension;
    List<String> preferredLanguages;
    Path reportPath;
}
