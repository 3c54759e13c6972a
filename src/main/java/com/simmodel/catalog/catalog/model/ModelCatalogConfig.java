package com.simmodel.catalog.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Public configuration of the model catalog.
 */
@Value
@Builder
public class ModelCatalogConfig {
    String modelDir;
    String modelLogDir;
    boolean logDirEnabled;
}
