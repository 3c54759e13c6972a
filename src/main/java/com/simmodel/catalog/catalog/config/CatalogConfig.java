package com.simmodel.catalog.catalog.config;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration of the model catalog service.
 */
@Data
@Builder
public class CatalogConfig {

    public static final String DEFAULT_STORE_EXTENSION = ".sqlite";
    public static final int DEFAULT_MIN_SCHEMA_VERSION = 1;

    private String modelDir;
    private String modelLogDir;

    @Builder.Default
    private String storeExtension = DEFAULT_STORE_EXTENSION;
    @Builder.Default
    private int minSchemaVersion = DEFAULT_MIN_SCHEMA_VERSION;

    // service-level values reported by the admin state
    private String rootDir;
    @Builder.Default
    private long rowPageMaxSize = 100;
    @Builder.Default
    private String doubleFormat = "%.15g";
    @Builder.Default
    private int runHistoryMaxSize = 100;
    private String loginUrl;
    private String logoutUrl;

    public static CatalogConfig defaults() {
        return CatalogConfig.builder().build();
    }
}
