package com.simmodel.catalog.admin;

import com.simmodel.catalog.catalog.model.ModelCatalogConfig;
import com.simmodel.catalog.catalog.model.ModelCatalogState;

import lombok.Builder;
import lombok.Value;

/**
 * Public service state: service configuration and model catalog state.
 */
@Value
@Builder
public class ServiceState {
    String rootDir;
    long rowPageMaxSize;
    String doubleFormat;
    int runHistoryMaxSize;
    String loginUrl;
    String logoutUrl;
    ModelCatalogConfig modelCatalogConfig;
    ModelCatalogState modelCatalogState;
}
