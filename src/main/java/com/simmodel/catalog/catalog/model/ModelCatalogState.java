package com.simmodel.catalog.catalog.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Public state of the model catalog, taken in a single lock hold.
 */
@Value
@Builder
public class ModelCatalogState {
    String modelDir;
    boolean modelDirEnabled;
    String modelLogDir;
    boolean logDirEnabled;
    @Singular
    List<String> digests;
    @Singular
    List<ModelBasic> models;
}
