package com.simmodel.catalog.catalog.store;

import java.util.List;

import com.simmodel.catalog.catalog.model.LanguageMeta;
import com.simmodel.catalog.catalog.model.ModelDicRow;

import lombok.NonNull;
import lombok.Value;

/**
 * A store that opened, passed the compatibility check and has models and languages.
 * The handle is still open and owned by whoever holds this record.
 */
@Value
public class ProbedStore {
    @NonNull
    StoreHandle handle;
    @NonNull
    List<ModelDicRow> models;
    @NonNull
    LanguageMeta languages;
}
