package com.simmodel.catalog.catalog.model;

import java.util.List;

import com.simmodel.catalog.catalog.language.LanguageMatcher;
import com.simmodel.catalog.catalog.store.StoreHandle;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One unique model in the registry.
 *
 * The store handle is shared with other entries from the same store file and is released
 * by the catalog when the entry is retired.
 */
@Value
@Builder
public class RegistryEntry {
    @NonNull
    ModelDicRow model;
    @NonNull
    StoreHandle store;
    String binDir;
    String logDir;
    boolean logEnabled;
    /** Default language first, then the others in store order. */
    @NonNull
    List<String> languageCodes;
    @NonNull
    LanguageMeta languageMeta;
    @NonNull
    LanguageMatcher languageMatcher;
    boolean metaFull;

    public String getDigest() {
        return model.getDigest();
    }

    public String getName() {
        return model.getName();
    }

    public ModelBasic toBasic() {
        return ModelBasic.builder()
                .name(getName())
                .digest(getDigest())
                .binDir(binDir)
                .logDir(logDir)
                .logEnabled(logEnabled)
                .build();
    }
}
