package com.simmodel.catalog.catalog;

import java.util.Optional;

import com.simmodel.catalog.catalog.store.StoreException;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a successful catalog refresh.
 *
 * A release failure means a previous store connection failed to close; the new catalog is installed anyway.
 */
@Value
@Builder
public class RefreshResult {
    String modelDir;
    String modelLogDir;
    boolean logDirEnabled;
    int modelCount;
    int storesFound;
    int storesSkipped;
    int duplicatesSkipped;
    int retiredModels;
    StoreException releaseError;

    public Optional<StoreException> getReleaseFailure() {
        return Optional.ofNullable(releaseError);
    }
}
