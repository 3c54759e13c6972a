package com.simmodel.catalog.catalog.service;

import java.util.List;

import com.simmodel.catalog.catalog.model.RegistryEntry;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * New registry content produced by a catalog build, not yet installed.
 */
@Value
@Builder
public class CatalogBuildResult {
    @NonNull
    @Singular
    List<RegistryEntry> entries;
    int storesFound;
    int storesSkipped;
    int duplicatesSkipped;
}
