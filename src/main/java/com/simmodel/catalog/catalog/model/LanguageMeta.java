package com.simmodel.catalog.catalog.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Language metadata of a model store, in store order.
 */
@Value
@Builder
public class LanguageMeta {

    @Singular
    List<LanguageRow> languages;

    public List<String> getCodes() {
        return languages.stream().map(LanguageRow::getLangCode).toList();
    }

    public boolean isEmpty() {
        return languages.isEmpty();
    }
}
