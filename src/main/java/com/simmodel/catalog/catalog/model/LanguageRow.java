package com.simmodel.catalog.catalog.model;

import java.util.Map;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One language of a model store with its translated words.
 */
@Value
@Builder
public class LanguageRow {
    int langId;
    String langCode;
    String name;
    @Singular
    Map<String, String> words;
}
