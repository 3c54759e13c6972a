package com.simmodel.catalog.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Basic model row as stored in a model store: identity, version and default language.
 */
@Value
@Builder
public class ModelDicRow {
    int modelId;
    String name;
    String digest;
    int type;
    String version;
    String createDateTime;
    String defaultLangCode;
}
