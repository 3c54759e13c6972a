package com.simmodel.catalog.catalog.model;

import lombok.Value;

/**
 * Configured directory and whether it exists and can be used.
 */
@Value
public class DirSetting {
    String path;
    boolean enabled;
}
