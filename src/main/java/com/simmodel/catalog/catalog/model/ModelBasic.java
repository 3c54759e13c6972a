package com.simmodel.catalog.catalog.model;

import lombok.Builder;
import lombok.Value;

/**
 * Shallow snapshot of a registry entry, safe to hand out: no connection, no mutable state.
 */
@Value
@Builder
public class ModelBasic {
    String name;
    String digest;
    String binDir;
    String logDir;
    boolean logEnabled;
}
