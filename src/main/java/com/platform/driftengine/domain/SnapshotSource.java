package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a snapshot was obtained. {@link #CURRENT_FALLBACK} marks a reference
 * request that could not be served historically and returned current data.
 */
public enum SnapshotSource {
    CURRENT, TIME_TRAVEL, CURRENT_FALLBACK;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
