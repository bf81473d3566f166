package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsed monitor configuration for one dataset.
 */
public record DriftConfig(
        @JsonProperty("time_travel_days") int timeTravelDays,
        List<MonitorSpec> monitors
) {
    public static final int DEFAULT_TIME_TRAVEL_DAYS = 1;

    public DriftConfig {
        if (timeTravelDays < 1) {
            throw new IllegalArgumentException("time_travel_days must be positive: " + timeTravelDays);
        }
        monitors = List.copyOf(monitors);
    }
}
