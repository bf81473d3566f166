package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One configured drift check. Built by the config parser, never mutated.
 *
 * @param column   target column, set only for distribution monitors
 * @param statTest requested column test, null means the detector's default
 */
public record MonitorSpec(
        String name,
        MonitorKind kind,
        String column,
        double threshold,
        @JsonProperty("stat_test") StatTest statTest
) {
    public MonitorSpec {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        if (threshold < 0 || Double.isNaN(threshold)) {
            throw new IllegalArgumentException("threshold must be non-negative: " + threshold);
        }
        if (kind == MonitorKind.DISTRIBUTION && (column == null || column.isBlank())) {
            throw new IllegalArgumentException("distribution monitor '" + name + "' requires a column");
        }
    }

    public static MonitorSpec schema(String name) {
        return new MonitorSpec(name, MonitorKind.SCHEMA, null, MonitorKind.SCHEMA.defaultThreshold(), null);
    }

    public static MonitorSpec volume(String name, double threshold) {
        return new MonitorSpec(name, MonitorKind.VOLUME, null, threshold, null);
    }

    public static MonitorSpec distribution(String name, String column, double threshold) {
        return new MonitorSpec(name, MonitorKind.DISTRIBUTION, column, threshold, null);
    }

    public static MonitorSpec dataset(String name, double threshold) {
        return new MonitorSpec(name, MonitorKind.DATASET, null, threshold, null);
    }
}
