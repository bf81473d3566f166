package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of monitor kinds a drift config may declare.
 */
public enum MonitorKind {

    SCHEMA("schema", 0.0),
    VOLUME("volume", 3.0),
    DISTRIBUTION("distribution", 0.25),
    DATASET("dataset", 0.3);

    private final String configName;
    private final double defaultThreshold;

    MonitorKind(String configName, double defaultThreshold) {
        this.configName = configName;
        this.defaultThreshold = defaultThreshold;
    }

    @JsonValue
    public String configName() {
        return configName;
    }

    public double defaultThreshold() {
        return defaultThreshold;
    }

    public static Optional<MonitorKind> fromConfigName(String name) {
        return Arrays.stream(values())
                .filter(k -> k.configName.equals(name))
                .findFirst();
    }
}
