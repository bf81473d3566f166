package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parser verdict. {@code config} is present only when there are no errors.
 */
public record ConfigValidation(
        List<ConfigIssue> errors,
        List<ConfigIssue> warnings,
        @JsonProperty("monitor_count") int monitorCount,
        @JsonIgnore DriftConfig config
) {
    public ConfigValidation {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public boolean valid() {
        return errors.isEmpty();
    }
}
