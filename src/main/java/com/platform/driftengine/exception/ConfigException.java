package com.platform.driftengine.exception;

import com.platform.driftengine.domain.ConfigIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The monitor configuration was rejected. Raised before any data is fetched.
 */
public class ConfigException extends DriftEngineException {

    private final List<ConfigIssue> issues;

    public ConfigException(List<ConfigIssue> issues) {
        super("CONFIG_ERROR", "Invalid drift configuration: " + issues.stream()
                .map(ConfigIssue::message)
                .collect(Collectors.joining("; ")));
        this.issues = List.copyOf(issues);
    }

    public List<ConfigIssue> getIssues() {
        return issues;
    }
}
