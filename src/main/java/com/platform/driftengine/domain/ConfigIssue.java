package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One validation error or warning. {@code index} is the monitor position, or
 * null for issues about the config as a whole.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConfigIssue(String type, String message, Integer index) {

    public static ConfigIssue global(String type, String message) {
        return new ConfigIssue(type, message, null);
    }

    public static ConfigIssue atMonitor(int index, String type, String message) {
        return new ConfigIssue(type, message, index);
    }
}
