package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one monitor within a run.
 *
 * @param details kind-specific evidence (added/removed columns, counts, p-value, PSI ...)
 */
public record DriftResult(
        @JsonProperty("monitor_name") String monitorName,
        @JsonProperty("drift_type") MonitorKind driftType,
        boolean detected,
        Severity severity,
        @JsonProperty("metric_value") Double metricValue,
        Double threshold,
        Map<String, Object> details,
        String message
) {
    public DriftResult {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Result recorded when a monitor's evaluation throws. Never counts as drift.
     */
    public static DriftResult error(MonitorSpec monitor, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (monitor.column() != null) {
            details.put("column", monitor.column());
        }
        return new DriftResult(monitor.name(), monitor.kind(), false, Severity.ERROR,
                null, monitor.threshold(), details, message);
    }

    /**
     * Result of a monitor whose baseline did not exist yet and was just established.
     */
    public static DriftResult baselineEstablished(MonitorSpec monitor, Double metricValue,
                                                  Map<String, Object> details, String message) {
        Map<String, Object> d = new LinkedHashMap<>(details);
        d.put("baseline_established", true);
        return new DriftResult(monitor.name(), monitor.kind(), false, Severity.INFO,
                metricValue, monitor.threshold(), d, message);
    }
}
