package com.platform.driftengine.exception;

/**
 * A single monitor could not be computed. Recovered into an error result.
 */
public class MonitorEvaluationException extends DriftEngineException {

    private final String monitorName;

    public MonitorEvaluationException(String monitorName, String message) {
        super("MONITOR_EVALUATION_ERROR", message);
        this.monitorName = monitorName;
    }

    public MonitorEvaluationException(String monitorName, String message, Throwable cause) {
        super("MONITOR_EVALUATION_ERROR", message, cause);
        this.monitorName = monitorName;
    }

    public String getMonitorName() {
        return monitorName;
    }
}
