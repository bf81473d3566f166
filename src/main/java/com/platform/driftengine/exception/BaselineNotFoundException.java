package com.platform.driftengine.exception;

public class BaselineNotFoundException extends DriftEngineException {

    public BaselineNotFoundException(String tenantId, String datasetId) {
        super("BASELINE_NOT_FOUND", "No baseline for tenant " + tenantId + ", dataset " + datasetId);
    }
}
