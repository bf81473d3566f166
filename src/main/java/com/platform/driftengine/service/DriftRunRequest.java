package com.platform.driftengine.service;

import com.platform.driftengine.domain.TableRef;

import java.util.Objects;

/**
 * One invocation of the engine.
 *
 * @param config monitor configuration as YAML text
 */
public record DriftRunRequest(String tenantId, String datasetId, TableRef table, String config) {

    public DriftRunRequest {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(datasetId, "datasetId");
        Objects.requireNonNull(table, "table");
    }
}
