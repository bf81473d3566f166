package com.platform.driftengine.detect;

import com.platform.driftengine.domain.DriftRunResult;
import com.platform.driftengine.domain.TableRef;

/**
 * Everything a detector needs to know about the run besides monitors and data.
 *
 * @param run a {@code pending} run the detector drives to a terminal state
 */
public record DriftRunContext(
        DriftRunResult run,
        String tenantId,
        TableRef table,
        int timeTravelDays
) {
    public String datasetId() {
        return run.getDatasetId();
    }
}
