package com.platform.driftengine.detect;

import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.domain.DriftRunResult;
import com.platform.driftengine.domain.MonitorSpec;
import com.platform.driftengine.monitor.ThresholdDefaults;

import java.util.List;

/**
 * Evaluates a set of monitors over one run's data.
 * <p>
 * Results come back in monitor order. A monitor that throws yields an
 * {@code error} result and does not stop the run.
 */
public interface DriftDetector {

    /**
     * @param reference time-travel snapshot, or null when {@link #requiresReference()} is false
     */
    DriftRunResult evaluate(DriftRunContext context, List<MonitorSpec> monitors,
                            DatasetSnapshot current, DatasetSnapshot reference);

    /**
     * Whether the engine has to fetch a reference snapshot before evaluation.
     */
    boolean requiresReference();

    /**
     * Thresholds for monitors configured without one, on this detector's metric scales.
     */
    default ThresholdDefaults thresholdDefaults() {
        return ThresholdDefaults.STANDARD;
    }
}
