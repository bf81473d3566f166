package com.platform.driftengine.monitor;

import com.platform.driftengine.domain.MonitorKind;
import com.platform.driftengine.domain.StatTest;

/**
 * Threshold given to a monitor that declares none. Detectors compare volume on
 * different scales, so each supplies its own defaults.
 */
@FunctionalInterface
public interface ThresholdDefaults {

    /**
     * Z-score for volume, the test's own default for distribution, the kind's default otherwise.
     */
    ThresholdDefaults STANDARD = (kind, statTest) -> {
        if (kind == MonitorKind.DISTRIBUTION && statTest != null) {
            return statTest.defaultThreshold();
        }
        return kind.defaultThreshold();
    };

    /**
     * @param statTest declared test, null when none or unknown
     */
    double thresholdFor(MonitorKind kind, StatTest statTest);
}
