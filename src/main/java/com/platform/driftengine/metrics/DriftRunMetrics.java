package com.platform.driftengine.metrics;

import com.platform.driftengine.domain.DriftResult;
import com.platform.driftengine.domain.DriftRunResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Run-level meters: runs by outcome, detected drift by monitor kind, run duration.
 */
@Component
public class DriftRunMetrics {

    public static final String RUNS = "drift_engine.runs";
    public static final String DRIFT_DETECTED = "drift_engine.drift.detected";
    public static final String RUN_DURATION = "drift_engine.run.duration";

    private final MeterRegistry registry;

    public DriftRunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRun(String tenantId, DriftRunResult run, Duration elapsed) {
        String datasetId = run.getDatasetId();
        Counter.builder(RUNS)
                .description("Drift detection runs")
                .tag("tenant_id", tenantId)
                .tag("dataset_id", datasetId)
                .tag("status", run.getStatus().label())
                .register(registry)
                .increment();

        Timer.builder(RUN_DURATION)
                .description("Duration of drift detection runs, fetch included")
                .tag("tenant_id", tenantId)
                .tag("dataset_id", datasetId)
                .register(registry)
                .record(elapsed);

        for (DriftResult result : run.getResults()) {
            if (result.detected()) {
                Counter.builder(DRIFT_DETECTED)
                        .description("Monitors that detected drift")
                        .tag("tenant_id", tenantId)
                        .tag("dataset_id", datasetId)
                        .tag("drift_type", result.driftType().configName())
                        .register(registry)
                        .increment();
            }
        }
    }
}
