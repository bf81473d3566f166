package com.platform.driftengine.detect;

import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.DriftEngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Run lifecycle and monitor fan-out shared by the detector variants.
 *
 * @param <S> per-run state handed to every monitor evaluation; must be safe for concurrent use
 */
public abstract class AbstractDriftDetector<S> implements DriftDetector {

    private static final Logger log = LoggerFactory.getLogger(AbstractDriftDetector.class);

    private final ExecutorService monitorExecutor;

    /**
     * @param monitorExecutor pool for monitor evaluation, null to evaluate on the caller thread
     */
    protected AbstractDriftDetector(ExecutorService monitorExecutor) {
        this.monitorExecutor = monitorExecutor;
    }

    @Override
    public final DriftRunResult evaluate(DriftRunContext context, List<MonitorSpec> monitors,
                                         DatasetSnapshot current, DatasetSnapshot reference) {
        DriftRunResult run = context.run();
        if (run.getStatus() == RunStatus.PENDING) {
            run.markRunning();
        }
        long start = System.nanoTime();

        S state;
        try {
            state = openRun(context, current, reference);
        } catch (DriftEngineException e) {
            log.error("Run {} could not start evaluation: {}", run.getRunId(), e.getMessage());
            run.fail(e.getMessage());
            return run;
        }

        for (DriftResult result : evaluateAll(state, monitors)) {
            run.addResult(result);
        }

        try {
            closeRun(context, state);
        } catch (DriftEngineException e) {
            // results stand, only the baseline write is lost
            log.error("Run {} failed to persist baseline: {}", run.getRunId(), e.getMessage(), e);
            run.completeWithError("Baseline not persisted: " + e.getMessage());
            return run;
        }

        run.complete();
        log.info("Run {} completed: {} monitors, {} drifted, {} ms",
                run.getRunId(), run.getTotalMonitors(), run.getDriftDetectedCount(),
                (System.nanoTime() - start) / 1_000_000);
        return run;
    }

    /**
     * Load whatever the monitors share (baselines, reference flags).
     */
    protected abstract S openRun(DriftRunContext context, DatasetSnapshot current, DatasetSnapshot reference);

    protected abstract DriftResult evaluateMonitor(S state, MonitorSpec monitor);

    /**
     * Applied to every result, error results included.
     */
    protected DriftResult decorate(S state, DriftResult result) {
        return result;
    }

    /**
     * Called after every monitor finished. Default: nothing to persist.
     */
    protected void closeRun(DriftRunContext context, S state) {
    }

    private List<DriftResult> evaluateAll(S state, List<MonitorSpec> monitors) {
        List<DriftResult> results = new ArrayList<>(monitors.size());
        if (monitorExecutor == null || monitors.size() < 2) {
            for (MonitorSpec monitor : monitors) {
                results.add(evaluateSafely(state, monitor));
            }
            return results;
        }

        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<DriftResult>> futures = new ArrayList<>(monitors.size());
        for (MonitorSpec monitor : monitors) {
            futures.add(monitorExecutor.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try {
                    return evaluateSafely(state, monitor);
                } finally {
                    MDC.clear();
                }
            }));
        }
        for (int i = 0; i < futures.size(); i++) {
            results.add(await(futures.get(i), monitors.get(i)));
        }
        return results;
    }

    private DriftResult await(Future<DriftResult> future, MonitorSpec monitor) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DriftResult.error(monitor, "Evaluation interrupted");
        } catch (ExecutionException e) {
            log.warn("Monitor {} evaluation failed: {}", monitor.name(), e.getCause().getMessage());
            return DriftResult.error(monitor, "Evaluation failed: " + e.getCause().getMessage());
        }
    }

    private DriftResult evaluateSafely(S state, MonitorSpec monitor) {
        try {
            DriftResult result = decorate(state, evaluateMonitor(state, monitor));
            log.debug("Monitor {} ({}): detected={} metric={} threshold={}",
                    monitor.name(), monitor.kind().configName(), result.detected(),
                    result.metricValue(), result.threshold());
            return result;
        } catch (Exception e) {
            log.warn("Monitor {} evaluation failed: {}", monitor.name(), e.getMessage());
            return decorate(state, DriftResult.error(monitor, "Evaluation failed: " + e.getMessage()));
        }
    }
}
