package com.platform.driftengine.service;

import com.platform.driftengine.detect.DriftDetector;
import com.platform.driftengine.detect.DriftRunContext;
import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.ConfigException;
import com.platform.driftengine.exception.DataFetchException;
import com.platform.driftengine.exception.InsufficientReferenceDataException;
import com.platform.driftengine.fetch.ReferenceFetcher;
import com.platform.driftengine.metrics.DriftRunMetrics;
import com.platform.driftengine.monitor.MonitorConfigParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;

/**
 * Single entry point of drift detection: parse, fetch, detect.
 * <p>
 * Invalid configs are rejected before a run exists. Once the run exists,
 * fetch failures end it as {@code failed}; everything after that is the
 * detector's business.
 */
@Service
public class DriftEngine {

    private static final Logger log = LoggerFactory.getLogger(DriftEngine.class);
    static final String MDC_RUN_ID = "run_id";

    private final MonitorConfigParser parser;
    private final ReferenceFetcher fetcher;
    private final DriftDetector detector;
    private final ExecutorService fetchExecutor;
    private final DriftRunMetrics metrics;

    @Autowired
    public DriftEngine(MonitorConfigParser parser,
                       ReferenceFetcher fetcher,
                       DriftDetector detector,
                       @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                       DriftRunMetrics metrics) {
        this.parser = parser;
        this.fetcher = fetcher;
        this.detector = detector;
        this.fetchExecutor = fetchExecutor;
        this.metrics = metrics;
    }

    public ConfigValidation validate(String yaml) {
        ConfigValidation validation = parser.parse(yaml, detector.thresholdDefaults());
        for (ConfigIssue warning : validation.warnings()) {
            log.debug("Config warning [{}]: {}", warning.type(), warning.message());
        }
        return validation;
    }

    /**
     * @throws ConfigException when the config has errors; no run is created
     */
    public DriftRunResult run(DriftRunRequest request) {
        ConfigValidation validation = validate(request.config());
        if (!validation.valid()) {
            log.warn("Rejected drift config for {}/{}: {} error(s)",
                    request.tenantId(), request.datasetId(), validation.errors().size());
            throw new ConfigException(validation.errors());
        }
        for (ConfigIssue warning : validation.warnings()) {
            log.warn("Drift config for {}/{}: {}", request.tenantId(), request.datasetId(), warning.message());
        }
        return run(request.tenantId(), request.datasetId(), request.table(), validation.config());
    }

    public DriftRunResult run(String tenantId, String datasetId, TableRef table, DriftConfig config) {
        return execute(DriftRunResult.start(datasetId), tenantId, table, config);
    }

    /**
     * Drive {@code run} from pending to a terminal status. The run is
     * {@code running} from the moment the fetches start.
     */
    DriftRunResult execute(DriftRunResult run, String tenantId, TableRef table, DriftConfig config) {
        MDC.put(MDC_RUN_ID, run.getRunId().toString());
        long start = System.nanoTime();
        try {
            fetchAndEvaluate(run, tenantId, table, config);
            metrics.recordRun(tenantId, run, Duration.ofNanos(System.nanoTime() - start));
            return run;
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private void fetchAndEvaluate(DriftRunResult run, String tenantId, TableRef table, DriftConfig config) {
        String datasetId = run.getDatasetId();
        log.info("Starting drift run {} for {}/{} on {} ({} monitors, detector={})",
                run.getRunId(), tenantId, datasetId, table, config.monitors().size(),
                detector.getClass().getSimpleName());
        run.markRunning();

        int offsetDays = config.timeTravelDays();
        CompletableFuture<DatasetSnapshot> currentFuture =
                CompletableFuture.supplyAsync(() -> fetcher.fetchCurrent(table), fetchExecutor);
        CompletableFuture<DatasetSnapshot> referenceFuture = detector.requiresReference()
                ? CompletableFuture.supplyAsync(() -> fetcher.fetchReference(table, offsetDays), fetchExecutor)
                : CompletableFuture.completedFuture(null);

        DatasetSnapshot current;
        DatasetSnapshot reference;
        try {
            current = await(currentFuture, table, null);
            reference = await(referenceFuture, table, offsetDays);
            if (reference != null && reference.isEmpty()) {
                throw new InsufficientReferenceDataException(table, offsetDays);
            }
        } catch (DataFetchException e) {
            log.error("Drift run {} failed: {}", run.getRunId(), e.getMessage());
            run.fail(describe(e));
            return;
        }

        log.debug("Fetched current ({} rows){}", current.rowCount(),
                reference == null ? "" : " and reference (" + reference.rowCount() + " rows, "
                        + reference.source() + ")");
        DriftRunContext context = new DriftRunContext(run, tenantId, table, offsetDays);
        detector.evaluate(context, config.monitors(), current, reference);
    }

    private static DatasetSnapshot await(CompletableFuture<DatasetSnapshot> future, TableRef table, Integer offsetDays) {
        try {
            return future.join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DataFetchException fetchException) {
                throw fetchException;
            }
            throw new DataFetchException(table, offsetDays,
                    "Fetch failed: " + (cause != null ? cause.getMessage() : e.getMessage()), cause);
        }
    }

    static String describe(DataFetchException e) {
        if (e instanceof InsufficientReferenceDataException) {
            return e.getMessage();
        }
        String when = e.getOffsetDays() == null ? "current data" : e.getOffsetDays() + " day(s) ago";
        return "Data fetch failed for " + e.getTable() + " (" + when + "): " + e.getMessage();
    }
}
