package com.platform.driftengine.detect;

import com.platform.driftengine.domain.*;
import com.platform.driftengine.stats.DriftStatistics;
import com.platform.driftengine.store.BaselineStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Compares the current snapshot against the stored baseline of the dataset.
 * <p>
 * The baseline is read once when the run opens, so every monitor sees the
 * same version. Changes the run makes (first-time establishment, a new row
 * count in the volume history, profiles of newly monitored columns) are
 * merged into a single store write after the last monitor.
 */
@Component
@ConditionalOnProperty(name = "drift-engine.detector", havingValue = "statistical", matchIfMissing = true)
public class StatisticalDriftDetector extends AbstractDriftDetector<StatisticalDriftDetector.RunState> {

    private static final Logger log = LoggerFactory.getLogger(StatisticalDriftDetector.class);

    private final BaselineStore baselineStore;
    private final int historySize;
    private final double datasetColumnThreshold;

    @Autowired
    public StatisticalDriftDetector(BaselineStore baselineStore,
                                    @Qualifier("monitorExecutor") ExecutorService monitorExecutor,
                                    @Value("${drift-engine.baseline.history-size:30}") int historySize,
                                    @Value("${drift-engine.dataset.column-threshold:0.1}") double datasetColumnThreshold) {
        super(monitorExecutor);
        if (historySize < 1) {
            throw new IllegalArgumentException("history size must be positive: " + historySize);
        }
        this.baselineStore = baselineStore;
        this.historySize = historySize;
        this.datasetColumnThreshold = datasetColumnThreshold;
    }

    @Override
    public boolean requiresReference() {
        return false;
    }

    @Override
    protected RunState openRun(DriftRunContext context, DatasetSnapshot current, DatasetSnapshot reference) {
        Optional<BaselineRecord> baseline = baselineStore.get(context.tenantId(), context.datasetId());
        if (baseline.isEmpty()) {
            log.info("No baseline for {}/{}; this run establishes it", context.tenantId(), context.datasetId());
        }
        return new RunState(baseline.orElse(null), current, Instant.now());
    }

    @Override
    protected DriftResult evaluateMonitor(RunState state, MonitorSpec monitor) {
        return switch (monitor.kind()) {
            case SCHEMA -> checkSchema(state, monitor);
            case VOLUME -> checkVolume(state, monitor);
            case DISTRIBUTION -> checkDistribution(state, monitor);
            case DATASET -> checkDataset(state, monitor);
        };
    }

    @Override
    protected void closeRun(DriftRunContext context, RunState state) {
        if (state.baseline != null && !state.volumeObserved.get() && state.newProfiles.isEmpty()) {
            return;
        }
        DatasetSnapshot current = state.current;
        baselineStore.compute(context.tenantId(), context.datasetId(), existing -> {
            if (existing.isEmpty()) {
                return BaselineRecord.establish(context.tenantId(), context.datasetId(), current, state.now);
            }
            BaselineRecord updated = existing.get();
            if (state.volumeObserved.get()) {
                updated = updated.withRowCountObserved(current.rowCount(), historySize, state.now);
            }
            if (!state.newProfiles.isEmpty()) {
                updated = updated.withProfiles(state.newProfiles.values(), state.now);
            }
            return updated;
        });
    }

    private DriftResult checkSchema(RunState state, MonitorSpec monitor) {
        if (state.baseline == null) {
            return DriftResult.baselineEstablished(monitor, 0.0,
                    Map.of("columns", state.current.columns().size()),
                    "Baseline established with " + state.current.columns().size() + " columns");
        }
        return MonitorChecks.schema(monitor, state.baseline.columnTypes(), state.current.columnTypes());
    }

    private DriftResult checkVolume(RunState state, MonitorSpec monitor) {
        long currentCount = state.current.rowCount();
        if (state.baseline == null) {
            return DriftResult.baselineEstablished(monitor, 0.0,
                    Map.of("current_row_count", currentCount),
                    "Baseline established with " + currentCount + " rows");
        }
        state.volumeObserved.set(true);

        List<Long> history = state.baseline.rowCountHistory();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("current_row_count", currentCount);
        details.put("baseline_row_count", state.baseline.rowCount());
        details.put("history_size", history.size());

        double score;
        if (history.size() >= 2) {
            score = DriftStatistics.zscore(currentCount, history);
            details.put("method", "zscore");
        } else {
            long previous = history.isEmpty() ? state.baseline.rowCount() : history.get(history.size() - 1);
            double percentChange = percentChange(previous, currentCount);
            details.put("percent_change", percentChange);
            details.put("method", "percent_change");
            score = percentChange / 10.0;
        }
        return MonitorChecks.volume(monitor, score, details);
    }

    private DriftResult checkDistribution(RunState state, MonitorSpec monitor) {
        String column = monitor.column();
        Optional<ColumnProfile> profile = state.baseline == null
                ? Optional.empty()
                : state.baseline.profile(column);
        if (profile.isPresent()) {
            return MonitorChecks.column(monitor, MonitorChecks.ColumnSample.of(profile.get()), state.current);
        }
        if (!state.current.hasColumn(column)) {
            return DriftResult.error(monitor, "Column " + column + " not found in current data");
        }
        if (state.baseline != null) {
            state.newProfiles.putIfAbsent(column, ColumnProfile.fromSnapshot(state.current, column, state.now));
        }
        return DriftResult.baselineEstablished(monitor, 0.0,
                Map.of("column", column, "sample_size", state.current.rowCount()),
                "Baseline established for column " + column);
    }

    private DriftResult checkDataset(RunState state, MonitorSpec monitor) {
        if (state.baseline == null) {
            return DriftResult.baselineEstablished(monitor, 0.0,
                    Map.of("columns", state.current.columns().size()),
                    "Baseline established for dataset-level drift");
        }
        Map<String, MonitorChecks.ColumnSample> samples = new LinkedHashMap<>();
        state.baseline.columnProfiles().forEach((column, profile) ->
                samples.put(column, MonitorChecks.ColumnSample.of(profile)));
        return MonitorChecks.dataset(monitor, samples, state.current, datasetColumnThreshold);
    }

    static double percentChange(long previous, long current) {
        if (previous == 0) {
            return current > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return (current - previous) * 100.0 / previous;
    }

    static final class RunState {
        private final BaselineRecord baseline;
        private final DatasetSnapshot current;
        private final Instant now;
        private final AtomicBoolean volumeObserved = new AtomicBoolean();
        private final Map<String, ColumnProfile> newProfiles = new ConcurrentHashMap<>();

        RunState(BaselineRecord baseline, DatasetSnapshot current, Instant now) {
            this.baseline = baseline;
            this.current = current;
            this.now = now;
        }
    }
}
