package com.platform.driftengine.detect;

import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.DataFetchException;
import com.platform.driftengine.exception.MonitorEvaluationException;
import com.platform.driftengine.monitor.ThresholdDefaults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Compares the current snapshot against the table as it was
 * {@code time_travel_days} ago. Stores nothing.
 * <p>
 * Every result carries {@code reference_fallback}: true when the fetcher could
 * not time travel and handed back the current data, in which case no drift can
 * be observed.
 */
@Component
@ConditionalOnProperty(name = "drift-engine.detector", havingValue = "reference")
public class ReferenceDriftDetector extends AbstractDriftDetector<ReferenceDriftDetector.RunState> {

    private static final Logger log = LoggerFactory.getLogger(ReferenceDriftDetector.class);

    /** Volume compares a change ratio here, not a z-score. */
    static final double DEFAULT_VOLUME_CHANGE_RATIO = 0.1;

    private static final ThresholdDefaults THRESHOLD_DEFAULTS = (kind, statTest) ->
            kind == MonitorKind.VOLUME
                    ? DEFAULT_VOLUME_CHANGE_RATIO
                    : ThresholdDefaults.STANDARD.thresholdFor(kind, statTest);

    private final double datasetColumnThreshold;

    @Autowired
    public ReferenceDriftDetector(@Qualifier("monitorExecutor") ExecutorService monitorExecutor,
                                  @Value("${drift-engine.dataset.column-threshold:0.1}") double datasetColumnThreshold) {
        super(monitorExecutor);
        this.datasetColumnThreshold = datasetColumnThreshold;
    }

    @Override
    public boolean requiresReference() {
        return true;
    }

    @Override
    public ThresholdDefaults thresholdDefaults() {
        return THRESHOLD_DEFAULTS;
    }

    @Override
    protected RunState openRun(DriftRunContext context, DatasetSnapshot current, DatasetSnapshot reference) {
        if (reference == null) {
            throw new DataFetchException(context.table(), context.timeTravelDays(),
                    "No reference snapshot for " + context.table());
        }
        boolean fallback = reference.source() == SnapshotSource.CURRENT_FALLBACK;
        if (fallback) {
            log.warn("Run {} compares {} against its current data; drift results are not meaningful",
                    context.run().getRunId(), context.table());
        }
        return new RunState(current, reference, fallback);
    }

    @Override
    protected DriftResult evaluateMonitor(RunState state, MonitorSpec monitor) {
        DatasetSnapshot current = state.current;
        DatasetSnapshot reference = state.reference;
        return switch (monitor.kind()) {
            case SCHEMA -> MonitorChecks.schema(monitor, reference.columnTypes(), current.columnTypes());
            case VOLUME -> checkVolume(monitor, reference.rowCount(), current.rowCount());
            case DISTRIBUTION -> {
                if (!reference.hasColumn(monitor.column())) {
                    throw new MonitorEvaluationException(monitor.name(),
                            "Column " + monitor.column() + " not found in reference data");
                }
                yield MonitorChecks.column(monitor,
                        MonitorChecks.ColumnSample.of(reference, monitor.column()), current);
            }
            case DATASET -> {
                Map<String, MonitorChecks.ColumnSample> samples = new LinkedHashMap<>();
                for (String column : reference.columns()) {
                    samples.put(column, MonitorChecks.ColumnSample.of(reference, column));
                }
                yield MonitorChecks.dataset(monitor, samples, current, datasetColumnThreshold);
            }
        };
    }

    @Override
    protected DriftResult decorate(RunState state, DriftResult result) {
        DriftResult flagged = MonitorChecks.withDetail(result, "reference_fallback", state.fallback);
        return MonitorChecks.withDetail(flagged, "reference_source", state.reference.source().label());
    }

    private DriftResult checkVolume(MonitorSpec monitor, long referenceCount, long currentCount) {
        double ratio = changeRatio(referenceCount, currentCount);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("current_row_count", currentCount);
        details.put("reference_row_count", referenceCount);
        details.put("change_ratio", ratio);
        return MonitorChecks.volume(monitor, ratio, details);
    }

    static double changeRatio(long reference, long current) {
        if (reference == 0) {
            return current > 0 ? Double.POSITIVE_INFINITY : 0.0;
        }
        return Math.abs(current - reference) / (double) reference;
    }

    static final class RunState {
        private final DatasetSnapshot current;
        private final DatasetSnapshot reference;
        private final boolean fallback;

        RunState(DatasetSnapshot current, DatasetSnapshot reference, boolean fallback) {
            this.current = current;
            this.reference = reference;
            this.fallback = fallback;
        }
    }
}
