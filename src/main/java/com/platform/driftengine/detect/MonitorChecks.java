package com.platform.driftengine.detect;

import com.platform.driftengine.domain.*;
import com.platform.driftengine.exception.MonitorEvaluationException;
import com.platform.driftengine.stats.ColumnDriftAnalyzer;
import com.platform.driftengine.stats.DriftStatistics;
import com.platform.driftengine.stats.FrequencyTables;

import java.util.*;

/**
 * Comparisons shared by both detector variants. Each takes the baseline side
 * in whatever form the variant holds it.
 */
final class MonitorChecks {

    static final StatTest DEFAULT_COLUMN_TEST = StatTest.PSI;

    private MonitorChecks() {}

    /**
     * Baseline values of one column plus whether they are numeric.
     */
    record ColumnSample(List<Object> values, boolean numeric) {

        static ColumnSample of(ColumnProfile profile) {
            return new ColumnSample(profile.values(), profile.numeric());
        }

        static ColumnSample of(DatasetSnapshot snapshot, String column) {
            return new ColumnSample(snapshot.columnValues(column), snapshot.isNumeric(column));
        }
    }

    static DriftResult schema(MonitorSpec monitor, Map<String, String> baselineTypes,
                              Map<String, String> currentTypes) {
        DriftStatistics.SchemaDiff diff = DriftStatistics.schemaDiff(baselineTypes, currentTypes);
        int changes = diff.changeCount();
        boolean detected = changes > monitor.threshold();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("added", diff.added());
        details.put("removed", diff.removed());
        details.put("modified", diff.modified());
        details.put("change_count", changes);

        String message = diff.hasChanges()
                ? String.format("Schema changed: %d added, %d removed, %d modified",
                        diff.added().size(), diff.removed().size(), diff.modified().size())
                : "No schema changes";
        return new DriftResult(monitor.name(), MonitorKind.SCHEMA, detected,
                detected ? Severity.CRITICAL : Severity.INFO,
                (double) changes, monitor.threshold(), details, message);
    }

    /**
     * @param score z-score or its approximation; drift when {@code |score| > threshold}
     */
    static DriftResult volume(MonitorSpec monitor, double score, Map<String, Object> details) {
        boolean detected = Math.abs(score) > monitor.threshold();
        long current = ((Number) details.getOrDefault("current_row_count", 0L)).longValue();
        String message = detected
                ? String.format("Row count %d deviates from baseline (score %.2f)", current, score)
                : String.format("Row count %d within expected range", current);
        return new DriftResult(monitor.name(), MonitorKind.VOLUME, detected,
                detected ? Severity.WARNING : Severity.INFO,
                score, monitor.threshold(), details, message);
    }

    static DriftResult column(MonitorSpec monitor, ColumnSample baseline, DatasetSnapshot current) {
        String column = monitor.column();
        if (!current.hasColumn(column)) {
            throw new MonitorEvaluationException(monitor.name(), "Column " + column + " not found in current data");
        }
        StatTest test = monitor.statTest() != null ? monitor.statTest() : DEFAULT_COLUMN_TEST;
        ColumnDriftAnalyzer.ColumnOutcome outcome = ColumnDriftAnalyzer.compare(test, baseline.values(),
                current.columnValues(column), baseline.numeric() && current.isNumeric(column));
        boolean detected = outcome.drifted(monitor.threshold());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("column", column);
        details.putAll(outcome.toDetails());

        String message = detected
                ? String.format("Distribution drift in %s: %s=%.4f", column, test.configName(), outcome.metric())
                : String.format("No significant drift in %s", column);
        return new DriftResult(monitor.name(), MonitorKind.DISTRIBUTION, detected,
                detected ? Severity.WARNING : Severity.INFO,
                outcome.metric(), monitor.threshold(), details, message);
    }

    /**
     * Share of columns present on both sides whose PSI exceeds {@code columnThreshold}.
     */
    static DriftResult dataset(MonitorSpec monitor, Map<String, ColumnSample> baseline,
                               DatasetSnapshot current, double columnThreshold) {
        List<String> drifted = new ArrayList<>();
        Map<String, Double> columnPsi = new LinkedHashMap<>();
        for (String column : current.columns()) {
            ColumnSample sample = baseline.get(column);
            if (sample == null) continue;
            FrequencyTables.Pair tables = FrequencyTables.pair(sample.values(), current.columnValues(column),
                    sample.numeric() && current.isNumeric(column));
            double psi = DriftStatistics.psi(tables.baseline(), tables.current());
            columnPsi.put(column, psi);
            if (psi > columnThreshold) {
                drifted.add(column);
            }
        }
        int shared = columnPsi.size();
        double share = shared == 0 ? 0.0 : (double) drifted.size() / shared;
        boolean detected = share >= monitor.threshold();

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("shared_columns", shared);
        details.put("drifted_columns", drifted);
        details.put("drift_share", share);
        details.put("column_threshold", columnThreshold);
        details.put("column_psi", columnPsi);

        String message = String.format("%d of %d columns drifted (%.0f%%)", drifted.size(), shared, share * 100);
        return new DriftResult(monitor.name(), MonitorKind.DATASET, detected,
                detected ? Severity.CRITICAL : Severity.INFO,
                share, monitor.threshold(), details, message);
    }

    static DriftResult withDetail(DriftResult result, String key, Object value) {
        Map<String, Object> details = new LinkedHashMap<>(result.details());
        details.put(key, value);
        return new DriftResult(result.monitorName(), result.driftType(), result.detected(), result.severity(),
                result.metricValue(), result.threshold(), details, result.message());
    }
}
