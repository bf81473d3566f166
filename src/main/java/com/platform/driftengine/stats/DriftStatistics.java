package com.platform.driftengine.stats;

import java.util.*;

/**
 * Core drift statistics: PSI, categorical association, z-score and schema diff.
 * <p>
 * Pure functions over value-to-count maps and column-to-type maps.
 */
public final class DriftStatistics {

    /** Added to every proportion so empty categories never produce log(0). */
    public static final double EPSILON = 1e-4;

    private DriftStatistics() {}

    // ------------------------------------------------------------------
    // Population Stability Index
    // ------------------------------------------------------------------

    /**
     * PSI over two discrete distributions. Either side empty yields 0.
     * <p>
     * Interpretation: below 0.1 no significant change, 0.1-0.25 moderate,
     * 0.25 and above significant.
     */
    public static double psi(Map<String, ? extends Number> baseline, Map<String, ? extends Number> current) {
        if (baseline.isEmpty() || current.isEmpty()) {
            return 0.0;
        }
        Set<String> values = new LinkedHashSet<>(baseline.keySet());
        values.addAll(current.keySet());

        double baselineTotal = total(baseline);
        double currentTotal = total(current);
        if (baselineTotal == 0) baselineTotal = 1;
        if (currentTotal == 0) currentTotal = 1;

        double psi = 0.0;
        for (String value : values) {
            double b = count(baseline, value) / baselineTotal + EPSILON;
            double c = count(current, value) / currentTotal + EPSILON;
            psi += (c - b) * Math.log(c / b);
        }
        return Math.abs(psi);
    }

    // ------------------------------------------------------------------
    // Categorical association (approximate chi-square)
    // ------------------------------------------------------------------

    /**
     * Chi-square style statistic of current counts against the counts the
     * baseline shares predict.
     * <p>
     * The p-value is not read from a chi-square CDF. It comes from two
     * critical-value bands that grow linearly with the degrees of freedom
     * (3.84 / 6.63 at df=1), so only 0.1, 0.05 and 0.01 are ever returned.
     */
    public static AssociationResult categoricalAssociation(Map<String, ? extends Number> baseline,
                                                           Map<String, ? extends Number> current) {
        Set<String> categories = new LinkedHashSet<>(baseline.keySet());
        categories.addAll(current.keySet());

        if (categories.size() < 2) {
            return new AssociationResult(0.0, 1.0, 0, AssociationLevel.INSUFFICIENT_CATEGORIES);
        }

        double baselineTotal = total(baseline);
        double currentTotal = total(current);
        if (baselineTotal == 0 || currentTotal == 0) {
            return new AssociationResult(0.0, 1.0, categories.size() - 1, AssociationLevel.INSUFFICIENT_DATA);
        }

        double chiSquare = 0.0;
        for (String category : categories) {
            double expected = (count(baseline, category) / baselineTotal) * currentTotal;
            if (expected > 0) {
                double diff = count(current, category) - expected;
                chiSquare += diff * diff / expected;
            }
        }

        int df = categories.size() - 1;
        double critical05 = 3.84 + (df - 1) * 2.0;
        double critical01 = 6.63 + (df - 1) * 2.5;

        if (chiSquare < critical05) {
            return new AssociationResult(chiSquare, 0.1, df, AssociationLevel.NO_SIGNIFICANT_CHANGE);
        } else if (chiSquare < critical01) {
            return new AssociationResult(chiSquare, 0.05, df, AssociationLevel.MODERATE_CHANGE);
        }
        return new AssociationResult(chiSquare, 0.01, df, AssociationLevel.SIGNIFICANT_CHANGE);
    }

    // ------------------------------------------------------------------
    // Z-score
    // ------------------------------------------------------------------

    /**
     * Z-score of {@code value} against {@code history} (sample stdev, n-1).
     * <p>
     * With a single historical point the relative difference times 3 stands in
     * for a z-score. A zero stdev gives 0 when the value equals the mean and
     * signed infinity otherwise.
     */
    public static double zscore(double value, List<? extends Number> history) {
        if (history.isEmpty()) {
            return 0.0;
        }
        int n = history.size();
        double mean = 0.0;
        for (Number h : history) {
            mean += h.doubleValue();
        }
        mean /= n;

        if (n < 2) {
            if (mean == 0) {
                return value == 0 ? 0.0 : Double.POSITIVE_INFINITY;
            }
            return Math.abs(value - mean) / mean * 3;
        }

        double sumSq = 0.0;
        for (Number h : history) {
            double d = h.doubleValue() - mean;
            sumSq += d * d;
        }
        double std = Math.sqrt(sumSq / (n - 1));

        if (std == 0) {
            if (value == mean) {
                return 0.0;
            }
            return value > mean ? Double.POSITIVE_INFINITY : Double.NEGATIVE_INFINITY;
        }
        return (value - mean) / std;
    }

    // ------------------------------------------------------------------
    // Schema diff
    // ------------------------------------------------------------------

    /**
     * Columns added (in current order), removed (in baseline order) and
     * retyped ({@code "col: old -> new"}, in baseline order).
     */
    public static SchemaDiff schemaDiff(Map<String, String> baseline, Map<String, String> current) {
        List<String> added = new ArrayList<>();
        for (String column : current.keySet()) {
            if (!baseline.containsKey(column)) {
                added.add(column);
            }
        }

        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        for (Map.Entry<String, String> entry : baseline.entrySet()) {
            String column = entry.getKey();
            if (!current.containsKey(column)) {
                removed.add(column);
            } else if (!Objects.equals(entry.getValue(), current.get(column))) {
                modified.add(column + ": " + entry.getValue() + " -> " + current.get(column));
            }
        }
        return new SchemaDiff(added, removed, modified);
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static double total(Map<String, ? extends Number> counts) {
        double total = 0.0;
        for (Number n : counts.values()) {
            total += n.doubleValue();
        }
        return total;
    }

    static double count(Map<String, ? extends Number> counts, String key) {
        Number n = counts.get(key);
        return n == null ? 0.0 : n.doubleValue();
    }

    // Result types

    public enum AssociationLevel {
        NO_SIGNIFICANT_CHANGE, MODERATE_CHANGE, SIGNIFICANT_CHANGE,
        INSUFFICIENT_CATEGORIES, INSUFFICIENT_DATA;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public record AssociationResult(
            double statistic,
            double pValue,
            int degreesOfFreedom,
            AssociationLevel level
    ) {}

    public record SchemaDiff(
            List<String> added,
            List<String> removed,
            List<String> modified
    ) {
        public SchemaDiff {
            added = List.copyOf(added);
            removed = List.copyOf(removed);
            modified = List.copyOf(modified);
        }

        public boolean hasChanges() {
            return !added.isEmpty() || !removed.isEmpty() || !modified.isEmpty();
        }

        public int changeCount() {
            return added.size() + removed.size() + modified.size();
        }
    }
}
