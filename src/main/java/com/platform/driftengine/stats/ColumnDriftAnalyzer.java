package com.platform.driftengine.stats;

import com.platform.driftengine.domain.StatTest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one {@link StatTest} over a baseline and a current column sample.
 */
public final class ColumnDriftAnalyzer {

    private ColumnDriftAnalyzer() {}

    /**
     * @param numeric whether the column holds numbers; required by ks, z and wasserstein
     * @throws IllegalArgumentException when the test cannot run on these samples
     */
    public static ColumnOutcome compare(StatTest test, List<?> baseline, List<?> current, boolean numeric) {
        if (test.numericOnly() && !numeric) {
            throw new IllegalArgumentException("Stat test '" + test.configName() + "' requires a numeric column");
        }

        FrequencyTables.Pair tables = FrequencyTables.pair(baseline, current, numeric);
        int baselineUnique = tables.baseline().size();
        int currentUnique = tables.current().size();

        return switch (test) {
            case PSI -> distance(test, DriftStatistics.psi(tables.baseline(), tables.current()),
                    baselineUnique, currentUnique);
            case JENSENSHANNON -> distance(test, ColumnTests.jensenShannon(tables.baseline(), tables.current()),
                    baselineUnique, currentUnique);
            case KL_DIV -> distance(test, ColumnTests.klDivergence(tables.baseline(), tables.current()),
                    baselineUnique, currentUnique);
            case CHISQUARE -> {
                DriftStatistics.AssociationResult r =
                        DriftStatistics.categoricalAssociation(tables.baseline(), tables.current());
                yield new ColumnOutcome(test, r.statistic(), r.pValue(), r.level().label(),
                        baselineUnique, currentUnique);
            }
            case KS -> {
                ColumnTests.Outcome r = ColumnTests.ks(FrequencyTables.toDoubles(baseline),
                        FrequencyTables.toDoubles(current));
                yield new ColumnOutcome(test, r.statistic(), r.pValue(), null, baselineUnique, currentUnique);
            }
            case Z -> {
                ColumnTests.Outcome r = ColumnTests.zTest(FrequencyTables.toDoubles(baseline),
                        FrequencyTables.toDoubles(current));
                yield new ColumnOutcome(test, r.statistic(), r.pValue(), null, baselineUnique, currentUnique);
            }
            case WASSERSTEIN -> distance(test, ColumnTests.wasserstein(FrequencyTables.toDoubles(baseline),
                    FrequencyTables.toDoubles(current)), baselineUnique, currentUnique);
        };
    }

    private static ColumnOutcome distance(StatTest test, double value, int baselineUnique, int currentUnique) {
        return new ColumnOutcome(test, value, null, null, baselineUnique, currentUnique);
    }

    /**
     * @param pValue null for distance tests
     * @param label  qualitative reading, only for chisquare
     */
    public record ColumnOutcome(
            StatTest test,
            double statistic,
            Double pValue,
            String label,
            int baselineUniqueValues,
            int currentUniqueValues
    ) {
        /** The value compared against the monitor threshold. */
        public double metric() {
            return test.interpretation() == StatTest.Interpretation.P_VALUE ? pValue : statistic;
        }

        public boolean drifted(double threshold) {
            return test.drifted(metric(), threshold);
        }

        public Map<String, Object> toDetails() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("stat_test", test.configName());
            details.put("statistic", statistic);
            if (pValue != null) details.put("p_value", pValue);
            if (test == StatTest.PSI) details.put("psi", statistic);
            if (label != null) details.put("interpretation", label);
            details.put("baseline_unique_values", baselineUniqueValues);
            details.put("current_unique_values", currentUniqueValues);
            return details;
        }
    }
}
