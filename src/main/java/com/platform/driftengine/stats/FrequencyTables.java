package com.platform.driftengine.stats;

import java.util.*;

/**
 * Turns raw column samples into value-to-count tables for the frequency based tests.
 * <p>
 * Numeric columns with more distinct baseline values than {@link #MAX_BUCKETS}
 * are bucketed on baseline quantile edges, so both sides share the same bins.
 */
public final class FrequencyTables {

    public static final int MAX_BUCKETS = 10;

    private FrequencyTables() {}

    /**
     * Counts by {@code String.valueOf(value)}; nulls are skipped.
     */
    public static Map<String, Long> categorical(List<?> values) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object v : values) {
            if (v != null) {
                counts.merge(String.valueOf(v), 1L, Long::sum);
            }
        }
        return counts;
    }

    /**
     * Paired baseline/current tables. Numeric samples are bucketed on the
     * baseline's quantiles, or counted by exact value when the baseline has
     * few distinct values.
     */
    public static Pair pair(List<?> baseline, List<?> current, boolean numeric) {
        if (!numeric) {
            return new Pair(categorical(baseline), categorical(current), List.of());
        }
        double[] base = toDoubles(baseline);
        double[] cur = toDoubles(current);

        long distinct = Arrays.stream(base).distinct().count();
        if (distinct <= MAX_BUCKETS) {
            return new Pair(exactCounts(base), exactCounts(cur), List.of());
        }

        List<Double> edges = quantileEdges(base, MAX_BUCKETS);
        return new Pair(bucketCounts(base, edges), bucketCounts(cur, edges), edges);
    }

    /**
     * Inner edges splitting {@code values} into {@code buckets} equal-frequency bins.
     */
    static List<Double> quantileEdges(double[] values, int buckets) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        TreeSet<Double> edges = new TreeSet<>();
        for (int i = 1; i < buckets; i++) {
            int idx = (int) Math.floor((double) i * sorted.length / buckets);
            edges.add(sorted[Math.min(idx, sorted.length - 1)]);
        }
        return new ArrayList<>(edges);
    }

    static Map<String, Long> bucketCounts(double[] values, List<Double> edges) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (int i = 0; i <= edges.size(); i++) {
            counts.put(bucketLabel(i, edges), 0L);
        }
        for (double v : values) {
            int bucket = 0;
            while (bucket < edges.size() && v >= edges.get(bucket)) {
                bucket++;
            }
            counts.merge(bucketLabel(bucket, edges), 1L, Long::sum);
        }
        return counts;
    }

    private static String bucketLabel(int bucket, List<Double> edges) {
        String lower = bucket == 0 ? "-inf" : String.valueOf(edges.get(bucket - 1));
        String upper = bucket == edges.size() ? "+inf" : String.valueOf(edges.get(bucket));
        return "[" + lower + ", " + upper + ")";
    }

    private static Map<String, Long> exactCounts(double[] values) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (double v : values) {
            counts.merge(String.valueOf(v), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Non-null values as doubles. Numeric strings are parsed.
     *
     * @throws IllegalArgumentException on a value that is not a number
     */
    public static double[] toDoubles(List<?> values) {
        double[] out = new double[values.size()];
        int n = 0;
        for (Object v : values) {
            if (v == null) continue;
            if (v instanceof Number number) {
                out[n++] = number.doubleValue();
            } else if (v instanceof Boolean b) {
                out[n++] = b ? 1.0 : 0.0;
            } else {
                try {
                    out[n++] = Double.parseDouble(v.toString().trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Non-numeric value '" + v + "'", e);
                }
            }
        }
        return Arrays.copyOf(out, n);
    }

    public record Pair(Map<String, Long> baseline, Map<String, Long> current, List<Double> bucketEdges) {}
}
