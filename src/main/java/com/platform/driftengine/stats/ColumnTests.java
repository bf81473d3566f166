package com.platform.driftengine.stats;

import java.util.*;

/**
 * Two-sample column tests beyond PSI: Kolmogorov-Smirnov, z-test on means,
 * Wasserstein, Jensen-Shannon and KL divergence.
 * <p>
 * p-values use asymptotic approximations, not exact distributions.
 */
public final class ColumnTests {

    private ColumnTests() {}

    /**
     * Two-sample KS statistic with the asymptotic Kolmogorov p-value.
     */
    public static Outcome ks(double[] baseline, double[] current) {
        requireSamples(baseline, current, 1);
        double[] a = baseline.clone();
        double[] b = current.clone();
        Arrays.sort(a);
        Arrays.sort(b);

        int i = 0, j = 0;
        double d = 0.0;
        while (i < a.length && j < b.length) {
            double x = Math.min(a[i], b[j]);
            while (i < a.length && a[i] <= x) i++;
            while (j < b.length && b[j] <= x) j++;
            double diff = Math.abs((double) i / a.length - (double) j / b.length);
            d = Math.max(d, diff);
        }

        double en = Math.sqrt((double) a.length * b.length / (a.length + b.length));
        double p = kolmogorovSurvival((en + 0.12 + 0.11 / en) * d);
        return new Outcome(d, p);
    }

    /**
     * Q_KS(lambda) = 2 * sum_{j>=1} (-1)^(j-1) exp(-2 j^2 lambda^2); 1 when the series does not settle.
     */
    static double kolmogorovSurvival(double lambda) {
        double a2 = -2.0 * lambda * lambda;
        double fac = 2.0;
        double sum = 0.0;
        double previous = 0.0;
        for (int j = 1; j <= 100; j++) {
            double term = fac * Math.exp(a2 * j * j);
            sum += term;
            if (Math.abs(term) <= 0.001 * previous || Math.abs(term) <= 1.0e-8 * sum) {
                return Math.max(0.0, Math.min(1.0, sum));
            }
            fac = -fac;
            previous = Math.abs(term);
        }
        return 1.0;
    }

    /**
     * Two-sample z-test on means with a two-sided normal p-value.
     */
    public static Outcome zTest(double[] baseline, double[] current) {
        requireSamples(baseline, current, 2);
        double mb = mean(baseline);
        double mc = mean(current);
        double se = Math.sqrt(variance(baseline, mb) / baseline.length + variance(current, mc) / current.length);
        double z;
        if (se == 0) {
            z = mb == mc ? 0.0 : Double.POSITIVE_INFINITY;
        } else {
            z = (mc - mb) / se;
        }
        double p = Double.isInfinite(z) ? 0.0 : erfc(Math.abs(z) / Math.sqrt(2.0));
        return new Outcome(z, p);
    }

    /**
     * 1-D Wasserstein distance divided by the baseline's standard deviation
     * (floored at 0.001).
     */
    public static double wasserstein(double[] baseline, double[] current) {
        requireSamples(baseline, current, 1);
        double[] a = baseline.clone();
        double[] b = current.clone();
        Arrays.sort(a);
        Arrays.sort(b);

        double[] all = new double[a.length + b.length];
        System.arraycopy(a, 0, all, 0, a.length);
        System.arraycopy(b, 0, all, a.length, b.length);
        Arrays.sort(all);

        double distance = 0.0;
        int i = 0, j = 0;
        for (int k = 0; k < all.length - 1; k++) {
            double x = all[k];
            while (i < a.length && a[i] <= x) i++;
            while (j < b.length && b[j] <= x) j++;
            double cdfDiff = Math.abs((double) i / a.length - (double) j / b.length);
            distance += cdfDiff * (all[k + 1] - x);
        }

        double mean = mean(a);
        double std = Math.sqrt(populationVariance(a, mean));
        return distance / Math.max(std, 0.001);
    }

    /**
     * Jensen-Shannon distance (square root of the divergence, natural log).
     * Either side empty yields 0.
     */
    public static double jensenShannon(Map<String, ? extends Number> baseline, Map<String, ? extends Number> current) {
        double bt = DriftStatistics.total(baseline);
        double ct = DriftStatistics.total(current);
        if (bt == 0 || ct == 0) {
            return 0.0;
        }
        Set<String> keys = new LinkedHashSet<>(baseline.keySet());
        keys.addAll(current.keySet());

        double divergence = 0.0;
        for (String key : keys) {
            double p = DriftStatistics.count(baseline, key) / bt;
            double q = DriftStatistics.count(current, key) / ct;
            double m = (p + q) / 2;
            if (p > 0) divergence += 0.5 * p * Math.log(p / m);
            if (q > 0) divergence += 0.5 * q * Math.log(q / m);
        }
        return Math.sqrt(Math.max(0.0, divergence));
    }

    /**
     * KL(baseline || current) with zero shares replaced by {@link DriftStatistics#EPSILON}.
     * Either side empty yields 0.
     */
    public static double klDivergence(Map<String, ? extends Number> baseline, Map<String, ? extends Number> current) {
        double bt = DriftStatistics.total(baseline);
        double ct = DriftStatistics.total(current);
        if (bt == 0 || ct == 0) {
            return 0.0;
        }
        Set<String> keys = new LinkedHashSet<>(baseline.keySet());
        keys.addAll(current.keySet());

        double kl = 0.0;
        for (String key : keys) {
            double p = DriftStatistics.count(baseline, key) / bt;
            double q = DriftStatistics.count(current, key) / ct;
            if (p == 0) p = DriftStatistics.EPSILON;
            if (q == 0) q = DriftStatistics.EPSILON;
            kl += p * Math.log(p / q);
        }
        return kl;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Complementary error function, fractional error below 1.2e-7.
     */
    static double erfc(double x) {
        double z = Math.abs(x);
        double t = 1.0 / (1.0 + 0.5 * z);
        double ans = t * Math.exp(-z * z - 1.26551223 + t * (1.00002368 + t * (0.37409196
                + t * (0.09678418 + t * (-0.18628806 + t * (0.27886807 + t * (-1.13520398
                + t * (1.48851587 + t * (-0.82215223 + t * 0.17087277)))))))));
        return x >= 0 ? ans : 2.0 - ans;
    }

    private static void requireSamples(double[] baseline, double[] current, int min) {
        if (baseline.length < min || current.length < min) {
            throw new IllegalArgumentException("Need at least " + min + " non-null value(s) per side, got "
                    + baseline.length + " baseline and " + current.length + " current");
        }
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static double variance(double[] values, double mean) {
        double sumSq = 0.0;
        for (double v : values) sumSq += (v - mean) * (v - mean);
        return sumSq / (values.length - 1);
    }

    private static double populationVariance(double[] values, double mean) {
        double sumSq = 0.0;
        for (double v : values) sumSq += (v - mean) * (v - mean);
        return sumSq / values.length;
    }

    public record Outcome(double statistic, double pValue) {}
}
